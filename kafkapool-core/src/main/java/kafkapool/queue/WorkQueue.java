package kafkapool.queue;

import kafkapool.PublishMessage;
import kafkapool.spi.MetricsExporter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unbounded FIFO of pending messages shared by the publisher facade and every worker.
 *
 * <p>All access goes through a single {@link ReentrantLock}. The lock is held only for the
 * in-memory append or removal, never across publish I/O or sleeps. If a holder fails inside
 * the critical section the queue is marked <em>poisoned</em>: later {@link #enqueue} calls
 * fail with {@link LockFailureException} and later drains return an empty list.
 *
 * <p>This class is thread-safe.
 */
public final class WorkQueue {
  private static final Logger logger = Logger.getLogger(WorkQueue.class.getName());

  /** Maximum number of messages a worker takes per drain. */
  public static final int DEFAULT_BATCH_SIZE = 10;

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<PublishMessage> pending;
  private final MetricsExporter metrics;
  private boolean poisoned;

  public WorkQueue() {
    this(MetricsExporter.NOOP);
  }

  public WorkQueue(MetricsExporter metrics) {
    this(new ArrayDeque<>(), metrics);
  }

  WorkQueue(Deque<PublishMessage> storage, MetricsExporter metrics) {
    this.pending = Objects.requireNonNull(storage, "storage");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Appends all messages in order.
   *
   * @param messages messages to append; must not be empty or contain {@code null}
   * @return the queue length after the append
   * @throws EmptyBatchException  if {@code messages} is empty
   * @throws LockFailureException if the lock cannot be acquired or the queue is poisoned
   */
  public int enqueue(List<PublishMessage> messages) throws WorkQueueException {
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) {
      EmptyBatchException e = new EmptyBatchException();
      logger.severe(e.getMessage());
      throw e;
    }
    List<PublishMessage> batch = List.copyOf(messages);

    try {
      acquire();
    } catch (LockFailureException e) {
      logger.log(Level.SEVERE, "failed to get lock on work queue", e);
      throw e;
    }
    int size;
    try {
      if (poisoned) {
        LockFailureException e = poisonedFailure();
        logger.severe(e.getMessage());
        throw e;
      }
      try {
        for (PublishMessage message : batch) {
          pending.addLast(message);
        }
      } catch (RuntimeException | Error e) {
        poisoned = true;
        throw e;
      }
      size = pending.size();
    } finally {
      lock.unlock();
    }
    metrics.incrementEnqueued(batch.size());
    metrics.recordQueueDepth(size);
    return size;
  }

  /**
   * Removes up to {@link #DEFAULT_BATCH_SIZE} messages from the front.
   *
   * @return drained messages in queue order, empty if there is nothing to do
   */
  public List<PublishMessage> drain() {
    return drain(DEFAULT_BATCH_SIZE);
  }

  /**
   * Removes up to {@code maxBatch} messages from the front.
   *
   * <p>A lock failure is logged and reported as an empty list; callers treat empty as
   * "nothing to do".
   *
   * @param maxBatch upper bound on the number of messages returned
   * @return drained messages in queue order
   * @throws IllegalArgumentException if {@code maxBatch < 1}
   */
  public List<PublishMessage> drain(int maxBatch) {
    if (maxBatch < 1) {
      throw new IllegalArgumentException("maxBatch must be >= 1, got: " + maxBatch);
    }
    return drainUpTo(maxBatch);
  }

  /**
   * Removes every pending message.
   *
   * @return all drained messages in queue order
   */
  public List<PublishMessage> drainAll() {
    return drainUpTo(Integer.MAX_VALUE);
  }

  private List<PublishMessage> drainUpTo(int maxBatch) {
    try {
      acquire();
    } catch (LockFailureException e) {
      logger.log(Level.SEVERE, "failed to get lock on work queue", e);
      return List.of();
    }
    List<PublishMessage> drained;
    int size;
    try {
      if (poisoned) {
        logger.log(Level.SEVERE, "failed to get lock on work queue", poisonedFailure());
        return List.of();
      }
      int count = Math.min(maxBatch, pending.size());
      drained = new ArrayList<>(count);
      try {
        for (int i = 0; i < count; i++) {
          drained.add(pending.pollFirst());
        }
      } catch (RuntimeException | Error e) {
        poisoned = true;
        throw e;
      }
      size = pending.size();
    } finally {
      lock.unlock();
    }
    if (!drained.isEmpty()) {
      metrics.recordQueueDepth(size);
    }
    return drained;
  }

  /**
   * @return number of pending messages, or {@code 0} if the lock cannot be used
   */
  public int size() {
    try {
      acquire();
    } catch (LockFailureException e) {
      logger.log(Level.SEVERE, "failed to get lock on work queue", e);
      return 0;
    }
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return {@code true} if an earlier holder failed inside the critical section
   */
  public boolean isPoisoned() {
    lock.lock();
    try {
      return poisoned;
    } finally {
      lock.unlock();
    }
  }

  private void acquire() throws LockFailureException {
    try {
      lock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockFailureException("interrupted while waiting for work queue lock", e);
    }
  }

  private static LockFailureException poisonedFailure() {
    return new LockFailureException("work queue lock poisoned by an earlier failure");
  }
}
