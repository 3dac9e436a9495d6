package kafkapool.benchmark;

import kafkapool.PublishMessage;
import kafkapool.queue.WorkQueue;
import kafkapool.queue.WorkQueueException;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures the shared queue under contention: producers append batches while workers drain them.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar WorkQueueBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class WorkQueueBenchmark {

    private WorkQueue queue;
    private List<PublishMessage> batch;

    @Param({"1", "10", "100"})
    private int batchSize;

    @Param({"100", "10000"})
    private int payloadSize;

    @Setup(Level.Trial)
    public void setup() {
        queue = new WorkQueue();
        String payload = "x".repeat(payloadSize);
        batch = new ArrayList<>(batchSize);
        for (int i = 0; i < batchSize; i++) {
            batch.add(PublishMessage.data("bench", "key-" + i, Map.of(), payload));
        }
    }

    @Benchmark
    @Threads(4)
    public int enqueue() throws WorkQueueException {
        int size = queue.enqueue(batch);
        if (size > 100_000) {
            queue.drainAll();
        }
        return size;
    }

    @Benchmark
    @Threads(4)
    public void enqueueThenDrain(Blackhole bh) throws WorkQueueException {
        queue.enqueue(batch);
        List<PublishMessage> drained;
        while (!(drained = queue.drain()).isEmpty()) {
            bh.consume(drained);
        }
    }
}
