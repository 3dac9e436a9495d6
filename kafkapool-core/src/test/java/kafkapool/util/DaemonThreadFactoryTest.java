package kafkapool.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void threadsAreDaemonsNumberedFromOne() {
        DaemonThreadFactory factory = new DaemonThreadFactory("ktp-worker-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertTrue(first.isDaemon());
        assertEquals("ktp-worker-1", first.getName());
        assertEquals("ktp-worker-2", second.getName());
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
    }
}
