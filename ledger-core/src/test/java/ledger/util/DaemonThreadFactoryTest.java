package ledger.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

    @Test
    void createsNumberedDaemonThreads() {
        DaemonThreadFactory factory = new DaemonThreadFactory("ledger-test-");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertTrue(first.isDaemon());
        assertEquals("ledger-test-1", first.getName());
        assertEquals("ledger-test-2", second.getName());
        assertNotNull(first.getUncaughtExceptionHandler());
        assertNotSame(first.getThreadGroup(), first.getUncaughtExceptionHandler());
    }
}
