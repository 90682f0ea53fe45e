package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.IoRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Elevator order: the cursor sweeps one block at a time in its direction and reverses at
 * block {@code 0} and block {@code blockCount - 1}. The sweep continues from where the previous
 * selection left it.
 */
public class ScanPolicy implements SchedulingPolicy {
    private static final Logger LOG = LogManager.getLogger(ScanPolicy.class);

    @Override
    public int select(List<IoRequest> pending, SchedulerCursor cursor, int blockCount) {
        // two full sweeps visit every block in range from any starting point
        final long maxSteps = 2L * blockCount;

        for (long step = 0; step <= maxSteps; step++) {
            final int index = firstAt(pending, cursor.position());
            if (index >= 0) {
                return index;
            }
            advance(cursor, blockCount);
        }

        LOG.warn("No pending request within [0, {}), falling back to {}", blockCount, pending.get(0));
        return 0;
    }

    private static int firstAt(List<IoRequest> pending, int block) {
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).block() == block) {
                return i;
            }
        }
        return -1;
    }

    private static void advance(SchedulerCursor cursor, int blockCount) {
        int next = cursor.position() + cursor.direction();
        if (next > blockCount - 1) {
            next = blockCount - 1;
            cursor.setDirection(SchedulerCursor.DOWN);
        } else if (next < 0) {
            next = 0;
            cursor.setDirection(SchedulerCursor.UP);
        }
        cursor.moveTo(next);
    }

    @Override
    public String toString() {
        return "SCAN";
    }
}
