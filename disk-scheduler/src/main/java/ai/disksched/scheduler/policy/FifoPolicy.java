package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.IoRequest;

import java.util.List;

/**
 * Services requests in arrival order.
 */
public class FifoPolicy implements SchedulingPolicy {

    @Override
    public int select(List<IoRequest> pending, SchedulerCursor cursor, int blockCount) {
        final int block = pending.get(0).block();
        if (SchedulingPolicy.inRange(block, blockCount)) {
            cursor.moveTo(block);
        }
        return 0;
    }

    @Override
    public String toString() {
        return "FIFO";
    }
}
