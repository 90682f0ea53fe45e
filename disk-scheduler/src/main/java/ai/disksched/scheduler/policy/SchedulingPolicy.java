package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.IoRequest;

import java.util.List;

public interface SchedulingPolicy {

    /**
     * Chooses the next request to service and updates the cursor.
     * Never blocks; called only with a non-empty list, under the scheduler lock.
     *
     * @param pending    pending requests in arrival order
     * @param blockCount number of blocks on the device
     * @return position in {@code pending} of the chosen request
     */
    int select(List<IoRequest> pending, SchedulerCursor cursor, int blockCount);

    static boolean inRange(int block, int blockCount) {
        return block >= 0 && block < blockCount;
    }
}
