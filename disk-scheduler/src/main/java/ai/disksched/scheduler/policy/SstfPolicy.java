package ai.disksched.scheduler.policy;

import ai.disksched.scheduler.queue.IoRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Shortest seek time first: the pending request closest to the cursor wins.
 *
 * <p>Equal distances are resolved in favour of the block above the cursor ({@code position + r}
 * before {@code position - r}), then in favour of the earlier arrival. Requests outside the device
 * are never matched by distance; when nothing else is pending the oldest request is returned.
 */
public class SstfPolicy implements SchedulingPolicy {
    private static final Logger LOG = LogManager.getLogger(SstfPolicy.class);

    @Override
    public int select(List<IoRequest> pending, SchedulerCursor cursor, int blockCount) {
        final int position = cursor.position();

        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        boolean bestAbove = false;

        for (int i = 0; i < pending.size(); i++) {
            final int block = pending.get(i).block();
            if (!SchedulingPolicy.inRange(block, blockCount)) {
                continue;
            }
            final int distance = Math.abs(block - position);
            final boolean above = block >= position;
            if (distance < bestDistance || (distance == bestDistance && above && !bestAbove)) {
                best = i;
                bestDistance = distance;
                bestAbove = above;
            }
        }

        if (best < 0) {
            LOG.warn("No pending request within [0, {}), falling back to {}", blockCount, pending.get(0));
            return 0;
        }

        cursor.moveTo(pending.get(best).block());
        return best;
    }

    @Override
    public String toString() {
        return "SSTF";
    }
}
