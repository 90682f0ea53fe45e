package ai.disksched.scheduler.queue;

import ai.disksched.scheduler.policy.SchedulerCursor;
import ai.disksched.scheduler.policy.SchedulingPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pending requests in arrival order. Not thread-safe, guarded by the owning {@link RequestMonitor}.
 */
public class RequestQueue {
    private final List<IoRequest> requests = new ArrayList<>();
    private final List<IoRequest> view = Collections.unmodifiableList(requests);

    public void enqueue(IoRequest request) {
        requests.add(request);
    }

    /**
     * Removes the request chosen by {@code policy} and hands it over to the caller.
     */
    public IoRequest selectAndRemove(SchedulingPolicy policy, SchedulerCursor cursor, int blockCount) {
        if (requests.isEmpty()) {
            throw new IllegalStateException("Cannot select from an empty queue");
        }
        final int index = policy.select(view, cursor, blockCount);
        if (index < 0 || index >= requests.size()) {
            throw new IllegalStateException("Policy " + policy + " selected position " + index
                + " of " + requests.size() + " pending requests");
        }
        return requests.remove(index);
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public int size() {
        return requests.size();
    }

    List<IoRequest> drain() {
        final List<IoRequest> drained = new ArrayList<>(requests);
        requests.clear();
        return drained;
    }
}
