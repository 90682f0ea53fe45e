package ai.disksched.scheduler.queue;

import ai.disksched.scheduler.DiskSchedulerStoppedException;
import ai.disksched.scheduler.policy.SchedulerCursor;
import ai.disksched.scheduler.policy.SchedulingPolicy;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands requests over from requester threads to the single servicing loop.
 *
 * <p>The queue and the cursor are touched only while holding {@link #lock}. The loop waits on
 * {@link #notEmpty}; every requester waits on the condition of its own request, so a completion
 * wakes exactly the thread that submitted it.
 */
public class RequestMonitor {
    private static final Logger LOG = LogManager.getLogger(RequestMonitor.class);

    private final String name;
    private final SchedulingPolicy policy;
    private final SchedulerCursor cursor;
    private final int blockCount;

    private final Lock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final RequestQueue queue = new RequestQueue();

    private boolean running = true;
    private long nextId = 0;

    public RequestMonitor(String name, SchedulingPolicy policy, SchedulerCursor cursor, int blockCount) {
        this.name = name;
        this.policy = policy;
        this.cursor = cursor;
        this.blockCount = blockCount;
    }

    /**
     * Enqueues the request and blocks until the servicing loop has completed it.
     * The wait cannot be abandoned; the interrupt status of the caller is preserved.
     *
     * @throws DiskSchedulerStoppedException if the monitor no longer accepts requests
     */
    public void submit(IoRequest request) {
        lock.lock();
        try {
            if (!running) {
                throw new DiskSchedulerStoppedException("Scheduler " + name + " is stopped");
            }
            request.enqueued(nextId++, lock.newCondition());
            queue.enqueue(request);
            LOG.debug("Scheduler {}: enqueued {}, {} pending", name, request, queue.size());
            notEmpty.signal();

            request.awaitCompletion();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for a pending request and removes the one chosen by the policy.
     *
     * @return the request to service, or {@code null} once the monitor is shut down and drained
     */
    @Nullable
    public IoRequest take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && running) {
                notEmpty.await();
            }
            if (queue.isEmpty()) {
                return null;
            }
            final IoRequest request = queue.selectAndRemove(policy, cursor, blockCount);
            LOG.debug("Scheduler {}: selected {}, cursor at {}", name, request, cursor);
            return request;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the request serviced and wakes its requester.
     */
    public void complete(IoRequest request, @Nullable Throwable failure) {
        lock.lock();
        try {
            request.complete(failure);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting new requests. Requests already queued are still handed out by {@link #take()}.
     */
    public void shutdown() {
        lock.lock();
        try {
            running = false;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting requests and completes every pending one with {@code cause}.
     *
     * @return number of failed requests
     */
    public int failPending(Throwable cause) {
        lock.lock();
        try {
            running = false;
            final List<IoRequest> pending = queue.drain();
            for (IoRequest request : pending) {
                request.complete(cause);
            }
            notEmpty.signalAll();
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    public int pending() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public long headMovement() {
        lock.lock();
        try {
            return cursor.headMovement();
        } finally {
            lock.unlock();
        }
    }
}
