package ai.disksched.scheduler;

/**
 * Thrown to a requester when its request cannot be serviced because the scheduler was shut down
 * or its servicing loop died.
 */
public class DiskSchedulerStoppedException extends IllegalStateException {

    public DiskSchedulerStoppedException(String message) {
        super(message);
    }

    public DiskSchedulerStoppedException(String message, Throwable cause) {
        super(message, cause);
    }
}
