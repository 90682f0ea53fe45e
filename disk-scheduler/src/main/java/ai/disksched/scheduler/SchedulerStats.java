package ai.disksched.scheduler;

/**
 * @param serviced     requests taken off the queue and handed to the device
 * @param failed       serviced requests the device reported a failure for
 * @param headMovement total distance in blocks the cursor travelled
 */
public record SchedulerStats(long serviced, long failed, long headMovement) { }
