package ai.disksched.scheduler.policy;

public enum SchedulingMode {
    FIFO,
    SSTF,
    SCAN;

    public SchedulingPolicy policy() {
        return switch (this) {
            case FIFO -> new FifoPolicy();
            case SSTF -> new SstfPolicy();
            case SCAN -> new ScanPolicy();
        };
    }
}
