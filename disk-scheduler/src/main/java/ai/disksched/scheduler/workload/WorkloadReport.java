package ai.disksched.scheduler.workload;

import java.time.Duration;

public record WorkloadReport(long reads, long writes, long failures, Duration elapsed) {

    public long requests() {
        return reads + writes;
    }
}
