package ai.disksched.scheduler;

import ai.disksched.scheduler.workload.WorkloadGenerator;
import ai.disksched.scheduler.workload.WorkloadReport;
import io.micronaut.runtime.Micronaut;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

@Singleton
public class DiskSchedulerApp {
    private static final Logger LOG = LogManager.getLogger(DiskSchedulerApp.class);

    private final DiskScheduler scheduler;
    private final WorkloadGenerator workload;

    public DiskSchedulerApp(DiskScheduler scheduler, WorkloadGenerator workload) {
        this.scheduler = scheduler;
        this.workload = workload;
    }

    public WorkloadReport run() throws InterruptedException {
        final WorkloadReport report = workload.run();
        LOG.info("Workload finished in {} ms: {} reads, {} writes, {} failures",
            report.elapsed().toMillis(), report.reads(), report.writes(), report.failures());

        final SchedulerStats stats = scheduler.stats();
        LOG.info("{} scheduler: {} requests serviced, {} failed, head moved {} blocks",
            scheduler.mode(), stats.serviced(), stats.failed(), stats.headMovement());
        LOG.info("Device: {} block reads, {} block writes",
            scheduler.deviceStats().reads(), scheduler.deviceStats().writes());
        return report;
    }

    public static void main(String[] args) throws InterruptedException {
        try (var context = Micronaut.run(DiskSchedulerApp.class, args)) {
            context.getBean(DiskSchedulerApp.class).run();
        }
    }
}
