package ai.disksched.scheduler;

import ai.disksched.scheduler.config.DiskSchedulerConfig;
import ai.disksched.scheduler.policy.SchedulingMode;
import io.micronaut.context.ApplicationContext;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.rules.Timeout;

import java.nio.file.Files;
import java.time.Duration;
import java.util.Map;

public class DiskSchedulerAppTest {

    @Rule
    public Timeout globalTimeout = Timeout.seconds(60);

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void runWorkloadOnFileDevice() throws Exception {
        var path = folder.getRoot().toPath().resolve("app.img");
        Map<String, Object> properties = Map.of(
            "disk-scheduler.mode", "SSTF",
            "disk-scheduler.shutdown-timeout", "5s",
            "disk-scheduler.device.path", path.toString(),
            "disk-scheduler.device.block-count", 64,
            "disk-scheduler.device.block-size", 512,
            "workload.threads", 3,
            "workload.requests-per-thread", 20,
            "workload.seed", 7);

        try (var context = ApplicationContext.run(properties)) {
            var config = context.getBean(DiskSchedulerConfig.class);
            Assert.assertEquals(SchedulingMode.SSTF, config.getMode());
            Assert.assertEquals(Duration.ofSeconds(5), config.getShutdownTimeout());
            Assert.assertEquals(64, config.getDevice().getBlockCount());

            var scheduler = context.getBean(DiskScheduler.class);
            Assert.assertEquals(SchedulingMode.SSTF, scheduler.mode());
            Assert.assertEquals(64, scheduler.blockCount());
            Assert.assertEquals(512, scheduler.blockSize());

            var report = context.getBean(DiskSchedulerApp.class).run();
            Assert.assertEquals(60, report.requests());
            Assert.assertEquals(0, report.failures());
            Assert.assertEquals(60, scheduler.stats().serviced());
            Assert.assertEquals(60, scheduler.deviceStats().operations());
        }
        Assert.assertEquals(64L * 512, Files.size(path));
    }

    @Test
    public void defaultsToInMemoryDevice() {
        try (var context = ApplicationContext.run(Map.of("disk-scheduler.mode", "SCAN"))) {
            var scheduler = context.getBean(DiskScheduler.class);
            Assert.assertEquals(SchedulingMode.SCAN, scheduler.mode());
            Assert.assertEquals(1000, scheduler.blockCount());
            Assert.assertEquals(4096, scheduler.blockSize());
            Assert.assertTrue(scheduler.toString().contains("MemoryBlockDevice"));
        }
    }
}
