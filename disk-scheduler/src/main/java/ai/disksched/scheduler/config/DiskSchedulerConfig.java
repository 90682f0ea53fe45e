package ai.disksched.scheduler.config;

import ai.disksched.scheduler.policy.SchedulingMode;
import io.micronaut.context.annotation.ConfigurationBuilder;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;

@Getter
@Setter
@ToString
@ConfigurationProperties("disk-scheduler")
public class DiskSchedulerConfig {
    private SchedulingMode mode = SchedulingMode.FIFO;
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    @ConfigurationBuilder("device")
    private DeviceConfiguration device = new DeviceConfiguration();
}
