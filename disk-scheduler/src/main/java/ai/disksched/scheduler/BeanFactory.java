package ai.disksched.scheduler;

import ai.disksched.device.BlockDevice;
import ai.disksched.device.FileBlockDevice;
import ai.disksched.device.MemoryBlockDevice;
import ai.disksched.scheduler.config.DeviceConfiguration;
import ai.disksched.scheduler.config.DiskSchedulerConfig;
import com.google.common.base.Strings;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

@Factory
public class BeanFactory {
    private static final Logger LOG = LogManager.getLogger(BeanFactory.class);

    @Singleton
    @Bean(preDestroy = "close")
    public DiskScheduler diskScheduler(DiskSchedulerConfig config) throws IOException {
        LOG.info("Creating disk scheduler with config: {}", config);
        final BlockDevice device = openDevice(config.getDevice());
        return new DiskScheduler(device, config.getMode(), config.getShutdownTimeout()).start();
    }

    private static BlockDevice openDevice(DeviceConfiguration config) throws IOException {
        if (Strings.isNullOrEmpty(config.getPath())) {
            return new MemoryBlockDevice("memory", config.getBlockCount(), config.getBlockSize());
        }
        return FileBlockDevice.createOrOpen(Path.of(config.getPath()), config.getBlockCount(), config.getBlockSize());
    }
}
