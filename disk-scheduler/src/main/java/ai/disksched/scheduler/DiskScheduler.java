package ai.disksched.scheduler;

import ai.disksched.device.BlockDevice;
import ai.disksched.device.DeviceStats;
import ai.disksched.device.FileBlockDevice;
import ai.disksched.scheduler.policy.SchedulerCursor;
import ai.disksched.scheduler.policy.SchedulingMode;
import ai.disksched.scheduler.queue.IoRequest;
import ai.disksched.scheduler.queue.RequestMonitor;
import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serializes blocking reads and writes of many threads onto one device, in the order chosen by
 * the {@link SchedulingMode}.
 *
 * <pre>
 * try (var scheduler = DiskScheduler.open(path, 1000, SchedulingMode.SSTF)) {
 *     scheduler.write(17, data);
 * }
 * </pre>
 */
public class DiskScheduler implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(DiskScheduler.class);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final BlockDevice device;
    private final SchedulingMode mode;
    private final Duration shutdownTimeout;
    private final RequestMonitor monitor;
    private final DiskSchedulerLoop loop;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DiskScheduler(BlockDevice device, SchedulingMode mode) {
        this(device, mode, DEFAULT_SHUTDOWN_TIMEOUT);
    }

    public DiskScheduler(BlockDevice device, SchedulingMode mode, Duration shutdownTimeout) {
        this(device, mode, shutdownTimeout, new SchedulerCursor());
    }

    @VisibleForTesting
    DiskScheduler(BlockDevice device, SchedulingMode mode, Duration shutdownTimeout, SchedulerCursor cursor) {
        this.device = device;
        this.mode = mode;
        this.shutdownTimeout = shutdownTimeout;
        this.monitor = new RequestMonitor(device.toString(), mode.policy(), cursor, device.blockCount());
        this.loop = new DiskSchedulerLoop(device.toString(), monitor, device);
    }

    /**
     * Creates or opens a file-backed device and starts a scheduler on it.
     */
    public static DiskScheduler open(Path path, int blockCount, SchedulingMode mode) throws IOException {
        return new DiskScheduler(FileBlockDevice.createOrOpen(path, blockCount), mode).start();
    }

    public DiskScheduler start() {
        if (started.compareAndSet(false, true)) {
            LOG.info("Starting {} scheduler for {}", mode, device);
            loop.start();
        }
        return this;
    }

    public int blockCount() {
        return device.blockCount();
    }

    public int blockSize() {
        return device.blockSize();
    }

    public SchedulingMode mode() {
        return mode;
    }

    /**
     * Reads {@code block} into {@code data}, blocking until the request is serviced.
     *
     * @throws IOException                   if the device failed to read the block
     * @throws DiskSchedulerStoppedException if the scheduler is shut down
     */
    public void read(int block, byte[] data) throws IOException {
        submit(IoRequest.read(block, data));
    }

    /**
     * Writes {@code data} to {@code block}, blocking until the request is serviced.
     *
     * @throws IOException                   if the device failed to write the block
     * @throws DiskSchedulerStoppedException if the scheduler is shut down
     */
    public void write(int block, byte[] data) throws IOException {
        submit(IoRequest.write(block, data));
    }

    private void submit(IoRequest request) throws IOException {
        monitor.submit(request);

        final Throwable failure = request.failure();
        if (failure == null) {
            return;
        }
        if (failure instanceof DiskSchedulerStoppedException) {
            throw new DiskSchedulerStoppedException(request + " was not serviced", failure);
        }
        throw new IOException("Cannot " + request.kind().name().toLowerCase(Locale.ROOT) + " block " + request.block()
            + " of " + device, failure);
    }

    /**
     * Stops accepting requests. Already queued requests are still serviced.
     */
    public void shutdown() {
        LOG.info("Shutting down {} scheduler for {}", mode, device);
        monitor.shutdown();
        if (!started.get()) {
            final int failed = monitor.failPending(
                new DiskSchedulerStoppedException("Scheduler for " + device + " was never started"));
            if (failed > 0) {
                LOG.warn("Failed {} requests queued to never started scheduler for {}", failed, device);
            }
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!started.get()) {
            return true;
        }
        loop.join(Math.max(1, timeout.toMillis()));
        return !loop.isAlive();
    }

    public SchedulerStats stats() {
        return new SchedulerStats(loop.serviced(), loop.failed(), monitor.headMovement());
    }

    public DeviceStats deviceStats() {
        return device.stats();
    }

    @VisibleForTesting
    int pendingRequests() {
        return monitor.pending();
    }

    /**
     * Shuts down, waits for queued requests to drain and closes the device.
     */
    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown();
        try {
            if (!awaitTermination(shutdownTimeout)) {
                LOG.warn("Scheduler for {} did not stop in {}, failing pending requests", device, shutdownTimeout);
                monitor.failPending(new DiskSchedulerStoppedException("Scheduler for " + device + " is closed"));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            monitor.failPending(new DiskSchedulerStoppedException("Scheduler for " + device + " is closed"));
        }
        device.close();
        LOG.info("Scheduler for {} closed: {}", device, stats());
    }

    @Override
    public String toString() {
        return "DiskScheduler{" + mode + ", " + device + "}";
    }
}
