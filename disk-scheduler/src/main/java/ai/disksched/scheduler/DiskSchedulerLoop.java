package ai.disksched.scheduler;

import ai.disksched.device.BlockDevice;
import ai.disksched.scheduler.queue.IoRequest;
import ai.disksched.scheduler.queue.RequestMonitor;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The only thread that touches the device. Takes requests from the monitor one at a time,
 * performs the I/O outside the lock and completes the request.
 */
public class DiskSchedulerLoop extends Thread {
    private static final Logger LOG = LogManager.getLogger(DiskSchedulerLoop.class);
    private static final ThreadGroup SCHEDULERS_TG = new ThreadGroup("disk-schedulers");

    private final RequestMonitor monitor;
    private final BlockDevice device;

    private final AtomicLong serviced = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);

    public DiskSchedulerLoop(String name, RequestMonitor monitor, BlockDevice device) {
        super(SCHEDULERS_TG, "disk-scheduler-" + name);
        this.monitor = monitor;
        this.device = device;
    }

    @Override
    public void run() {
        LOG.info("Scheduler loop for {} started", device);
        IoRequest current = null;
        try {
            while (true) {
                try {
                    current = monitor.take();
                } catch (InterruptedException e) {
                    LOG.debug("Thread interrupted");
                    continue;
                }
                if (current == null) {
                    break;
                }

                final Throwable failure = service(current);
                monitor.complete(current, failure);
                current = null;
            }
            LOG.info("Scheduler loop for {} stopped after {} requests", device, serviced.get());
        } catch (RuntimeException | Error e) {
            LOG.fatal("Scheduler loop for {} died", device, e);
            final var cause = new DiskSchedulerStoppedException("Scheduler loop for " + device + " died", e);
            if (current != null) {
                monitor.complete(current, cause);
            }
            final int pending = monitor.failPending(cause);
            if (pending > 0) {
                LOG.error("Failed {} pending requests of {}", pending, device);
            }
            throw e;
        }
    }

    @Nullable
    private Throwable service(IoRequest request) {
        serviced.incrementAndGet();
        try {
            switch (request.kind()) {
                case READ -> device.read(request.block(), request.data());
                case WRITE -> device.write(request.block(), request.data());
                default -> throw new IllegalStateException("Unexpected request kind " + request.kind());
            }
            LOG.debug("Serviced {}", request);
            return null;
        } catch (IOException | RuntimeException e) {
            failed.incrementAndGet();
            LOG.error("Device {} failed to service {}: {}", device, request, e.getMessage(), e);
            return e;
        }
    }

    public long serviced() {
        return serviced.get();
    }

    public long failed() {
        return failed.get();
    }
}
