package ai.disksched.scheduler.workload;

import ai.disksched.scheduler.DiskScheduler;
import ai.disksched.scheduler.config.WorkloadConfig;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives a scheduler from several client threads, each issuing random blocking reads and writes.
 */
@Singleton
public class WorkloadGenerator {
    private static final Logger LOG = LogManager.getLogger(WorkloadGenerator.class);

    private final DiskScheduler scheduler;
    private final WorkloadConfig config;

    public WorkloadGenerator(DiskScheduler scheduler, WorkloadConfig config) {
        if (config.threads() <= 0) {
            throw new IllegalArgumentException("Number of workload threads must be positive, got " + config.threads());
        }
        this.scheduler = scheduler;
        this.config = config;
    }

    public WorkloadReport run() throws InterruptedException {
        LOG.info("Running workload: {} threads x {} requests against {}",
            config.threads(), config.requestsPerThread(), scheduler);

        final ExecutorService executor = Executors.newFixedThreadPool(config.threads(),
            new ThreadFactoryBuilder().setNameFormat("workload-%d").build());
        final long start = System.nanoTime();
        try {
            final List<Future<WorkloadReport>> futures = new ArrayList<>(config.threads());
            for (int i = 0; i < config.threads(); i++) {
                final long seed = config.seed() == 0 ? System.nanoTime() ^ i : config.seed() + i;
                futures.add(executor.submit(() -> runClient(new Random(seed))));
            }

            long reads = 0;
            long writes = 0;
            long failures = 0;
            for (Future<WorkloadReport> future : futures) {
                final WorkloadReport report;
                try {
                    report = future.get();
                } catch (ExecutionException e) {
                    throw new RuntimeException("Workload client failed", e.getCause());
                }
                reads += report.reads();
                writes += report.writes();
                failures += report.failures();
            }
            return new WorkloadReport(reads, writes, failures, Duration.ofNanos(System.nanoTime() - start));
        } finally {
            executor.shutdownNow();
        }
    }

    private WorkloadReport runClient(Random random) {
        final long start = System.nanoTime();
        final byte[] data = new byte[scheduler.blockSize()];
        long reads = 0;
        long writes = 0;
        long failures = 0;

        for (int i = 0; i < config.requestsPerThread(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.info("Workload client interrupted after {} requests", i);
                break;
            }
            final int block = random.nextInt(scheduler.blockCount());
            try {
                if (random.nextBoolean()) {
                    scheduler.read(block, data);
                    reads++;
                } else {
                    random.nextBytes(data);
                    scheduler.write(block, data);
                    writes++;
                }
            } catch (IOException e) {
                LOG.error("Request to block {} failed", block, e);
                failures++;
            }
        }
        return new WorkloadReport(reads, writes, failures, Duration.ofNanos(System.nanoTime() - start));
    }
}
