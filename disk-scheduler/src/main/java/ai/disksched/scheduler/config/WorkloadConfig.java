package ai.disksched.scheduler.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * @param seed base seed of the per-thread random generators, {@code 0} for time-based seeds
 */
@ConfigurationProperties("workload")
public record WorkloadConfig(
    int threads,
    int requestsPerThread,
    long seed
) { }
