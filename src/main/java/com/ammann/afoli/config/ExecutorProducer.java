/* (C)2026 */
package com.ammann.afoli.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for the named ManagedExecutor that runs batch spectra.
 *
 * <p>Provides the "afoli-batch-executor" bean used by SpectrumBatchService. Each
 * submitted task runs AFOLI on one spectrum.
 */
@ApplicationScoped
public class ExecutorProducer {

    public static final String BATCH_EXECUTOR = "afoli-batch-executor";

    @ConfigProperty(name = "afoli.batch.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "afoli.batch.max-queued", defaultValue = "64")
    int maxQueued;

    /**
     * Produces the batch executor.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>afoli.batch.max-async</li>
     *   <li>afoli.batch.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named(BATCH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createBatchExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }

    void shutdownBatchExecutor(@Disposes @Named(BATCH_EXECUTOR) ManagedExecutor executor) {
        executor.shutdown();
    }
}
