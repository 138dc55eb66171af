package com.jreinhal.oplogstats;

import com.jreinhal.oplogstats.config.OplogStatsProperties;
import com.jreinhal.oplogstats.exception.PipelineException;
import com.jreinhal.oplogstats.pipeline.OplogPrinter;
import com.jreinhal.oplogstats.pipeline.PipelineTermination;
import com.jreinhal.oplogstats.pipeline.TailingPipeline;
import com.jreinhal.oplogstats.service.SummaryRecomputationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the configured mode once the context is up.
 *
 * <p>Both modes only end through a failure. The failure is logged with its stage and cause and
 * rethrown; being an {@link org.springframework.boot.ExitCodeGenerator} it becomes the non-zero
 * exit status of the process.</p>
 */
@Component
public class OplogStatsRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(OplogStatsRunner.class);

    private final OplogStatsProperties properties;
    private final TailingPipeline tailingPipeline;
    private final OplogPrinter oplogPrinter;
    private final SummaryRecomputationService recomputationService;

    public OplogStatsRunner(OplogStatsProperties properties, TailingPipeline tailingPipeline,
                            OplogPrinter oplogPrinter, SummaryRecomputationService recomputationService) {
        this.properties = properties;
        this.tailingPipeline = tailingPipeline;
        this.oplogPrinter = oplogPrinter;
        this.recomputationService = recomputationService;
    }

    @Override
    public void run(String... args) throws InterruptedException {
        if (!this.properties.getRunner().isEnabled()) {
            log.info("Runner disabled; not tailing the oplog.");
            return;
        }
        switch (this.properties.getMode()) {
            case PRINT -> this.print();
            case SUMMARIZE -> this.summarize();
        }
    }

    private void print() {
        try {
            this.oplogPrinter.run();
        } catch (PipelineException ex) {
            log.error("Oplog printer halted: {}", ex.describe());
            throw ex;
        }
    }

    private void summarize() throws InterruptedException {
        try {
            this.recomputationService.ensureSummaryIndex();
        } catch (PipelineException ex) {
            log.error("Cannot prepare summary collection: {}", ex.describe());
            throw ex;
        }
        PipelineTermination termination = this.tailingPipeline.run();
        log.error("Pipeline halted in {} stage: {}", termination.stage(), termination.cause().describe());
        log.error("Counters at halt: {}", termination.counters());
        termination.restartPosition().ifPresent(position ->
                log.error("A new run may resume after {}", position));
        throw termination.cause();
    }
}
