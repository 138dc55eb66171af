package com.jreinhal.oplogstats.config;

import com.jreinhal.oplogstats.oplog.ChangeSource;
import com.jreinhal.oplogstats.oplog.ChangeStreamSubscriber;
import com.jreinhal.oplogstats.oplog.IdentifierExtractor;
import com.jreinhal.oplogstats.oplog.ResumePointResolver;
import com.jreinhal.oplogstats.pipeline.OplogPrinter;
import com.jreinhal.oplogstats.pipeline.TailingPipeline;
import com.jreinhal.oplogstats.service.SummaryRecomputationService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Assembles the tailing pipeline and the oplog printer.
 *
 * <p>Stage threads come from a named factory so thread dumps show which stage is blocked where.
 * Each pipeline run owns a fixed pool of one thread per stage.</p>
 */
@Configuration
public class PipelineConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public ThreadFactory pipelineThreadFactory() {
        return new NamedThreadFactory("oplog-stage-");
    }

    @Bean
    public TailingPipeline tailingPipeline(ResumePointResolver resumePointResolver, ChangeStreamSubscriber subscriber,
                                           IdentifierExtractor extractor,
                                           SummaryRecomputationService recomputationService,
                                           ThreadFactory pipelineThreadFactory, OplogStatsProperties properties) {
        OplogStatsProperties.Pipeline pipeline = properties.getPipeline();
        log.info("Tailing pipeline for {}: skipMissingSeries={}, shutdownGrace={}",
                subscriber.getNamespace(), pipeline.isSkipMissingSeries(), pipeline.getShutdownGrace());
        return new TailingPipeline(resumePointResolver, subscriber, extractor, recomputationService,
                pipelineThreadFactory, pipeline.isSkipMissingSeries(), pipeline.getShutdownGrace());
    }

    @Bean
    public OplogPrinter oplogPrinter(ResumePointResolver resumePointResolver, ChangeSource changeSource) {
        return new OplogPrinter(resumePointResolver, changeSource);
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            return thread;
        }
    }
}
