package com.jreinhal.oplogstats.config;

import com.jreinhal.oplogstats.oplog.ChangeSource;
import com.jreinhal.oplogstats.oplog.ChangeStreamSubscriber;
import com.jreinhal.oplogstats.oplog.IdentifierExtractor;
import com.jreinhal.oplogstats.oplog.MongoOplogSource;
import com.jreinhal.oplogstats.oplog.ResumePointResolver;
import com.mongodb.client.MongoClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Wires the oplog side of the pipeline.
 *
 * <p>The oplog lives in its own database, so it gets a private {@link MongoTemplate} sharing the
 * application's {@link MongoClient}. It is not exposed as a bean, which would displace the
 * auto-configured template of the metrics database.</p>
 */
@Configuration
public class OplogSourceConfig {
    private static final Logger log = LoggerFactory.getLogger(OplogSourceConfig.class);

    @Bean
    public ChangeSource changeSource(MongoClient mongoClient, OplogStatsProperties properties) {
        OplogStatsProperties.Oplog oplog = properties.getOplog();
        MongoTemplate oplogTemplate = new MongoTemplate(mongoClient, oplog.getDatabase());
        log.info("Oplog source: {}.{}", oplog.getDatabase(), oplog.getCollection());
        return new MongoOplogSource(oplogTemplate, oplog.getCollection());
    }

    @Bean
    public ResumePointResolver resumePointResolver(ChangeSource changeSource) {
        return new ResumePointResolver(changeSource);
    }

    @Bean
    public ChangeStreamSubscriber changeStreamSubscriber(ChangeSource changeSource, MongoTemplate mongoTemplate,
                                                         OplogStatsProperties properties) {
        return new ChangeStreamSubscriber(changeSource, watchedNamespace(mongoTemplate, properties));
    }

    @Bean
    public IdentifierExtractor identifierExtractor() {
        return new IdentifierExtractor();
    }

    static String watchedNamespace(MongoTemplate mongoTemplate, OplogStatsProperties properties) {
        return mongoTemplate.getDb().getName() + "." + properties.getMetrics().getRawCollection();
    }
}
