package com.jreinhal.oplogstats.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "oplogstats")
public class OplogStatsProperties {

    public enum Mode {
        /**
         * Tail the raw collection and maintain summaries.
         */
        SUMMARIZE,
        /**
         * Log every oplog entry from the newest one onwards.
         */
        PRINT
    }

    private Mode mode = Mode.SUMMARIZE;

    private final Runner runner = new Runner();
    private final Oplog oplog = new Oplog();
    private final Metrics metrics = new Metrics();
    private final Pipeline pipeline = new Pipeline();

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Runner getRunner() {
        return runner;
    }

    public Oplog getOplog() {
        return oplog;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public static class Runner {
        /**
         * Start the configured mode once the context is up. Disabled in tests.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Oplog {
        private String database = "local";
        private String collection = "oplog.rs";

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }
    }

    public static class Metrics {
        /**
         * Collection of raw series in the application database; its namespace is the one tailed.
         */
        private String rawCollection = "raw";

        /**
         * Collection receiving the seven-number summaries.
         */
        private String summaryCollection = "summary";

        public String getRawCollection() {
            return rawCollection;
        }

        public void setRawCollection(String rawCollection) {
            this.rawCollection = rawCollection;
        }

        public String getSummaryCollection() {
            return summaryCollection;
        }

        public void setSummaryCollection(String summaryCollection) {
            this.summaryCollection = summaryCollection;
        }
    }

    public static class Pipeline {
        /**
         * Skip (log and count) raw series deleted before their recomputation instead of halting.
         */
        private boolean skipMissingSeries = false;

        /**
         * How long a halting pipeline waits for its stage threads to exit.
         */
        private Duration shutdownGrace = Duration.ofSeconds(10);

        public boolean isSkipMissingSeries() {
            return skipMissingSeries;
        }

        public void setSkipMissingSeries(boolean skipMissingSeries) {
            this.skipMissingSeries = skipMissingSeries;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }
    }
}
