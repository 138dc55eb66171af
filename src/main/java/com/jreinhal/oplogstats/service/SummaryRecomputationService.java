package com.jreinhal.oplogstats.service;

import com.jreinhal.oplogstats.config.OplogStatsProperties;
import com.jreinhal.oplogstats.exception.PipelineStage;
import com.jreinhal.oplogstats.exception.SeriesNotFoundException;
import com.jreinhal.oplogstats.exception.SourceUnavailableException;
import com.jreinhal.oplogstats.exception.SummaryPersistException;
import com.jreinhal.oplogstats.model.RawSeries;
import com.jreinhal.oplogstats.model.SeriesId;
import com.jreinhal.oplogstats.model.SevenNumberSummary;
import com.jreinhal.oplogstats.util.LogSanitizer;
import com.jreinhal.oplogstats.util.Quantiles;
import com.mongodb.MongoException;
import com.mongodb.client.model.Filters;
import java.util.Optional;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Recomputes the summary of one raw series and upserts it under {@code (key, at)}.
 *
 * <p>The upsert is a single-document write that sets every summary field, so it is atomic and a
 * repeated recomputation of the same snapshot leaves an identical document. Failures are
 * returned to the caller untouched; nothing is retried here.</p>
 */
@Service
public class SummaryRecomputationService {
    private static final Logger log = LoggerFactory.getLogger(SummaryRecomputationService.class);
    static final String SUMMARY_INDEX_NAME = "key_at_unique";

    private final MongoTemplate mongoTemplate;
    private final String rawCollection;
    private final String summaryCollection;

    public SummaryRecomputationService(MongoTemplate mongoTemplate, OplogStatsProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.rawCollection = properties.getMetrics().getRawCollection();
        this.summaryCollection = properties.getMetrics().getSummaryCollection();
    }

    /**
     * @return the persisted summary, or empty when the series holds no values yet
     * @throws SeriesNotFoundException    the series no longer exists
     * @throws SourceUnavailableException the series could not be read
     * @throws SummaryPersistException    the upsert failed
     */
    public Optional<SevenNumberSummary> recompute(SeriesId seriesId) {
        RawSeries raw = this.load(seriesId);
        if (raw.getValues() == null || raw.getValues().isEmpty()) {
            log.warn("Raw series {} ({}@{}) has no values; summary left unchanged",
                    seriesId, LogSanitizer.sanitize(raw.getKey()), raw.getAt());
            return Optional.empty();
        }
        SevenNumberSummary summary = summarize(raw);
        this.upsert(summary);
        if (log.isDebugEnabled()) {
            log.debug("Upserted summary for {}: {}", raw, LogSanitizer.sanitize(summary.toString()));
        }
        return Optional.of(summary);
    }

    public static SevenNumberSummary summarize(RawSeries raw) {
        double[] values = raw.sortedValues();
        return new SevenNumberSummary(
                raw.getKey(),
                raw.getAt(),
                Quantiles.empirical(0.0, values),
                Quantiles.empirical(1.0, values),
                Quantiles.empirical(0.02, values),
                Quantiles.empirical(0.09, values),
                Quantiles.empirical(0.25, values),
                Quantiles.empirical(0.50, values),
                Quantiles.empirical(0.75, values),
                Quantiles.empirical(0.91, values),
                Quantiles.empirical(0.98, values));
    }

    /**
     * Creates the unique {@code (key, at)} index the upsert relies on, if missing.
     */
    public void ensureSummaryIndex() {
        Index index = new Index()
                .on(SevenNumberSummary.FIELD_KEY, Sort.Direction.ASC)
                .on(SevenNumberSummary.FIELD_AT, Sort.Direction.ASC)
                .unique()
                .named(SUMMARY_INDEX_NAME);
        try {
            this.mongoTemplate.indexOps(this.summaryCollection).ensureIndex(index);
        } catch (DataAccessException ex) {
            throw new SummaryPersistException("Cannot create index " + SUMMARY_INDEX_NAME
                    + " on " + this.summaryCollection, ex);
        }
    }

    private RawSeries load(SeriesId seriesId) {
        // native filter: the template's query mapping would turn a 24-hex string id into an ObjectId
        Bson byId = Filters.eq(RawSeries.FIELD_ID, seriesId.value());
        Document raw;
        try {
            raw = this.mongoTemplate.getCollection(this.rawCollection).find(byId).first();
        } catch (MongoException | DataAccessException ex) {
            throw new SourceUnavailableException(PipelineStage.RECOMPUTE,
                    "Cannot load raw series " + seriesId + " from " + this.rawCollection, ex);
        }
        if (raw == null) {
            throw new SeriesNotFoundException(seriesId.toString());
        }
        return RawSeries.fromDocument(raw);
    }

    private void upsert(SevenNumberSummary summary) {
        Query selector = new Query(Criteria.where(SevenNumberSummary.FIELD_KEY).is(summary.key())
                .and(SevenNumberSummary.FIELD_AT).is(summary.at()));
        Update update = new Update()
                .set(SevenNumberSummary.FIELD_KEY, summary.key())
                .set(SevenNumberSummary.FIELD_AT, summary.at())
                .set("min", summary.min())
                .set("max", summary.max())
                .set("p2", summary.p2())
                .set("p9", summary.p9())
                .set("p25", summary.p25())
                .set("p50", summary.p50())
                .set("p75", summary.p75())
                .set("p91", summary.p91())
                .set("p98", summary.p98());
        try {
            this.mongoTemplate.upsert(selector, update, this.summaryCollection);
        } catch (DataAccessException ex) {
            throw new SummaryPersistException("Upsert of summary " + LogSanitizer.sanitize(summary.key())
                    + "@" + summary.at() + " into " + this.summaryCollection + " failed", ex);
        }
    }
}
