package com.jreinhal.oplogstats.oplog;

import com.jreinhal.oplogstats.exception.PipelineStage;
import com.jreinhal.oplogstats.exception.SourceUnavailableException;
import com.jreinhal.oplogstats.exception.StreamBrokenException;
import com.mongodb.CursorType;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.Filters;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * {@link ChangeSource} over a replica set oplog, read through a {@link MongoTemplate} bound to the
 * {@code local} database.
 */
public class MongoOplogSource implements ChangeSource {
    private static final Logger log = LoggerFactory.getLogger(MongoOplogSource.class);
    private static final Document NATURAL_ASC = new Document("$natural", 1);
    private static final Document NATURAL_DESC = new Document("$natural", -1);

    private final MongoTemplate oplogTemplate;
    private final String collectionName;

    public MongoOplogSource(MongoTemplate oplogTemplate, String collectionName) {
        this.oplogTemplate = oplogTemplate;
        this.collectionName = collectionName;
    }

    @Override
    public Optional<OplogEntry> latest() {
        try {
            Document newest = this.collection().find().sort(NATURAL_DESC).limit(1).first();
            return Optional.ofNullable(newest).map(OplogEntry::fromDocument);
        } catch (MongoException | DataAccessException ex) {
            throw new SourceUnavailableException(PipelineStage.RESUME,
                    "Cannot read newest entry of " + this.collectionName, ex);
        }
    }

    @Override
    public ChangeStream tail(OplogFilter filter) {
        Bson query = toQuery(filter);
        try {
            MongoCursor<Document> cursor = this.collection()
                    .find(query)
                    .sort(NATURAL_ASC)
                    .cursorType(CursorType.TailableAwait)
                    .noCursorTimeout(true)
                    .iterator();
            if (log.isDebugEnabled()) {
                log.debug("Opened tailable cursor on {} with filter {}", this.collectionName, query);
            }
            return new CursorChangeStream(cursor);
        } catch (MongoException | DataAccessException ex) {
            throw new SourceUnavailableException(PipelineStage.TAIL,
                    "Cannot open tailable cursor on " + this.collectionName, ex);
        }
    }

    static Bson toQuery(OplogFilter filter) {
        List<Bson> clauses = new ArrayList<>();
        clauses.add(filter.inclusive()
                ? Filters.gte(OplogEntry.FIELD_TS, filter.position().timestamp())
                : Filters.gt(OplogEntry.FIELD_TS, filter.position().timestamp()));
        if (filter.namespace() != null) {
            clauses.add(Filters.eq(OplogEntry.FIELD_NS, filter.namespace()));
        }
        if (!filter.operations().isEmpty()) {
            List<String> codes = filter.operations().stream()
                    .map(OplogOperation::code)
                    .sorted()
                    .toList();
            clauses.add(Filters.in(OplogEntry.FIELD_OP, codes));
        }
        return clauses.size() == 1 ? clauses.get(0) : Filters.and(clauses);
    }

    private MongoCollection<Document> collection() {
        return this.oplogTemplate.getCollection(this.collectionName);
    }

    static final class CursorChangeStream implements ChangeStream {
        private final MongoCursor<Document> cursor;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        CursorChangeStream(MongoCursor<Document> cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            if (this.closed.get()) {
                return false;
            }
            try {
                return this.cursor.hasNext();
            } catch (MongoException | IllegalStateException ex) {
                if (this.closed.get()) {
                    return false;
                }
                throw new StreamBrokenException("Tailing cursor failed", ex);
            }
        }

        @Override
        public OplogEntry next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException("change stream is closed");
            }
            try {
                return OplogEntry.fromDocument(this.cursor.next());
            } catch (MongoException ex) {
                throw new StreamBrokenException("Tailing cursor failed", ex);
            }
        }

        @Override
        public void close() {
            if (this.closed.compareAndSet(false, true)) {
                this.cursor.close();
            }
        }
    }
}
