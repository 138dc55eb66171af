package com.jreinhal.oplogstats.oplog;

import com.jreinhal.oplogstats.model.SeriesId;
import com.jreinhal.oplogstats.util.LogSanitizer;
import java.util.Optional;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes an oplog entry into the id of the raw series it touched.
 *
 * <p>Inserts carry the id in the inserted document, updates in the selector ({@code o2}); an
 * update payload may be a partial delta and is never consulted. Entries without a usable
 * {@code _id} are dropped and logged at debug; the pipeline counts them. Duplicates pass
 * through untouched.</p>
 */
public class IdentifierExtractor {
    private static final Logger log = LoggerFactory.getLogger(IdentifierExtractor.class);
    private static final String ID_FIELD = "_id";

    public Optional<SeriesId> extract(OplogEntry entry) {
        Document source = switch (entry.operation()) {
            case INSERT -> entry.object();
            case UPDATE -> entry.queryObject();
            default -> null;
        };
        Optional<SeriesId> id = source == null ? Optional.empty() : SeriesId.from(source.get(ID_FIELD));
        if (id.isEmpty() && log.isDebugEnabled()) {
            log.debug("Dropped {} entry at {} in {}: no usable _id",
                    entry.operation(), entry.position(), LogSanitizer.sanitize(entry.namespace()));
        }
        return id;
    }
}
