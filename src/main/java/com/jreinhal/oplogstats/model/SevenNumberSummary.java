package com.jreinhal.oplogstats.model;

/**
 * Seven-number summary of one raw series bucket, plus its min and max.
 *
 * <p>The persistence key is {@code (key, at)}: every revision of the same bucket collapses
 * onto one summary document.</p>
 *
 * @see <a href="http://en.wikipedia.org/wiki/Seven-number_summary">Seven-number summary</a>
 */
public record SevenNumberSummary(
        String key,
        long at,
        double min,
        double max,
        double p2,
        double p9,
        double p25,
        double p50,
        double p75,
        double p91,
        double p98) {

    public static final String FIELD_KEY = "key";
    public static final String FIELD_AT = "at";
}
