package com.jreinhal.oplogstats.exception;

public class SeriesNotFoundException extends PipelineException {
    private final String seriesId;

    public SeriesNotFoundException(String seriesId) {
        super(Kind.NOT_FOUND, PipelineStage.RECOMPUTE, "Raw series " + seriesId + " no longer exists", null);
        this.seriesId = seriesId;
    }

    public String getSeriesId() {
        return this.seriesId;
    }
}
