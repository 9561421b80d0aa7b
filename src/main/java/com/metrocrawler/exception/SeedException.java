package com.metrocrawler.exception;

import lombok.Getter;

/**
 * One of the two seed entities could not be resolved; the crawl cannot start.
 */
@Getter
public class SeedException extends CrawlException {

    public enum Kind {
        SYSTEM_NOT_FOUND,
        STATION_NOT_FOUND
    }

    private final Kind kind;
    private final String seedId;

    public SeedException(Kind kind, String seedId, Throwable cause) {
        super((kind == Kind.SYSTEM_NOT_FOUND ? "Seed system " : "Seed station ") + seedId
                + " cannot be resolved: " + cause.getMessage(), cause);
        this.kind = kind;
        this.seedId = seedId;
    }

    @Override
    public String getReason() {
        return kind.name();
    }
}
