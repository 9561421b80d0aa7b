package com.metrocrawler.exception;

import com.metrocrawler.model.EntityRef;
import lombok.Getter;

/**
 * An entity's attributes could not be fetched or read.
 */
@Getter
public class ResolutionException extends CrawlException {

    public enum Kind {
        NOT_FOUND,
        MALFORMED_ATTRIBUTE,
        TRANSPORT
    }

    private final Kind kind;
    private final EntityRef entity;

    public ResolutionException(Kind kind, EntityRef entity, String message) {
        super(entity + ": " + message);
        this.kind = kind;
        this.entity = entity;
    }

    public ResolutionException(Kind kind, EntityRef entity, String message, Throwable cause) {
        super(entity + ": " + message, cause);
        this.kind = kind;
        this.entity = entity;
    }

    @Override
    public String getReason() {
        return kind.name();
    }
}
