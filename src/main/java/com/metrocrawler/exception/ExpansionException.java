package com.metrocrawler.exception;

import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.RelationKind;
import lombok.Getter;

/**
 * The relations of an entity could not be listed.
 */
@Getter
public class ExpansionException extends CrawlException {

    public enum Kind {
        TRANSPORT,
        NOT_FOUND
    }

    private final Kind kind;
    private final EntityRef entity;
    private final RelationKind relation;

    public ExpansionException(Kind kind, EntityRef entity, RelationKind relation, String message, Throwable cause) {
        super(entity + " (" + relation + "): " + message, cause);
        this.kind = kind;
        this.entity = entity;
        this.relation = relation;
    }

    @Override
    public String getReason() {
        return kind.name();
    }
}
