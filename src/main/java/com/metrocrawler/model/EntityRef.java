package com.metrocrawler.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A knowledge-graph entity (its Wikidata id) together with the role it plays
 * in the crawl.
 */
@Value
public class EntityRef {
    @NonNull
    String id;
    @NonNull
    EntityKind kind;

    public static EntityRef system(String id) {
        return new EntityRef(id, EntityKind.SYSTEM);
    }

    public static EntityRef line(String id) {
        return new EntityRef(id, EntityKind.LINE);
    }

    public static EntityRef station(String id) {
        return new EntityRef(id, EntityKind.STATION);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + id;
    }
}
