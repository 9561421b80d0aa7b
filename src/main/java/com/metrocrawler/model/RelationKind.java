package com.metrocrawler.model;

import com.metrocrawler.util.WikidataUtils;
import lombok.Getter;

import java.util.List;

/**
 * Typed edges the crawl follows, with the Wikidata properties that carry them.
 */
@Getter
public enum RelationKind {
    STATIONS_OF_LINE(EntityKind.STATION, WikidataUtils.PROPERTY_HAS_PART),
    LINES_OF_STATION(EntityKind.LINE, WikidataUtils.PROPERTY_CONNECTING_LINE),
    ADJACENT_STATIONS(EntityKind.STATION, WikidataUtils.PROPERTY_ADJACENT_STATION),
    CONNECTING_STATIONS(EntityKind.STATION, WikidataUtils.PROPERTY_INTERCHANGE_STATION),
    LINES_OF_SYSTEM(EntityKind.LINE, WikidataUtils.PROPERTY_HAS_PART),
    SYSTEMS_OF_LINE(EntityKind.SYSTEM, WikidataUtils.PROPERTY_PART_OF, WikidataUtils.PROPERTY_TRANSPORT_NETWORK);

    private final EntityKind targetKind;
    private final List<String> properties;

    RelationKind(EntityKind targetKind, String... properties) {
        this.targetKind = targetKind;
        this.properties = List.of(properties);
    }
}
