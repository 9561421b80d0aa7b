package com.metrocrawler.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wikidata property ids and helpers for walking the claim structure returned by
 * {@code wbgetentities} and {@code wbgetclaims}.
 */
public final class WikidataUtils {

    public static final String PROPERTY_TRANSPORT_NETWORK = "P16";
    public static final String PROPERTY_CONNECTING_LINE = "P81";
    public static final String PROPERTY_ADJACENT_STATION = "P197";
    public static final String PROPERTY_PART_OF = "P361";
    public static final String PROPERTY_COMPLEX_COLOR = "P462";
    public static final String PROPERTY_COLOR = "P465";
    public static final String PROPERTY_HAS_PART = "P527";
    public static final String PROPERTY_END_TIME = "P582";
    public static final String PROPERTY_COORDINATES = "P625";
    public static final String PROPERTY_INTERCHANGE_STATION = "P833";
    public static final String PROPERTY_DATE_OF_OFFICIAL_OPENING = "P1619";
    public static final String PROPERTY_VERTICAL_DEPTH = "P4511";

    public static final String ITEM_METRE = "Q11573";

    public static final String ERROR_NO_SUCH_ENTITY = "no-such-entity";

    private static final String RANK_DEPRECATED = "deprecated";
    private static final String SNAK_TYPE_VALUE = "value";

    private WikidataUtils() {
    }

    /**
     * Claims of one property, in the order Wikidata lists them. Missing property
     * or unexpected shape gives an empty list.
     */
    public static List<Map<String, Object>> claimsOf(Map<String, Object> claims, String property) {
        if (claims == null) {
            return Collections.emptyList();
        }
        Object value = claims.get(property);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object claim : (List<?>) value) {
            Map<String, Object> map = asMap(claim);
            if (map != null) {
                result.add(map);
            }
        }
        return result;
    }

    /**
     * A claim is current when it is not deprecated and carries no end time.
     */
    public static boolean isCurrent(Map<String, Object> claim) {
        if (RANK_DEPRECATED.equals(claim.get("rank"))) {
            return false;
        }
        Map<String, Object> qualifiers = asMap(claim.get("qualifiers"));
        return qualifiers == null || !qualifiers.containsKey(PROPERTY_END_TIME);
    }

    /**
     * Value of the claim's main snak; empty for "unknown value" and "no value"
     * snaks.
     */
    public static Optional<Object> mainValue(Map<String, Object> claim) {
        return snakValue(asMap(claim.get("mainsnak")));
    }

    /**
     * Value of the first qualifier snak of the given property.
     */
    public static Optional<Object> qualifierValue(Map<String, Object> claim, String property) {
        Map<String, Object> qualifiers = asMap(claim.get("qualifiers"));
        if (qualifiers == null || !(qualifiers.get(property) instanceof List)) {
            return Optional.empty();
        }
        for (Object snak : (List<?>) qualifiers.get(property)) {
            Optional<Object> value = snakValue(asMap(snak));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Item id of a {@code wikibase-entityid} value, falling back to the numeric
     * id for older payloads.
     */
    public static Optional<String> itemId(Object value) {
        Map<String, Object> map = asMap(value);
        if (map == null) {
            return Optional.empty();
        }
        if (map.get("id") instanceof String) {
            return Optional.of((String) map.get("id"));
        }
        if (map.get("numeric-id") instanceof Number) {
            return Optional.of("Q" + ((Number) map.get("numeric-id")).longValue());
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    private static Optional<Object> snakValue(Map<String, Object> snak) {
        if (snak == null || !SNAK_TYPE_VALUE.equals(snak.getOrDefault("snaktype", SNAK_TYPE_VALUE))) {
            return Optional.empty();
        }
        Map<String, Object> datavalue = asMap(snak.get("datavalue"));
        if (datavalue == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(datavalue.get("value"));
    }
}
