package com.metrocrawler.client;

import java.util.Map;

/**
 * Raw access to the Wikidata action API. Responses are returned as decoded JSON
 * maps; interpreting them is left to the callers.
 */
public interface WikidataApi {

    /**
     * {@code action=wbgetentities} for a single item (labels, claims, sitelinks).
     */
    Map<String, Object> getEntity(String entityId);

    /**
     * {@code action=wbgetclaims} for one property of an item.
     */
    Map<String, Object> getClaims(String entityId, String property);
}
