package com.metrocrawler.service;

import com.metrocrawler.client.WikidataApi;
import com.metrocrawler.exception.ExpansionException;
import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.RelationKind;
import com.metrocrawler.util.WikidataUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static com.metrocrawler.util.WikidataUtils.asMap;

/**
 * Lists the entities an entity points to through one {@link RelationKind}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationExpander {

    private final WikidataApi wikidataApi;

    /**
     * Claims are fetched eagerly, so transport failures surface here; the
     * returned stream is lazy, single use and yields each target once, in claim
     * order. Ended ("end time" qualifier), deprecated and value-less claims are
     * skipped.
     *
     * @throws ExpansionException when the claims cannot be fetched
     */
    public Stream<EntityRef> expand(EntityRef ref, RelationKind relation) {
        List<Map<String, Object>> claims = new ArrayList<>();
        for (String property : relation.getProperties()) {
            claims.addAll(fetchClaims(ref, relation, property));
        }
        return claims.stream()
                .filter(WikidataUtils::isCurrent)
                .map(WikidataUtils::mainValue)
                .flatMap(Optional::stream)
                .map(WikidataUtils::itemId)
                .flatMap(Optional::stream)
                .distinct()
                .map(id -> new EntityRef(id, relation.getTargetKind()));
    }

    private List<Map<String, Object>> fetchClaims(EntityRef ref, RelationKind relation, String property) {
        Map<String, Object> response;
        try {
            response = wikidataApi.getClaims(ref.getId(), property);
        } catch (RuntimeException e) {
            throw new ExpansionException(ExpansionException.Kind.TRANSPORT, ref, relation, e.getMessage(), e);
        }
        if (response == null) {
            log.debug("No claims response for {} {}", ref, property);
            return List.of();
        }
        Map<String, Object> error = asMap(response.get("error"));
        if (error != null) {
            ExpansionException.Kind kind = WikidataUtils.ERROR_NO_SUCH_ENTITY.equals(error.get("code"))
                    ? ExpansionException.Kind.NOT_FOUND
                    : ExpansionException.Kind.TRANSPORT;
            throw new ExpansionException(kind, ref, relation, "API error " + error.get("code"), null);
        }
        return WikidataUtils.claimsOf(asMap(response.get("claims")), property);
    }
}
