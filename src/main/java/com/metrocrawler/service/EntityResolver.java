package com.metrocrawler.service;

import com.metrocrawler.client.WikidataApi;
import com.metrocrawler.exception.ResolutionException;
import com.metrocrawler.model.EntityKind;
import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.GeoPosition;
import com.metrocrawler.model.ResolvedAttributes;
import com.metrocrawler.model.StationStatus;
import com.metrocrawler.util.NameExtractor;
import com.metrocrawler.util.WikidataUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.metrocrawler.util.WikidataUtils.asMap;

/**
 * Fetches one Wikidata item and reads the attributes the network document
 * needs. A single unreadable attribute never fails the entity: it is left out
 * and reported in {@link ResolvedAttributes#getProblems()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityResolver {

    // "+1935-05-15T00:00:00Z"; month and day are 00 when unknown
    private static final Pattern WIKIDATA_TIME = Pattern.compile("^\\+(\\d{4,})-(\\d{2})-(\\d{2})T");
    private static final Pattern HEX_COLOR = Pattern.compile("^#?([0-9A-Fa-f]{6})$");

    private static final Map<String, Map<String, StationStatus>> STATUS_KEYWORDS = new LinkedHashMap<>();

    static {
        Map<String, StationStatus> english = new LinkedHashMap<>();
        english.put("prospective", StationStatus.PLANNED);
        english.put("planned", StationStatus.PLANNED);
        english.put("under construction", StationStatus.UNDER_CONSTRUCTION);
        STATUS_KEYWORDS.put("en", english);

        Map<String, StationStatus> russian = new LinkedHashMap<>();
        russian.put("временно закрытая", StationStatus.CLOSED);
        russian.put("законсервированная", StationStatus.CLOSED);
        russian.put("перспективная", StationStatus.PLANNED);
        russian.put("проектируемая", StationStatus.PLANNED);
        russian.put("будущая", StationStatus.PLANNED);
        russian.put("строящаяся", StationStatus.UNDER_CONSTRUCTION);
        STATUS_KEYWORDS.put("ru", russian);
    }

    private final WikidataApi wikidataApi;

    public ResolvedAttributes resolve(EntityRef ref) {
        Map<String, Object> response;
        try {
            response = wikidataApi.getEntity(ref.getId());
        } catch (RuntimeException e) {
            throw new ResolutionException(ResolutionException.Kind.TRANSPORT, ref, e.getMessage(), e);
        }
        Map<String, Object> entity = extractEntity(ref, response);
        Map<String, Object> claims = asMap(entity.get("claims"));

        // Merged items answer with the surviving item; that id is the one to deduplicate on
        EntityRef canonical = entity.get("id") instanceof String && !ref.getId().equals(entity.get("id"))
                ? new EntityRef((String) entity.get("id"), ref.getKind())
                : ref;
        if (canonical != ref) {
            log.debug("{} is redirected to {}", ref, canonical.getId());
        }

        ResolvedAttributes.ResolvedAttributesBuilder builder = ResolvedAttributes.builder().ref(canonical);
        readNames(ref.getKind(), asMap(entity.get("labels")), builder);
        readSiteLinks(asMap(entity.get("sitelinks")), builder);

        if (ref.getKind() == EntityKind.STATION) {
            readCoordinates(claims, builder);
            readHeight(claims, builder);
            readStatus(asMap(entity.get("descriptions")), claims, builder);
        } else if (ref.getKind() == EntityKind.LINE) {
            readColor(claims, builder);
        }

        ResolvedAttributes attributes = builder.build();
        log.debug("Resolved {}: {} names, {} site links", ref, attributes.getNames().size(),
                attributes.getSiteLinks().size());
        return attributes;
    }

    private Map<String, Object> extractEntity(EntityRef ref, Map<String, Object> response) {
        if (response == null) {
            throw new ResolutionException(ResolutionException.Kind.TRANSPORT, ref, "empty response");
        }
        Map<String, Object> error = asMap(response.get("error"));
        if (error != null) {
            if (WikidataUtils.ERROR_NO_SUCH_ENTITY.equals(error.get("code"))) {
                throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, ref, "no such entity");
            }
            throw new ResolutionException(ResolutionException.Kind.TRANSPORT, ref,
                    "API error " + error.get("code") + ": " + error.get("info"));
        }
        Map<String, Object> entities = asMap(response.get("entities"));
        if (entities == null) {
            throw new ResolutionException(ResolutionException.Kind.MALFORMED_ATTRIBUTE, ref, "no entities in response");
        }
        Map<String, Object> entity = asMap(entities.get(ref.getId()));
        if (entity == null && entities.size() == 1) {
            // Redirected items may come back under the id of the redirect target
            entity = asMap(entities.values().iterator().next());
        }
        if (entity == null || entity.containsKey("missing")) {
            throw new ResolutionException(ResolutionException.Kind.NOT_FOUND, ref, "entity is missing");
        }
        return entity;
    }

    private void readNames(EntityKind kind, Map<String, Object> labels,
            ResolvedAttributes.ResolvedAttributesBuilder builder) {
        if (labels == null) {
            return;
        }
        for (Map.Entry<String, Object> label : labels.entrySet()) {
            Map<String, Object> value = asMap(label.getValue());
            if (value == null || !(value.get("value") instanceof String)) {
                continue;
            }
            String caption = (String) value.get("value");
            if (caption.isBlank()) {
                continue;
            }
            String language = label.getKey();
            if (kind == EntityKind.STATION) {
                builder.name(language, NameExtractor.extractStationName(caption, language));
            } else if (kind == EntityKind.LINE) {
                builder.name(language, NameExtractor.extractLineName(caption, language));
            } else {
                builder.name(language, caption);
            }
        }
    }

    private void readSiteLinks(Map<String, Object> siteLinks, ResolvedAttributes.ResolvedAttributesBuilder builder) {
        if (siteLinks == null) {
            return;
        }
        for (Map.Entry<String, Object> siteLink : siteLinks.entrySet()) {
            Map<String, Object> value = asMap(siteLink.getValue());
            if (value != null && value.get("title") instanceof String && !((String) value.get("title")).isBlank()) {
                builder.siteLink(siteLink.getKey(), (String) value.get("title"));
            }
        }
    }

    private void readCoordinates(Map<String, Object> claims, ResolvedAttributes.ResolvedAttributesBuilder builder) {
        Optional<Object> value = firstValue(claims, WikidataUtils.PROPERTY_COORDINATES);
        if (value.isEmpty()) {
            return;
        }
        Map<String, Object> coordinates = asMap(value.get());
        if (coordinates == null
                || !(coordinates.get("latitude") instanceof Number)
                || !(coordinates.get("longitude") instanceof Number)) {
            builder.problem("coordinates without latitude/longitude: " + value.get());
            return;
        }
        builder.geoPosition(new GeoPosition(
                ((Number) coordinates.get("latitude")).doubleValue(),
                ((Number) coordinates.get("longitude")).doubleValue()));
    }

    private void readHeight(Map<String, Object> claims, ResolvedAttributes.ResolvedAttributesBuilder builder) {
        Optional<Object> value = firstValue(claims, WikidataUtils.PROPERTY_VERTICAL_DEPTH);
        if (value.isEmpty()) {
            return;
        }
        Map<String, Object> quantity = asMap(value.get());
        if (quantity == null || !(quantity.get("amount") instanceof String) || !(quantity.get("unit") instanceof String)) {
            builder.problem("unreadable vertical depth: " + value.get());
            return;
        }
        if (!((String) quantity.get("unit")).endsWith("/" + WikidataUtils.ITEM_METRE)) {
            builder.problem("unsupported vertical depth unit " + quantity.get("unit"));
            return;
        }
        try {
            // Depth below the surface becomes a negative height
            builder.height(-Double.parseDouble((String) quantity.get("amount")));
        } catch (NumberFormatException e) {
            builder.problem("invalid vertical depth " + quantity.get("amount") + ": " + e.getMessage());
        }
    }

    /**
     * Status from description keywords; a later language in
     * {@link #STATUS_KEYWORDS} wins over an earlier one, and an opening date in
     * the future means the station is still being built.
     */
    private void readStatus(Map<String, Object> descriptions, Map<String, Object> claims,
            ResolvedAttributes.ResolvedAttributesBuilder builder) {
        StationStatus status = null;
        if (descriptions != null) {
            for (Map.Entry<String, Map<String, StationStatus>> language : STATUS_KEYWORDS.entrySet()) {
                Map<String, Object> description = asMap(descriptions.get(language.getKey()));
                if (description == null || !(description.get("value") instanceof String)) {
                    continue;
                }
                String text = ((String) description.get("value")).toLowerCase(Locale.ROOT);
                for (Map.Entry<String, StationStatus> keyword : language.getValue().entrySet()) {
                    if (text.contains(keyword.getKey())) {
                        status = keyword.getValue();
                        break;
                    }
                }
            }
        }

        LocalDate openDate = readOpenDate(claims, builder);
        if (openDate != null && openDate.isAfter(LocalDate.now())) {
            status = StationStatus.UNDER_CONSTRUCTION;
        }
        builder.status(status);
    }

    private LocalDate readOpenDate(Map<String, Object> claims, ResolvedAttributes.ResolvedAttributesBuilder builder) {
        Optional<Object> value = firstValue(claims, WikidataUtils.PROPERTY_DATE_OF_OFFICIAL_OPENING);
        if (value.isEmpty()) {
            return null;
        }
        Map<String, Object> time = asMap(value.get());
        Matcher matcher = time != null && time.get("time") instanceof String
                ? WIKIDATA_TIME.matcher((String) time.get("time"))
                : null;
        if (matcher == null || !matcher.lookingAt()) {
            builder.problem("unreadable opening date: " + value.get());
            return null;
        }
        try {
            LocalDate openDate = LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Math.max(1, Integer.parseInt(matcher.group(2))),
                    Math.max(1, Integer.parseInt(matcher.group(3))));
            builder.openDate(openDate);
            return openDate;
        } catch (DateTimeException | NumberFormatException e) {
            builder.problem("invalid opening date " + time.get("time") + ": " + e.getMessage());
            return null;
        }
    }

    private void readColor(Map<String, Object> claims, ResolvedAttributes.ResolvedAttributesBuilder builder) {
        Optional<Object> color = firstValue(claims, WikidataUtils.PROPERTY_COLOR);

        // A color given as a qualifier of "complex color" wins over the plain one
        List<Map<String, Object>> complexColors = WikidataUtils.claimsOf(claims, WikidataUtils.PROPERTY_COMPLEX_COLOR);
        if (!complexColors.isEmpty()) {
            Optional<Object> qualifier = WikidataUtils.qualifierValue(complexColors.get(0),
                    WikidataUtils.PROPERTY_COLOR);
            if (qualifier.isPresent()) {
                color = qualifier;
            }
        }

        if (color.isEmpty()) {
            return;
        }
        Matcher matcher = color.get() instanceof String ? HEX_COLOR.matcher((String) color.get()) : null;
        if (matcher == null || !matcher.matches()) {
            builder.problem("unreadable color: " + color.get());
            return;
        }
        builder.color("#" + matcher.group(1));
    }

    private Optional<Object> firstValue(Map<String, Object> claims, String property) {
        List<Map<String, Object>> candidates = WikidataUtils.claimsOf(claims, property);
        for (Map<String, Object> claim : candidates) {
            if (!WikidataUtils.isCurrent(claim)) {
                continue;
            }
            Optional<Object> value = WikidataUtils.mainValue(claim);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
