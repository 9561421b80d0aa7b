package com.metrocrawler.service;

import com.metrocrawler.model.EntityRef;
import com.metrocrawler.model.IdStrategy;
import com.metrocrawler.model.ResolvedAttributes;
import com.metrocrawler.util.NameExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Hands out run-local identifiers: {@code <short-id>} for systems and lines,
 * {@code <line-id>/<short-id>} for stations. Assignment is idempotent per
 * external id, and no two external ids ever share a local id. One instance
 * serves one crawl.
 */
@Slf4j
public class IdentifierAssigner {

    private static final String PREFERRED_LANGUAGE = "en";

    private final IdStrategy strategy;
    private final List<String> localLanguages;

    private final Map<String, String> assigned = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    public IdentifierAssigner(IdStrategy strategy, List<String> localLanguages) {
        this.strategy = strategy;
        this.localLanguages = localLanguages != null ? localLanguages : List.of();
    }

    public String assignSystem(EntityRef ref, ResolvedAttributes attributes) {
        return assign(ref, null, attributes);
    }

    public String assignLine(EntityRef ref, ResolvedAttributes attributes) {
        return assign(ref, null, attributes);
    }

    public String assignStation(EntityRef ref, String owningLineId, ResolvedAttributes attributes) {
        return assign(ref, owningLineId, attributes);
    }

    public Optional<String> lookup(String externalId) {
        return Optional.ofNullable(assigned.get(externalId));
    }

    private String assign(EntityRef ref, String prefix, ResolvedAttributes attributes) {
        String existing = assigned.get(ref.getId());
        if (existing != null) {
            return existing;
        }
        String base = prefix != null ? prefix + "/" + shortId(ref, attributes) : shortId(ref, attributes);
        String id = base;
        if (taken.contains(id)) {
            id = base + "_" + ref.getId();
            log.debug("Local id {} is taken, {} becomes {}", base, ref, id);
        }
        assigned.put(ref.getId(), id);
        taken.add(id);
        return id;
    }

    private String shortId(EntityRef ref, ResolvedAttributes attributes) {
        if (strategy == IdStrategy.ENTITY_ID || attributes == null) {
            return ref.getId();
        }
        Map<String, String> names = attributes.getNames();
        List<String> languages = new ArrayList<>();
        languages.add(PREFERRED_LANGUAGE);
        languages.addAll(localLanguages);
        languages.addAll(new TreeSet<>(names.keySet()));
        for (String language : languages) {
            String name = names.get(language);
            if (name == null) {
                continue;
            }
            String slug = NameExtractor.slugify(name);
            if (!slug.isEmpty()) {
                return slug;
            }
        }
        log.warn("⚠️ No usable name for {}, falling back to its entity id", ref);
        return ref.getId();
    }
}
