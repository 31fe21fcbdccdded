package dk.trustworks.skillgap.catalog.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.skillgap.catalog.model.CatalogEntry;
import dk.trustworks.skillgap.catalog.model.MatchType;
import dk.trustworks.skillgap.catalog.model.SkillCatalogDocument;
import dk.trustworks.skillgap.config.SkillGapConfig;
import dk.trustworks.skillgap.exceptions.SkillCatalogException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory catalog of canonical skills, their synonyms and category relationships.
 *
 * <p>The catalog is data, not code: it is read once from a JSON document on the classpath
 * ({@code skillgap.matching.catalog-location}) so new skills and synonyms only need a data change.
 * Lookups are by normalized name (see {@link SkillMatcher#normalize(String)}).
 */
@JBossLog
@ApplicationScoped
public class SkillCatalog {

    private final List<CatalogEntry> entries;
    private final Map<String, Lookup> index;
    private final Map<String, List<String>> relatedCategories;

    @Inject
    public SkillCatalog(SkillGapConfig config, ObjectMapper objectMapper) {
        this(load(config.matching().catalogLocation(), objectMapper));
    }

    public SkillCatalog(SkillCatalogDocument document) {
        this.entries = document.skills();
        this.index = buildIndex(document.skills());
        this.relatedCategories = buildRelatedCategories(document.relatedCategories());
        log.infof("[SkillCatalog] Loaded %d canonical skills with %d lookup keys", entries.size(), index.size());
    }

    /**
     * Exact lookup of a normalized canonical name or synonym.
     */
    public Optional<Lookup> find(String normalizedName) {
        return Optional.ofNullable(index.get(normalizedName));
    }

    /**
     * All normalized lookup keys (canonical names and synonyms) in catalog order.
     */
    public Map<String, Lookup> lookupKeys() {
        return Collections.unmodifiableMap(index);
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    /**
     * Category of a canonical or synonym name, if the catalog knows it.
     */
    public Optional<String> categoryOf(String skillName) {
        if (skillName == null || skillName.isBlank()) {
            return Optional.empty();
        }
        return find(SkillMatcher.normalize(skillName)).map(lookup -> lookup.entry().category());
    }

    /**
     * Categories whose skills partially transfer to skills of {@code category}, in either direction.
     */
    public List<String> relatedCategories(String category) {
        if (category == null) {
            return List.of();
        }
        return relatedCategories.getOrDefault(category.toLowerCase(Locale.ROOT), List.of());
    }

    public boolean areRelated(String fromCategory, String toCategory) {
        if (fromCategory == null || toCategory == null) {
            return false;
        }
        return relatedCategories(fromCategory).stream().anyMatch(c -> c.equalsIgnoreCase(toCategory));
    }

    private static Map<String, Lookup> buildIndex(List<CatalogEntry> entries) {
        Map<String, Lookup> index = new LinkedHashMap<>();
        for (CatalogEntry entry : entries) {
            if (entry.name() == null || entry.name().isBlank()) {
                throw new SkillCatalogException("Catalog entry without a name in category " + entry.category());
            }
            index.put(SkillMatcher.normalize(entry.name()), new Lookup(entry, MatchType.EXACT));
        }
        // Canonical names win over synonyms that collide with them
        for (CatalogEntry entry : entries) {
            for (String synonym : entry.synonyms()) {
                index.putIfAbsent(SkillMatcher.normalize(synonym), new Lookup(entry, MatchType.SYNONYM));
            }
        }
        return index;
    }

    private static Map<String, List<String>> buildRelatedCategories(Map<String, List<String>> declared) {
        Map<String, List<String>> related = new LinkedHashMap<>();
        declared.forEach((from, targets) -> {
            for (String to : targets) {
                link(related, from, to);
                link(related, to, from);
            }
        });
        return related;
    }

    private static void link(Map<String, List<String>> related, String from, String to) {
        List<String> targets = related.computeIfAbsent(from.toLowerCase(Locale.ROOT), k -> new ArrayList<>());
        if (targets.stream().noneMatch(t -> t.equalsIgnoreCase(to))) {
            targets.add(to);
        }
    }

    static SkillCatalogDocument load(String location, ObjectMapper objectMapper) {
        String resource = location.startsWith("/") ? location.substring(1) : location;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        try (InputStream is = classLoader.getResourceAsStream(resource)) {
            if (is == null) {
                throw new SkillCatalogException("Skill catalog not found on classpath: " + location);
            }
            return objectMapper.readValue(is, SkillCatalogDocument.class);
        } catch (IOException e) {
            throw new SkillCatalogException("Failed to read skill catalog " + location, e);
        }
    }

    /**
     * Result of an exact catalog lookup.
     *
     * @param entry     The canonical entry.
     * @param matchType EXACT for a canonical name, SYNONYM for a synonym.
     */
    public record Lookup(CatalogEntry entry, MatchType matchType) {
    }
}
