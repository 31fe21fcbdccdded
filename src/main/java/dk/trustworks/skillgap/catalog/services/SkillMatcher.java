package dk.trustworks.skillgap.catalog.services;

import dk.trustworks.skillgap.catalog.model.CatalogEntry;
import dk.trustworks.skillgap.catalog.model.MatchType;
import dk.trustworks.skillgap.catalog.model.SkillMatch;
import dk.trustworks.skillgap.config.SkillGapConfig;
import dk.trustworks.skillgap.exceptions.InvalidInputException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves free-form skill names to a canonical catalog identity, so that
 * "JS", "Javascript" and "JavaScript " are treated as the same skill.
 *
 * Resolution order:
 *   1. Normalize (trim, lowercase, collapse whitespace)
 *   2. Exact lookup of canonical names and synonyms
 *   3. Fuzzy match by normalized edit distance, accepted above the configured threshold
 *   4. Otherwise the normalized name becomes its own canonical skill (open-world catalog)
 *
 * Resolutions are cached per normalized name; the cache is safe for concurrent team analyses.
 */
@JBossLog
@ApplicationScoped
public class SkillMatcher {

    static final double SYNONYM_CONFIDENCE = 0.95;

    private final SkillCatalog catalog;
    private final SkillGapConfig.Matching config;
    private final Map<String, SkillMatch> resolved = new ConcurrentHashMap<>();

    @Inject
    public SkillMatcher(SkillCatalog catalog, SkillGapConfig config) {
        this.catalog = catalog;
        this.config = config.matching();
    }

    /**
     * Resolves a raw skill name. Never fails for unknown skills.
     *
     * @param rawName skill name as written by a person or an extractor
     * @return canonical identity with a confidence between 0 and 1
     * @throws InvalidInputException if the name is null or blank
     */
    public SkillMatch resolve(String rawName) {
        if (StringUtils.isBlank(rawName)) {
            throw new InvalidInputException("Skill name must not be blank");
        }
        return resolved.computeIfAbsent(normalize(rawName), this::resolveNormalized);
    }

    public boolean sameSkill(String a, String b) {
        return resolve(a).canonicalName().equals(resolve(b).canonicalName());
    }

    /**
     * Trims, lowercases and collapses inner whitespace. Idempotent.
     */
    public static String normalize(String rawName) {
        return StringUtils.normalizeSpace(rawName).toLowerCase(Locale.ROOT);
    }

    int cachedResolutions() {
        return resolved.size();
    }

    private SkillMatch resolveNormalized(String normalized) {
        var exact = catalog.find(normalized);
        if (exact.isPresent()) {
            CatalogEntry entry = exact.get().entry();
            double confidence = exact.get().matchType() == MatchType.EXACT ? 1.0 : SYNONYM_CONFIDENCE;
            return new SkillMatch(entry.name(), entry.category(), confidence, exact.get().matchType());
        }

        CatalogEntry bestEntry = null;
        double bestSimilarity = 0.0;
        for (Map.Entry<String, SkillCatalog.Lookup> candidate : catalog.lookupKeys().entrySet()) {
            double similarity = StringSimilarity.similarity(normalized, candidate.getKey());
            if (similarity > bestSimilarity) {
                bestSimilarity = similarity;
                bestEntry = candidate.getValue().entry();
            }
        }

        if (bestEntry != null && bestSimilarity >= config.fuzzyThreshold()) {
            log.debugf("[SkillMatcher] Fuzzy matched '%s' to '%s' (similarity=%.2f)", normalized, bestEntry.name(), bestSimilarity);
            return new SkillMatch(bestEntry.name(), bestEntry.category(), round(bestSimilarity), MatchType.FUZZY);
        }

        log.debugf("[SkillMatcher] Unknown skill '%s', registering as its own canonical skill", normalized);
        return new SkillMatch(normalized, config.unknownCategory(), config.unknownConfidence(), MatchType.UNKNOWN);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
