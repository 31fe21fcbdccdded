package dk.trustworks.skillgap.catalog.model;

/**
 * Canonical identity of a raw skill name.
 *
 * @param canonicalName Catalog name, or the normalized input for unknown skills.
 * @param category      Catalog category, or the unknown-skill category.
 * @param confidence    Confidence in the resolution between 0 and 1.
 * @param matchType     How the name was resolved.
 */
public record SkillMatch(String canonicalName, String category, double confidence, MatchType matchType) {

    public boolean isKnown() {
        return matchType != MatchType.UNKNOWN;
    }
}
