package dk.trustworks.skillgap.catalog.model;

import java.util.List;

/**
 * One canonical skill in the catalog.
 *
 * @param name     Canonical display name, e.g. "JavaScript".
 * @param category Catalog category, e.g. "Programming".
 * @param synonyms Alternative spellings and abbreviations, e.g. "JS", "ECMAScript".
 */
public record CatalogEntry(String name, String category, List<String> synonyms) {

    public CatalogEntry {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }
}
