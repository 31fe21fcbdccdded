package dk.trustworks.skillgap.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of {@code skill-catalog.json}.
 *
 * @param skills            Canonical skills with their synonyms.
 * @param relatedCategories Category to categories whose skills partially transfer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillCatalogDocument(List<CatalogEntry> skills, Map<String, List<String>> relatedCategories) {

    public SkillCatalogDocument {
        skills = skills == null ? List.of() : List.copyOf(skills);
        relatedCategories = relatedCategories == null ? Map.of() : Map.copyOf(relatedCategories);
    }
}
