package dk.trustworks.skillgap.gapanalysis.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

/**
 * A skill a job or project asks for, as supplied by the requirement extractor or the caller.
 *
 * @param skill         Raw skill name.
 * @param category      Category; blank means "use the catalog category".
 * @param importance    critical, important or nice-to-have.
 * @param minimumLevel  Lowest level that satisfies the requirement.
 * @param confidence    Extraction confidence between 0 and 1.
 * @param context       Free text the requirement was extracted from.
 * @param yearsRequired Optional years of experience asked for.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillRequirement(
        @NotBlank(message = "Required skill name is required")
        String skill,
        String category,
        @NotNull(message = "Importance is required")
        Importance importance,
        @NotNull(message = "Minimum level is required")
        SkillLevel minimumLevel,
        @DecimalMin(value = "0.0", message = "Requirement confidence must be between 0 and 1")
        @DecimalMax(value = "1.0", message = "Requirement confidence must be between 0 and 1")
        double confidence,
        String context,
        @PositiveOrZero(message = "Years required cannot be negative")
        Double yearsRequired
) {
}
