package dk.trustworks.skillgap.gapanalysis.model;

import java.util.List;

/**
 * Actionable recommendations bucketed by time horizon.
 *
 * @param immediate Within a month.
 * @param shortTerm Two to four months.
 * @param longTerm  More than four months.
 */
public record Recommendations(List<String> immediate, List<String> shortTerm, List<String> longTerm) {

    public Recommendations {
        immediate = immediate == null ? List.of() : List.copyOf(immediate);
        shortTerm = shortTerm == null ? List.of() : List.copyOf(shortTerm);
        longTerm = longTerm == null ? List.of() : List.copyOf(longTerm);
    }

    public static Recommendations empty() {
        return new Recommendations(List.of(), List.of(), List.of());
    }
}
