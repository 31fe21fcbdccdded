package dk.trustworks.skillgap.team.model;

import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;

import java.util.Objects;

/**
 * Result of one member's analysis inside a team run: either the analysis or the reason it failed.
 * Exactly one of {@code result} and {@code failureReason} is set.
 */
public record MemberOutcome(TeamMember member, GapAnalysisResult result, String failureReason) {

    public MemberOutcome {
        Objects.requireNonNull(member, "member");
        if ((result == null) == (failureReason == null)) {
            throw new IllegalArgumentException("Member outcome must carry either a result or a failure reason");
        }
    }

    public static MemberOutcome analyzed(TeamMember member, GapAnalysisResult result) {
        return new MemberOutcome(member, result, null);
    }

    public static MemberOutcome failed(TeamMember member, String reason) {
        return new MemberOutcome(member, null, reason == null ? "unknown error" : reason);
    }

    public boolean isFailed() {
        return failureReason != null;
    }
}
