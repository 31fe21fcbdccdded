package dk.trustworks.skillgap.team.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;
import dk.trustworks.skillgap.team.model.enums.MemberStatus;

/**
 * One member's entry in a team result. Failed members are kept with a degraded analysis,
 * so the member list of a team result always matches the team.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemberAnalysis(
        @JsonProperty("member_id") String memberId,
        @JsonProperty("member_name") String memberName,
        @JsonProperty("role") String role,
        @JsonProperty("department") String department,
        @JsonProperty("status") MemberStatus status,
        @JsonProperty("failure_reason") String failureReason,
        @JsonUnwrapped GapAnalysisResult analysis
) {

    public static MemberAnalysis from(MemberOutcome outcome) {
        TeamMember member = outcome.member();
        if (outcome.isFailed()) {
            return new MemberAnalysis(member.id(), member.name(), member.role(), member.department(),
                    MemberStatus.FAILED, outcome.failureReason(), GapAnalysisResult.degraded(outcome.failureReason()));
        }
        return new MemberAnalysis(member.id(), member.name(), member.role(), member.department(),
                MemberStatus.ANALYZED, null, outcome.result());
    }

    public boolean isFailed() {
        return status == MemberStatus.FAILED;
    }
}
