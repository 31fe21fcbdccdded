package dk.trustworks.skillgap.services;

import dk.trustworks.skillgap.exceptions.AggregationException;
import dk.trustworks.skillgap.exceptions.InvalidInputException;
import dk.trustworks.skillgap.exceptions.RequirementExtractionException;
import dk.trustworks.skillgap.gapanalysis.model.GapAnalysisResult;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.UserSkill;
import dk.trustworks.skillgap.gapanalysis.services.GapAnalyzer;
import dk.trustworks.skillgap.team.model.ProjectRequirements;
import dk.trustworks.skillgap.team.model.TeamAnalysisResult;
import dk.trustworks.skillgap.team.model.TeamMember;
import dk.trustworks.skillgap.team.services.TeamAggregator;
import dk.trustworks.skillgap.validation.InputValidator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;

/**
 * Entry point for callers such as a REST layer or a batch job.
 *
 * Validates input at the boundary and hands it to the pipeline:
 * <ul>
 *   <li>{@link #analyzeIndividual} runs a single gap analysis</li>
 *   <li>{@link #analyzeTeam} runs one analysis per member and aggregates them</li>
 * </ul>
 *
 * Only bad input ({@link InvalidInputException}), extractor failures ({@link RequirementExtractionException})
 * and aggregation defects ({@link AggregationException}) reach the caller. A failing member analysis
 * is reported inside the team result instead.
 */
@JBossLog
@ApplicationScoped
public class SkillGapAnalysisService {

    private final InputValidator inputValidator;
    private final GapAnalyzer gapAnalyzer;
    private final TeamAggregator teamAggregator;

    @Inject
    public SkillGapAnalysisService(InputValidator inputValidator, GapAnalyzer gapAnalyzer, TeamAggregator teamAggregator) {
        this.inputValidator = inputValidator;
        this.gapAnalyzer = gapAnalyzer;
        this.teamAggregator = teamAggregator;
    }

    /**
     * Analyzes one person against a requirement list.
     *
     * @param userSkills   the person's skills, may be empty
     * @param requirements the requirements, may be empty
     * @return the gap analysis
     * @throws InvalidInputException if a skill or requirement record is malformed
     */
    public GapAnalysisResult analyzeIndividual(List<UserSkill> userSkills, List<SkillRequirement> requirements) {
        inputValidator.validateIndividual(userSkills, requirements);
        log.debugf("[SkillGapAnalysisService] Individual analysis: %d skill(s), %d requirement(s)",
                userSkills.size(), requirements.size());
        return gapAnalyzer.analyze(userSkills, requirements);
    }

    /**
     * Analyzes a team against a project.
     *
     * @param teamMembers the team, at least one member with unique ids
     * @param project     what the project needs
     * @return the team analysis, with one member analysis per team member
     * @throws InvalidInputException          if the team or the project is malformed
     * @throws RequirementExtractionException if the description could not be turned into requirements
     * @throws AggregationException           if the member results could not be merged
     */
    public TeamAnalysisResult analyzeTeam(List<TeamMember> teamMembers, ProjectRequirements project) {
        inputValidator.validateTeam(teamMembers, project);
        return teamAggregator.analyze(teamMembers, project);
    }
}
