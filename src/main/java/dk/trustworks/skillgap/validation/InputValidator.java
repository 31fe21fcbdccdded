package dk.trustworks.skillgap.validation;

import dk.trustworks.skillgap.exceptions.InvalidInputException;
import dk.trustworks.skillgap.exceptions.InvalidInputException.Violation;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.UserSkill;
import dk.trustworks.skillgap.team.model.ProjectRequirements;
import dk.trustworks.skillgap.team.model.TeamMember;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Boundary checks run before anything enters the pipeline.
 *
 * Bean Validation constraints on the input records cover single fields; the cross-record
 * rules (empty team, duplicate member ids) are checked here. Member skill records are checked
 * with the team, so one negative experience value rejects the whole request.
 */
@ApplicationScoped
public class InputValidator {

    private final Validator validator;

    @Inject
    public InputValidator(Validator validator) {
        this.validator = validator;
    }

    public void validateIndividual(List<UserSkill> userSkills, List<SkillRequirement> requirements) {
        List<Violation> violations = new ArrayList<>();
        collectSkills(userSkills, "userSkills", violations);
        collectRequirements(requirements, "requirements", violations);
        throwIfAny(violations);
    }

    public void validateSkills(List<UserSkill> userSkills, String path) {
        List<Violation> violations = new ArrayList<>();
        collectSkills(userSkills, path, violations);
        throwIfAny(violations);
    }

    public void validateRequirements(List<SkillRequirement> requirements, String path) {
        List<Violation> violations = new ArrayList<>();
        collectRequirements(requirements, path, violations);
        throwIfAny(violations);
    }

    public void validateTeam(List<TeamMember> members, ProjectRequirements project) {
        List<Violation> violations = new ArrayList<>();

        if (members == null || members.isEmpty()) {
            violations.add(new Violation("members", "Team must have at least one member"));
        } else {
            Set<String> seenIds = new HashSet<>();
            for (int i = 0; i < members.size(); i++) {
                TeamMember member = members.get(i);
                String path = "members[" + i + "]";
                if (member == null) {
                    violations.add(new Violation(path, "Team member must not be null"));
                    continue;
                }
                collect(member, path, violations);
                collectSkills(member.skills(), path + ".skills", violations);
                if (member.id() != null && !seenIds.add(member.id())) {
                    violations.add(new Violation(path + ".id", "Duplicate member id: " + member.id()));
                }
            }
        }

        if (project == null) {
            violations.add(new Violation("project", "Project requirements are required"));
        } else {
            collect(project, "project", violations);
        }

        throwIfAny(violations);
    }

    private void collectSkills(List<UserSkill> userSkills, String path, List<Violation> violations) {
        if (userSkills == null) {
            violations.add(new Violation(path, "Skill list is required"));
            return;
        }
        for (int i = 0; i < userSkills.size(); i++) {
            UserSkill skill = userSkills.get(i);
            if (skill == null) {
                violations.add(new Violation(path + "[" + i + "]", "Skill must not be null"));
                continue;
            }
            collect(skill, path + "[" + i + "]", violations);
        }
    }

    private void collectRequirements(List<SkillRequirement> requirements, String path, List<Violation> violations) {
        if (requirements == null) {
            violations.add(new Violation(path, "Requirement list is required"));
            return;
        }
        for (int i = 0; i < requirements.size(); i++) {
            SkillRequirement requirement = requirements.get(i);
            if (requirement == null) {
                violations.add(new Violation(path + "[" + i + "]", "Requirement must not be null"));
                continue;
            }
            collect(requirement, path + "[" + i + "]", violations);
        }
    }

    private <T> void collect(T bean, String path, List<Violation> violations) {
        Set<ConstraintViolation<T>> found = validator.validate(bean);
        found.stream()
                .map(v -> new Violation(path + "." + v.getPropertyPath(), v.getMessage()))
                .sorted(Comparator.comparing(Violation::field))
                .forEach(violations::add);
    }

    private static void throwIfAny(List<Violation> violations) {
        if (!violations.isEmpty()) {
            throw new InvalidInputException(violations);
        }
    }
}
