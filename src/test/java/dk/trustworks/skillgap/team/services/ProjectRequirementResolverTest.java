package dk.trustworks.skillgap.team.services;

import dk.trustworks.skillgap.exceptions.InvalidInputException;
import dk.trustworks.skillgap.exceptions.RequirementExtractionException;
import dk.trustworks.skillgap.gapanalysis.model.SkillRequirement;
import dk.trustworks.skillgap.gapanalysis.model.enums.Importance;
import dk.trustworks.skillgap.gapanalysis.model.enums.SkillLevel;
import dk.trustworks.skillgap.team.model.ProjectRequirements;
import dk.trustworks.skillgap.team.model.enums.RequirementSource;
import dk.trustworks.skillgap.team.services.ProjectRequirementResolver.ResolvedRequirements;
import dk.trustworks.skillgap.team.spi.RequirementExtractor;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static dk.trustworks.skillgap.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProjectRequirementResolver Unit Tests")
class ProjectRequirementResolverTest {

    @Mock
    Instance<RequirementExtractor> extractors;

    @Mock
    RequirementExtractor extractor;

    private ProjectRequirementResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ProjectRequirementResolver(catalog(), inputValidator(), extractors);
    }

    private static ProjectRequirements describedProject() {
        return ProjectRequirements.builder()
                .name("Data Platform")
                .description("We need strong Python and solid AWS experience")
                .build();
    }

    @Test
    @DisplayName("Structured requirements win over skill names")
    void resolve_structuredRequirements_takePrecedence() {
        // Given
        ProjectRequirements project = ProjectRequirements.builder()
                .name("Portal")
                .requiredSkills(List.of("Java"))
                .skillRequirements(List.of(requirement("React", Importance.CRITICAL, SkillLevel.ADVANCED)))
                .build();

        // When
        ResolvedRequirements resolved = resolver.resolve(project);

        // Then
        assertEquals(RequirementSource.STRUCTURED, resolved.source());
        assertEquals(1, resolved.requirements().size());
        assertEquals("React", resolved.requirements().get(0).skill());
        verifyNoInteractions(extractors);
    }

    @Test
    @DisplayName("Skill names → important, intermediate requirements with catalog category")
    void resolve_skillNames_getDefaults() {
        // When
        ResolvedRequirements resolved = resolver.resolve(projectWithSkillNames("AWS", " Underwater Basket Weaving "));

        // Then
        assertEquals(RequirementSource.REQUIRED_SKILLS, resolved.source());
        SkillRequirement aws = resolved.requirements().get(0);
        assertEquals("AWS", aws.skill());
        assertEquals(Importance.IMPORTANT, aws.importance());
        assertEquals(SkillLevel.INTERMEDIATE, aws.minimumLevel());
        assertEquals(1.0, aws.confidence());
        assertEquals("Cloud & DevOps", aws.category());

        SkillRequirement unknown = resolved.requirements().get(1);
        assertEquals("Underwater Basket Weaving", unknown.skill());
        assertNull(unknown.category());
    }

    @Test
    @DisplayName("Description only → extractor output")
    void resolve_descriptionOnly_usesExtractor() {
        // Given
        when(extractors.isResolvable()).thenReturn(true);
        when(extractors.get()).thenReturn(extractor);
        when(extractor.extract(anyString(), eq("Data Platform"))).thenReturn(List.of(
                requirement("Python", Importance.CRITICAL, SkillLevel.ADVANCED),
                requirement("AWS", Importance.IMPORTANT, SkillLevel.INTERMEDIATE)));

        // When
        ResolvedRequirements resolved = resolver.resolve(describedProject());

        // Then
        assertEquals(RequirementSource.EXTRACTED, resolved.source());
        assertEquals(2, resolved.requirements().size());
        verify(extractor).extract("We need strong Python and solid AWS experience", "Data Platform");
    }

    @Test
    @DisplayName("Extractor failure → RequirementExtractionException with cause")
    void resolve_extractorThrows_wrapsFailure() {
        // Given
        IllegalStateException failure = new IllegalStateException("model unavailable");
        when(extractors.isResolvable()).thenReturn(true);
        when(extractors.get()).thenReturn(extractor);
        when(extractor.extract(anyString(), anyString())).thenThrow(failure);

        // When
        RequirementExtractionException exception = assertThrows(RequirementExtractionException.class,
                () -> resolver.resolve(describedProject()));

        // Then
        assertSame(failure, exception.getCause());
        assertTrue(exception.getMessage().contains("Data Platform"));
    }

    @Test
    @DisplayName("Malformed extractor output → RequirementExtractionException")
    void resolve_malformedExtraction_isRejected() {
        // Given
        SkillRequirement malformed = SkillRequirement.builder().skill("Python").confidence(0.9).build();
        when(extractors.isResolvable()).thenReturn(true);
        when(extractors.get()).thenReturn(extractor);
        when(extractor.extract(anyString(), anyString())).thenReturn(List.of(malformed));

        // When
        RequirementExtractionException exception = assertThrows(RequirementExtractionException.class,
                () -> resolver.resolve(describedProject()));

        // Then
        InvalidInputException cause = assertInstanceOf(InvalidInputException.class, exception.getCause());
        assertEquals(2, cause.getViolations().size());
    }

    @Test
    @DisplayName("No extractor deployed → no requirements")
    void resolve_noExtractor_isEmpty() {
        // Given
        when(extractors.isResolvable()).thenReturn(false);

        // When
        ResolvedRequirements resolved = resolver.resolve(describedProject());

        // Then
        assertEquals(RequirementSource.NONE, resolved.source());
        assertTrue(resolved.requirements().isEmpty());
    }

    @Test
    @DisplayName("Nothing to resolve from → extractor is not consulted")
    void resolve_noDescription_skipsExtractor() {
        ResolvedRequirements resolved = resolver.resolve(ProjectRequirements.builder().name("Empty").build());

        assertEquals(RequirementSource.NONE, resolved.source());
        verifyNoInteractions(extractors);
    }
}
