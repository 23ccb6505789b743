package io.arazzolens.infrastructure.validation;

import io.arazzolens.ArazzoFixtures;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.diagnostic.DiagnosticSeverity;
import io.arazzolens.core.exception.ArazzoIllegalStateException;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Step;
import io.arazzolens.infrastructure.validation.validators.InfoValidator;
import io.arazzolens.infrastructure.validation.validators.StepValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ArazzoValidatorRegistryTest {

    private static final String HEADER = """
            arazzo: 1.0.0
            info:
              title: Test
              version: 1.0.0
            sourceDescriptions:
              - name: api
                url: ./openapi.yaml
                type: openapi
            """;

    private final ArazzoValidatorRegistry registry = new ArazzoValidatorRegistry();

    private List<Diagnostic> validate(final ArazzoDocument document) {
        return registry.validate(document, ArazzoValidationOptions.ofDefault()).getDiagnostics();
    }

    @Test
    void testMinimalDocumentIsValid() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.MINIMAL));

        // when
        final ArazzoValidationResult result = registry.validate(document, ArazzoValidationOptions.ofDefault());

        // then
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.isInvalid()).isFalse();
    }

    @Test
    void testFixturesAreValid() {
        // given
        final ArazzoDocument petPurchase = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.PET_PURCHASE));
        final ArazzoDocument petPurchaseJson = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.PET_PURCHASE_JSON));
        final ArazzoDocument orderWithRetries = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.ORDER_WITH_RETRIES));

        // when / then
        assertThat(validate(petPurchase)).isEmpty();
        assertThat(validate(petPurchaseJson)).isEmpty();
        assertThat(validate(orderWithRetries)).isEmpty();
    }

    @Test
    void testStepWithoutStepIdReportsExactlyOneError() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(HEADER + """
                workflows:
                  - workflowId: flow
                    steps:
                      - operationId: getThing
                """);
        final Step step = document.getWorkflows().get(0).getSteps().get(0);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).containsExactly(
                Diagnostic.error(DiagnosticCategory.STRUCTURAL_ERROR, "Missing required field: stepId", step.getRange()));
    }

    @Test
    void testStepWithoutOperationReferenceReportsExactlyOneError() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(HEADER + """
                workflows:
                  - workflowId: flow
                    steps:
                      - stepId: lost
                """);
        final Step step = document.getWorkflows().get(0).getSteps().get(0);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).containsExactly(
                Diagnostic.error(DiagnosticCategory.STRUCTURAL_ERROR, StepValidator.MISSING_OPERATION_REFERENCE, step.getRange()));
        assertThat(StepValidator.MISSING_OPERATION_REFERENCE)
                .contains("operationId", "operationPath", "workflowId");
    }

    @Test
    void testStepWithTwoOperationReferences() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(HEADER + """
                workflows:
                  - workflowId: flow
                    steps:
                      - stepId: both
                        operationId: getThing
                        operationPath: '{$sourceDescriptions.api.url}#/paths/~1things/get'
                """);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).extracting(Diagnostic::getMessage)
                .containsExactly(StepValidator.AMBIGUOUS_OPERATION_REFERENCE);
    }

    @Test
    void testMissingRootFields() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document("arazzo: '1.0'\n");

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics)
                .extracting(Diagnostic::getSeverity, Diagnostic::getMessage)
                .containsExactly(
                        tuple(DiagnosticSeverity.WARNING, "'arazzo' does not adhere to semantic versioning"),
                        tuple(DiagnosticSeverity.ERROR, "Missing required field: info"),
                        tuple(DiagnosticSeverity.ERROR, "Missing required field: sourceDescriptions"),
                        tuple(DiagnosticSeverity.ERROR, "Missing required field: workflows"));
    }

    @Test
    void testDuplicateIdentifiers() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document("""
                arazzo: 1.0.0
                info:
                  title: Test
                  version: 1.0.0
                sourceDescriptions:
                  - name: api
                    url: ./a.yaml
                  - name: api
                    url: ./b.yaml
                workflows:
                  - workflowId: flow
                    steps:
                      - stepId: same
                        operationId: getThing
                      - stepId: same
                        operationId: getOther
                """);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).extracting(Diagnostic::getMessage)
                .containsExactly(
                        "Source description name 'api' must be unique",
                        "Source description name 'api' must be unique",
                        "stepId 'same' must be unique within workflow 'flow'",
                        "stepId 'same' must be unique within workflow 'flow'");
    }

    @Test
    void testWorkflowReferences() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(HEADER + """
                workflows:
                  - workflowId: flow
                    dependsOn:
                      - flow
                      - ghost
                    steps:
                      - stepId: callOther
                        workflowId: phantom
                """);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics)
                .extracting(Diagnostic::getCategory, Diagnostic::getMessage)
                .containsExactly(
                        tuple(DiagnosticCategory.REFERENCE_ERROR, "Workflow 'flow' must not depend on itself"),
                        tuple(DiagnosticCategory.REFERENCE_ERROR, "'dependsOn' references workflow 'ghost' which does not exist"),
                        tuple(DiagnosticCategory.REFERENCE_ERROR, "Step 'callOther' references workflow 'phantom' which does not exist"));
    }

    @Test
    void testEmptyStepsAndMalformedSteps() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(HEADER + """
                workflows:
                  - workflowId: empty
                    steps: []
                  - workflowId: malformed
                    steps: not-a-list
                """);

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).extracting(Diagnostic::getMessage)
                .containsExactly("'steps' must contain at least one step");
    }

    @Test
    void testInvalidRootIsNotValidatedAgain() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document("just text");

        // when
        final List<Diagnostic> diagnostics = validate(document);

        // then
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void testMissingValidatorIsIllegalState() {
        // given
        final ArazzoDocument document = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.MINIMAL));
        final ArazzoValidatorRegistry infoOnly = new ArazzoValidatorRegistry(List.of(new InfoValidator()));

        // when / then
        assertThatThrownBy(() -> infoOnly.validate(document, ArazzoValidationOptions.ofDefault()))
                .isInstanceOf(ArazzoIllegalStateException.class)
                .hasMessage("No validator registered for 'SourceDescription'");
    }
}
