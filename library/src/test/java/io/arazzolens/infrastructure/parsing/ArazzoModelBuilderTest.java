package io.arazzolens.infrastructure.parsing;

import io.arazzolens.ArazzoFixtures;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticSeverity;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.EntityType;
import io.arazzolens.core.model.GotoAction;
import io.arazzolens.core.model.InvalidAction;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.ReferencedAction;
import io.arazzolens.core.model.RetryAction;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ArazzoModelBuilderTest {

    @Test
    void testBuildPetPurchase() {
        // given
        final String content = ArazzoFixtures.read(ArazzoFixtures.PET_PURCHASE);

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics()).isEmpty();
        assertThat(result.hasStubs()).isFalse();
        final ArazzoDocument document = result.getDocument();
        assertThat(document.getArazzo()).isEqualTo("1.0.0");
        assertThat(document.getInfo().getTitle()).isEqualTo("Pet purchase");
        assertThat(document.getSourceDescriptions())
                .extracting("name", "url")
                .containsExactly(tuple("petStore", "https://petstore3.swagger.io/api/v3/openapi.json"));

        final Workflow workflow = document.getWorkflows().get(0);
        assertThat(workflow.getWorkflowId()).isEqualTo("purchasePet");
        assertThat(workflow.getInputProperties()).containsExactly("username", "password", "petId");
        assertThat(workflow.getSteps()).extracting(Step::getStepId).containsExactly("loginStep", "getPetStep");
        assertThat(workflow.getSteps()).extracting(Step::getIndex).containsExactly(0, 1);
        assertThat(workflow.getOutputs()).containsOnlyKeys("pet");

        final Step loginStep = workflow.getSteps().get(0);
        assertThat(loginStep.getOperationId()).isEqualTo("loginUser");
        assertThat(loginStep.getParameters()).extracting("name", "in", "value")
                .containsExactly(
                        tuple("username", "query", "$inputs.username"),
                        tuple("password", "query", "$inputs.password"));
        assertThat(loginStep.getOutputs().get("sessionToken").value()).isEqualTo("$response.body");
        assertThat(loginStep.rangeOf("stepId")).isNotEqualTo(loginStep.getRange());
    }

    @Test
    void testStepsNotAnArrayIsReportedOnce() {
        // given
        final String content = """
                arazzo: 1.0.0
                workflows:
                  - workflowId: broken
                    steps: oops
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly("'steps' must be an array");
        final Workflow workflow = result.getDocument().getWorkflows().get(0);
        assertThat(workflow.isMalformed("steps")).isTrue();
        assertThat(workflow.getSteps()).isEmpty();
    }

    @Test
    void testStepThatIsNotAnObjectBecomesStub() {
        // given
        final String content = """
                workflows:
                  - workflowId: partial
                    steps:
                      - just a string
                      - stepId: real
                        operationId: getThing
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getStubs())
                .extracting("type", "path")
                .containsExactly(tuple(EntityType.STEP, "workflows[0].steps[0]"));
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly("'workflows[0].steps[0]' must be an object");

        final Workflow workflow = result.getDocument().getWorkflows().get(0);
        assertThat(workflow.getSteps()).hasSize(2);
        assertThat(workflow.getSteps().get(0).isValid()).isFalse();
        assertThat(workflow.getSteps().get(1).isValid()).isTrue();
        assertThat(workflow.getSteps().get(1).getIndex()).isEqualTo(1);
    }

    @Test
    void testRootThatIsNotAnObject() {
        // given
        final String content = "- a\n- b\n";

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDocument().isValid()).isFalse();
        assertThat(result.getStubs()).extracting("type").containsExactly(EntityType.DOCUMENT);
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly("Arazzo description must be an object");
    }

    @Test
    void testActionsAreTypedByTheirTypeField() {
        // given
        final String content = """
                workflows:
                  - workflowId: flow
                    steps:
                      - stepId: first
                        operationId: getThing
                        onSuccess:
                          - name: jump
                            type: goto
                            stepId: first
                          - name: odd
                            type: teleport
                        onFailure:
                          - name: again
                            type: retry
                            stepId: first
                            retryAfter: 1.5
                          - reference: $components.failureActions.shared
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        final Step step = result.getDocument().getWorkflows().get(0).getSteps().get(0);
        assertThat(step.getOnSuccess().get(0)).isInstanceOf(GotoAction.class);
        assertThat(((GotoAction) step.getOnSuccess().get(0)).getStepId()).isEqualTo("first");
        assertThat(step.getOnSuccess().get(1)).isInstanceOf(InvalidAction.class);
        assertThat(((InvalidAction) step.getOnSuccess().get(1)).getTypeValue()).isEqualTo("teleport");

        final RetryAction retry = (RetryAction) step.getOnFailure().get(0);
        assertThat(retry.getRetryLimit()).isEqualTo(RetryAction.DEFAULT_RETRY_LIMIT);
        assertThat(retry.getRetryAfter()).isEqualByComparingTo(new BigDecimal("1.5"));
        assertThat(step.getOnFailure().get(1)).isInstanceOf(ReferencedAction.class);
        assertThat(((ReferencedAction) step.getOnFailure().get(1)).getReference())
                .isEqualTo("$components.failureActions.shared");
    }

    @Test
    void testRetryLimitOutsideIntegerRangeIsNotTruncated() {
        // given
        final String content = """
                workflows:
                  - workflowId: flow
                    steps:
                      - stepId: first
                        operationId: getThing
                        onFailure:
                          - name: wrapped
                            type: retry
                            stepId: first
                            retryLimit: 4294967297
                          - name: negative
                            type: retry
                            stepId: first
                            retryLimit: 2147483648
                          - name: fits
                            type: retry
                            stepId: first
                            retryLimit: 2147483647
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly(
                        "'retryLimit' must be an integer between -2147483648 and 2147483647",
                        "'retryLimit' must be an integer between -2147483648 and 2147483647");
        final Step step = result.getDocument().getWorkflows().get(0).getSteps().get(0);
        final RetryAction wrapped = (RetryAction) step.getOnFailure().get(0);
        assertThat(wrapped.isMalformed("retryLimit")).isTrue();
        assertThat(wrapped.getRetryLimit()).isEqualTo(RetryAction.DEFAULT_RETRY_LIMIT);
        assertThat(((RetryAction) step.getOnFailure().get(1)).isMalformed("retryLimit")).isTrue();
        assertThat(((RetryAction) step.getOnFailure().get(2)).getRetryLimit()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void testEmptyOutputsAndDependenciesAreReported() {
        // given
        final String content = """
                workflows:
                  - workflowId: flow
                    dependsOn:
                      - null
                      - other
                    steps:
                      - stepId: first
                        operationId: getThing
                        outputs:
                          available:
                          id: $response.body#/id
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly(
                        "'workflows[0].dependsOn[0]' must be a non-empty string",
                        "'workflows[0].steps[0].outputs.available' must be a string");
        final Workflow workflow = result.getDocument().getWorkflows().get(0);
        assertThat(workflow.getDependsOn()).extracting(Located::value).containsExactly("other");
        assertThat(workflow.getSteps().get(0).getOutputs()).containsOnlyKeys("id");
    }

    @Test
    void testUnexpectedAndReservedAttributesAreWarnings() {
        // given
        final String content = """
                arazzo: 1.0.0
                x-internal: kept
                x-oai-flag: true
                info:
                  title: Test
                  version: 1.0.0
                  colour: blue
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getSeverity, Diagnostic::getMessage)
                .containsExactlyInAnyOrder(
                        tuple(DiagnosticSeverity.WARNING, "Attribute 'x-oai-flag' uses a prefix reserved by the OpenAPI Initiative"),
                        tuple(DiagnosticSeverity.WARNING, "Attribute 'info.colour' is unexpected"));
    }

    @Test
    void testUnexpectedAttributesCanBeIgnored() {
        // given
        final String content = "arazzo: 1.0.0\ncolour: blue\n";
        final ArazzoParseOptions options = ArazzoParseOptions.builder()
                .reportUnexpectedAttributes(false)
                .build();

        // when
        final ModelBuildResult result = new ArazzoModelBuilder(options).build(new RangedNodeReader().read(content).getRoot());

        // then
        assertThat(result.getDiagnostics()).isEmpty();
    }

    @Test
    void testInputsReferenceResolvesThroughComponents() {
        // given
        final String content = ArazzoFixtures.read(ArazzoFixtures.ORDER_WITH_RETRIES);

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics()).isEmpty();
        final Workflow workflow = result.getDocument().findWorkflow("placeOrder").orElseThrow();
        assertThat(workflow.getInputProperties()).containsExactly("cartId");
        assertThat(workflow.getDependsOn()).extracting(Located::value).containsExactly("prepareCart");
    }

    @Test
    void testDanglingInputsReferenceIsReferenceError() {
        // given
        final String content = """
                workflows:
                  - workflowId: flow
                    inputs:
                      $ref: '#/components/inputs/missing'
                    steps:
                      - stepId: only
                        operationId: getThing
                """;

        // when
        final ModelBuildResult result = ArazzoFixtures.build(content);

        // then
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly("Inputs reference '#/components/inputs/missing' does not resolve to an entry of components.inputs");
    }
}
