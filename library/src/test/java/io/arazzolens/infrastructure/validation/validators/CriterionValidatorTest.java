package io.arazzolens.infrastructure.validation.validators;

import io.arazzolens.ArazzoFixtures;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.diagnostic.DiagnosticSeverity;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Criterion;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class CriterionValidatorTest {

    private static final String DOCUMENT = """
            arazzo: 1.0.0
            info:
              title: Criteria
              version: 1.0.0
            sourceDescriptions:
              - name: api
                url: ./openapi.yaml
            workflows:
              - workflowId: flow
                steps:
                  - stepId: check
                    operationId: getThing
                    successCriteria:
                      - condition: $statusCode == 200
                      - condition: $steps.nowhere.outputs.id == 1
                      - context: $response.body
                        condition: '^2\\d\\d$'
                        type: regex
                      - context: $response.body
                        condition: '[unclosed'
                        type: regex
                      - context: $response.body
                        condition: "$.pets[?(@.status == 'available')]"
                        type: jsonpath
                      - context: $response.body
                        condition: $.store.
                        type: jsonpath
                      - context: $response.body
                        condition: "//pet[@id='1']"
                        type: xpath
                      - context: $response.body
                        condition: //pet[
                        type: xpath
                      - condition: '^ok$'
                        type: regex
                      - context: $response.body
                        condition: ok
                        type: fuzzy
                      - context: body
                        condition: $statusCode == 200
                      - context: $response.body
                        condition: //pet
                        type:
                          type: xpath
                          version: xpath-30
                      - context: $response.body
                        condition: $.pets
                        type:
                          type: jsonpath
                      - context: $response.body
                        condition: '^a$'
                        type:
                          type: regex
                          version: draft
                      - context: $response.body
                        condition: $.pets
                        type:
                          type: jsonpath
                          version: rfc9535
                      - context: $response.body
            """;

    private final CriterionValidator validator = new CriterionValidator();

    private List<Criterion> criteria;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        final ArazzoDocument document = ArazzoFixtures.document(DOCUMENT);
        final Workflow workflow = document.getWorkflows().get(0);
        final Step step = workflow.getSteps().get(0);
        criteria = step.getSuccessCriteria();
        context = ResolutionContext.builder().document(document).workflow(workflow).step(step).build();
    }

    private List<Diagnostic> validate(final int index, final ArazzoValidationOptions options) {
        return validator.validate(criteria.get(index), context, options).getDiagnostics();
    }

    private List<String> messages(final int index) {
        return validate(index, ArazzoValidationOptions.ofDefault()).stream()
                .map(Diagnostic::getMessage)
                .toList();
    }

    @Test
    void testSimpleConditions() {
        // when / then
        assertThat(messages(0)).isEmpty();
        assertThat(messages(1)).singleElement().satisfies(message ->
                assertThat(message).startsWith("Step 'nowhere' is not declared"));
    }

    @Test
    void testConditionIsRequired() {
        // when / then
        assertThat(messages(15)).containsExactly("Missing required field: condition");
    }

    @Test
    void testRegexConditionMustCompile() {
        // when
        final List<Diagnostic> diagnostics = validate(3, ArazzoValidationOptions.ofDefault());

        // then
        assertThat(messages(2)).isEmpty();
        assertThat(diagnostics)
                .extracting(Diagnostic::getCategory, Diagnostic::getMessage, Diagnostic::getRange)
                .containsExactly(tuple(DiagnosticCategory.EXPRESSION_ERROR,
                        "Condition '[unclosed' is an invalid regex",
                        criteria.get(3).rangeOf("condition")));
    }

    @Test
    void testJsonPathConditionMustCompile() {
        // when / then
        assertThat(messages(4)).isEmpty();
        assertThat(messages(5)).containsExactly("Condition '$.store.' contains invalid JSONPath");
    }

    @Test
    void testXPathConditionMustCompile() {
        // when / then
        assertThat(messages(6)).isEmpty();
        assertThat(messages(7)).containsExactly("Condition '//pet[' contains invalid XPath");
    }

    @Test
    void testSyntaxCheckCanBeDisabled() {
        // given
        final ArazzoValidationOptions options = ArazzoValidationOptions.builder()
                .resolveExpressions(true)
                .validateCriterionSyntax(false)
                .build();

        // when / then
        assertThat(validate(3, options)).isEmpty();
        assertThat(validate(5, options)).isEmpty();
        assertThat(validate(7, options)).isEmpty();
    }

    @Test
    void testTypedCriterionRequiresContext() {
        // when / then
        assertThat(messages(8)).containsExactly("Criterion of type 'regex' requires 'context' to be defined");
    }

    @Test
    void testUnknownType() {
        // when / then
        assertThat(messages(9)).containsExactly("'type' must be one of simple, regex, jsonpath, xpath but was 'fuzzy'");
    }

    @Test
    void testConstantContextIsWarning() {
        // when
        final List<Diagnostic> diagnostics = validate(10, ArazzoValidationOptions.ofDefault());

        // then
        assertThat(diagnostics)
                .extracting(Diagnostic::getSeverity, Diagnostic::getMessage)
                .containsExactly(tuple(DiagnosticSeverity.WARNING, "Expected 'context' to be a runtime expression"));
    }

    @Test
    void testExpressionTypeObjects() {
        // when / then
        assertThat(criteria.get(11).isExpressionTypeObject()).isTrue();
        assertThat(messages(11)).isEmpty();
        assertThat(messages(12)).containsExactly("Missing required field: version");
        assertThat(messages(13)).containsExactly("Criterion expression type must be 'jsonpath' or 'xpath'");
        assertThat(messages(14)).containsExactly("Unknown version 'rfc9535' for criterion type 'jsonpath'");
    }
}
