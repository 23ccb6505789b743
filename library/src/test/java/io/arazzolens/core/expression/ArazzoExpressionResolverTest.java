package io.arazzolens.core.expression;

import io.arazzolens.ArazzoFixtures;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.diagnostic.DiagnosticSeverity;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.tree.SourceRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ArazzoExpressionResolverTest {

    private final ArazzoExpressionResolver resolver = new ArazzoExpressionResolver();

    private ArazzoDocument document;
    private ResolutionContext workflowContext;

    @BeforeEach
    void setUp() {
        document = ArazzoFixtures.document(ArazzoFixtures.read(ArazzoFixtures.PET_PURCHASE));
        workflowContext = ResolutionContext.builder()
                .document(document)
                .workflow(document.findWorkflow("purchasePet").orElseThrow())
                .range(SourceRange.of(10, 20))
                .build();
    }

    @Test
    void testResolveDeclaredStepOutput() {
        // when
        final ResolutionResult result = resolver.resolve("$steps.loginStep.outputs.sessionToken", workflowContext);

        // then
        assertThat(result.isValid()).isTrue();
        assertThat(result.getKind()).isEqualTo(ExpressionKind.STEPS);
        assertThat(result.getDiagnostics()).isEmpty();
    }

    @Test
    void testResolveUndeclaredStepOutputIsWarning() {
        // when
        final ResolutionResult result = resolver.resolve("$steps.loginStep.outputs.refreshToken", workflowContext);

        // then
        assertThat(result.isValid()).isTrue();
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getSeverity, Diagnostic::getCategory, Diagnostic::getMessage)
                .containsExactly(tuple(DiagnosticSeverity.WARNING, DiagnosticCategory.EXPRESSION_ERROR,
                        "Output 'refreshToken' is not declared by step 'loginStep'"));
    }

    @Test
    void testResolveUnknownStepIsError() {
        // when
        final ResolutionResult result = resolver.resolve("$steps.logoutStep.outputs.sessionToken", workflowContext);

        // then
        assertThat(result.isValid()).isFalse();
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getSeverity, Diagnostic::getMessage, Diagnostic::getRange)
                .containsExactly(tuple(DiagnosticSeverity.ERROR,
                        "Step 'logoutStep' is not declared in workflow 'purchasePet'", SourceRange.of(10, 20)));
    }

    @Test
    void testResolveMalformedExpressions() {
        // when
        final ResolutionResult noDollar = resolver.resolve("steps.loginStep", workflowContext);
        final ResolutionResult unknownPrefix = resolver.resolve("$foo.bar", workflowContext);
        final ResolutionResult emptySegment = resolver.resolve("$steps..outputs", workflowContext);
        final ResolutionResult missingOutputs = resolver.resolve("$steps.loginStep", workflowContext);

        // then
        assertThat(noDollar.getKind()).isEqualTo(ExpressionKind.INVALID);
        assertThat(noDollar.getDiagnostics()).extracting(Diagnostic::getMessage)
                .containsExactly("Runtime expression must start with '$': 'steps.loginStep'");
        assertThat(unknownPrefix.getDiagnostics()).extracting(Diagnostic::getMessage)
                .containsExactly("Unknown runtime expression prefix '$foo' in '$foo.bar'");
        assertThat(emptySegment.isValid()).isFalse();
        assertThat(missingOutputs.getDiagnostics()).extracting(Diagnostic::getMessage)
                .containsExactly("Expected '$steps.<stepId>.outputs.<name>' but was '$steps.loginStep'");
    }

    @Test
    void testResolveMessageExpressions() {
        // when / then
        assertThat(resolver.resolve("$statusCode", workflowContext).isValid()).isTrue();
        assertThat(resolver.resolve("$statusCode.value", workflowContext).isValid()).isFalse();
        assertThat(resolver.resolve("$response.body#/id", workflowContext).isValid()).isTrue();
        assertThat(resolver.resolve("$request.header.Authorization", workflowContext).isValid()).isTrue();
        assertThat(resolver.resolve("$request.header", workflowContext).isValid()).isFalse();
        assertThat(resolver.resolve("$response.cookie.session", workflowContext).isValid()).isFalse();
    }

    @Test
    void testResolveInputsAgainstDeclaredProperties() {
        // when
        final ResolutionResult declared = resolver.resolve("$inputs.username", workflowContext);
        final ResolutionResult undeclared = resolver.resolve("$inputs.email", workflowContext);

        // then
        assertThat(declared.getDiagnostics()).isEmpty();
        assertThat(undeclared.isValid()).isTrue();
        assertThat(undeclared.getDiagnostics()).extracting(Diagnostic::getMessage)
                .containsExactly("Input 'email' is not declared in the inputs of workflow 'purchasePet'");
    }

    @Test
    void testResolveDocumentLevelReferences() {
        // given
        final ResolutionContext documentContext = ResolutionContext.of(document);

        // when / then
        assertThat(resolver.resolve("$sourceDescriptions.petStore.url", documentContext).isValid()).isTrue();
        assertThat(resolver.resolve("$sourceDescriptions.shop", documentContext).getDiagnostics())
                .extracting(Diagnostic::getMessage)
                .containsExactly("Source description 'shop' is not declared");
        assertThat(resolver.resolve("$workflows.purchasePet.outputs.pet", documentContext).getDiagnostics()).isEmpty();
        assertThat(resolver.resolve("$workflows.refund.outputs.pet", documentContext).isValid()).isFalse();
        assertThat(resolver.resolve("$steps.getPetStep.outputs.pet", documentContext).getDiagnostics()).isEmpty();
        assertThat(resolver.resolve("$components.parameters.page", documentContext).getDiagnostics())
                .extracting(Diagnostic::getCategory, Diagnostic::getMessage)
                .containsExactly(tuple(DiagnosticCategory.REFERENCE_ERROR,
                        "Component 'page' is not declared in components.parameters"));
    }

    @Test
    void testResolveValueWithTemplates() {
        // when
        final var constant = resolver.resolveValue("application/json", workflowContext);
        final var template = resolver.resolveValue("Bearer {$steps.loginStep.outputs.sessionToken}", workflowContext);
        final var brokenTemplate = resolver.resolveValue("Bearer {$steps.nobody.outputs.token}", workflowContext);
        final var unterminated = resolver.resolveValue("Bearer {$inputs.username", workflowContext);

        // then
        assertThat(constant).isEmpty();
        assertThat(template).isEmpty();
        assertThat(brokenTemplate).extracting(Diagnostic::getMessage)
                .containsExactly("Step 'nobody' is not declared in workflow 'purchasePet'");
        assertThat(unterminated).extracting(Diagnostic::getMessage)
                .containsExactly("Unmatched '{$' in expression: Bearer {$inputs.username");
    }

    @Test
    void testResolveEmbeddedExpressionsInConditions() {
        // when
        final var valid = resolver.resolveEmbedded("$statusCode == 200 && $response.body#/available == true", workflowContext);
        final var invalid = resolver.resolveEmbedded("$statusCode == 200 && $steps.ghost.outputs.id != null", workflowContext);

        // then
        assertThat(valid).isEmpty();
        assertThat(invalid).extracting(Diagnostic::getMessage)
                .containsExactly("Step 'ghost' is not declared in workflow 'purchasePet'");
    }
}
