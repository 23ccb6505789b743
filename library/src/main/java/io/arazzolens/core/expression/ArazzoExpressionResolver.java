package io.arazzolens.core.expression;

import com.google.common.base.Joiner;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Components;
import io.arazzolens.core.model.Components.ComponentCategory;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static resolver for runtime expressions: checks syntax and that well-known segments (step ids,
 * workflow ids, source names, component names) exist in the model. Nothing is evaluated.
 */
@Slf4j
public class ArazzoExpressionResolver implements ExpressionResolver {

    private static final Set<String> REQUEST_SOURCES = Set.of("header", "query", "path", "body");
    private static final Set<String> RESPONSE_SOURCES = Set.of("header", "body");
    private static final Set<String> WORKFLOW_MEMBERS = Set.of("inputs", "outputs");

    @Override
    public ResolutionResult resolve(final String expression, final ResolutionContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        RuntimeExpression parsed;
        try {
            parsed = RuntimeExpressionParser.parse(expression);
        } catch (ExpressionSyntaxException e) {
            diagnostics.add(expressionError(e.getMessage(), context));
            return ResolutionResult.of(ExpressionKind.INVALID, diagnostics);
        }

        switch (parsed.getKind()) {
            case URL:
            case METHOD:
            case STATUS_CODE:
                if (!parsed.getSegments().isEmpty() || parsed.hasPointer()) {
                    diagnostics.add(expressionError(
                            "'$%s' does not accept further segments: '%s'".formatted(parsed.getKind().getValue(), expression), context));
                }
                break;
            case REQUEST:
                resolveMessageSource(parsed, REQUEST_SOURCES, context, diagnostics);
                break;
            case RESPONSE:
                resolveMessageSource(parsed, RESPONSE_SOURCES, context, diagnostics);
                break;
            case INPUTS:
                resolveInputs(parsed, context, diagnostics);
                break;
            case OUTPUTS:
                resolveOutputs(parsed, context, diagnostics);
                break;
            case STEPS:
                resolveSteps(parsed, context, diagnostics);
                break;
            case WORKFLOWS:
                resolveWorkflows(parsed, context, diagnostics);
                break;
            case SOURCE_DESCRIPTIONS:
                resolveSourceDescriptions(parsed, context, diagnostics);
                break;
            case COMPONENTS:
                resolveComponents(parsed, context, diagnostics);
                break;
            default:
                break;
        }

        if (!diagnostics.isEmpty()) {
            log.debug("Resolved '{}' with {} diagnostic(s)", expression, diagnostics.size());
        }
        return ResolutionResult.of(parsed.getKind(), diagnostics);
    }

    /**
     * Resolves a value that may be a runtime expression, a string with {@code {$...}} templates,
     * or a constant.
     */
    public List<Diagnostic> resolveValue(final String value, final ResolutionContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (Objects.isNull(value)) return diagnostics;
        if (value.startsWith("$")) {
            diagnostics.addAll(resolve(value, context).getDiagnostics());
            return diagnostics;
        }
        try {
            RuntimeExpressionParser.templates(value)
                    .forEach(template -> diagnostics.addAll(resolve(template, context).getDiagnostics()));
        } catch (ExpressionSyntaxException e) {
            diagnostics.add(expressionError(e.getMessage(), context));
        }
        return diagnostics;
    }

    /**
     * Resolves the runtime expressions occurring anywhere in free text, e.g. {@code $statusCode == 200}.
     */
    public List<Diagnostic> resolveEmbedded(final String text, final ResolutionContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        RuntimeExpressionParser.embedded(text)
                .forEach(expression -> diagnostics.addAll(resolve(expression, context).getDiagnostics()));
        return diagnostics;
    }

    private void resolveMessageSource(final RuntimeExpression parsed,
                                      final Set<String> sources,
                                      final ResolutionContext context,
                                      final List<Diagnostic> diagnostics) {
        String prefix = parsed.getKind().getValue();
        String source = parsed.segment(0);
        if (Objects.isNull(source) || !sources.contains(source)) {
            diagnostics.add(expressionError("'$%s' must be followed by one of %s: '%s'"
                    .formatted(prefix, Joiner.on(", ").join(sources.stream().sorted().toList()), parsed.getText()), context));
            return;
        }
        if ("body".equals(source)) return;
        if (parsed.getSegments().size() != 2 || parsed.hasPointer()) {
            diagnostics.add(expressionError("'$%s.%s' requires exactly one name: '%s'"
                    .formatted(prefix, source, parsed.getText()), context));
        }
    }

    private void resolveInputs(final RuntimeExpression parsed,
                               final ResolutionContext context,
                               final List<Diagnostic> diagnostics) {
        String name = parsed.segment(0);
        if (Objects.isNull(name)) {
            diagnostics.add(expressionError("'$inputs' requires an input name: '%s'".formatted(parsed.getText()), context));
            return;
        }
        Workflow workflow = context.getWorkflow();
        if (Objects.nonNull(workflow)
                && !workflow.getInputProperties().isEmpty()
                && !workflow.getInputProperties().contains(name)) {
            diagnostics.add(expressionWarning("Input '%s' is not declared in the inputs of workflow '%s'"
                    .formatted(name, workflow.displayName()), context));
        }
    }

    private void resolveOutputs(final RuntimeExpression parsed,
                                final ResolutionContext context,
                                final List<Diagnostic> diagnostics) {
        String name = parsed.segment(0);
        if (Objects.isNull(name)) {
            diagnostics.add(expressionError("'$outputs' requires an output name: '%s'".formatted(parsed.getText()), context));
            return;
        }
        Workflow workflow = context.getWorkflow();
        if (Objects.nonNull(workflow) && workflow.declaresOutputs() && !workflow.getOutputs().containsKey(name)) {
            diagnostics.add(expressionWarning("Output '%s' is not declared by workflow '%s'"
                    .formatted(name, workflow.displayName()), context));
        }
    }

    private void resolveSteps(final RuntimeExpression parsed,
                              final ResolutionContext context,
                              final List<Diagnostic> diagnostics) {
        String stepId = parsed.segment(0);
        if (Objects.isNull(stepId) || !"outputs".equals(parsed.segment(1))) {
            diagnostics.add(expressionError("Expected '$steps.<stepId>.outputs.<name>' but was '%s'"
                    .formatted(parsed.getText()), context));
            return;
        }

        Optional<Step> step = findStepInScope(stepId, context);
        if (step.isEmpty()) {
            String scope = Objects.nonNull(context.getWorkflow())
                    ? "workflow '%s'".formatted(context.getWorkflow().displayName())
                    : "the document";
            diagnostics.add(expressionError("Step '%s' is not declared in %s".formatted(stepId, scope), context));
            return;
        }

        String outputName = parsed.segment(2);
        if (Objects.nonNull(outputName) && !step.get().getOutputs().containsKey(outputName)) {
            // may still be a field of the operation's response
            diagnostics.add(expressionWarning("Output '%s' is not declared by step '%s'".formatted(outputName, stepId), context));
        }
    }

    private Optional<Step> findStepInScope(final String stepId, final ResolutionContext context) {
        Workflow workflow = context.getWorkflow();
        if (Objects.isNull(workflow)) {
            return context.getDocument().getWorkflows().stream()
                    .map(candidate -> candidate.findStep(stepId))
                    .flatMap(Optional::stream)
                    .findFirst();
        }
        Optional<Step> step = workflow.findStep(stepId);
        if (step.isPresent() || !context.isDependencyStepsInScope()) return step;

        return workflow.getDependsOn().stream()
                .map(Located::value)
                .map(context.getDocument()::findWorkflow)
                .flatMap(Optional::stream)
                .map(dependency -> dependency.findStep(stepId))
                .flatMap(Optional::stream)
                .findFirst();
    }

    private void resolveWorkflows(final RuntimeExpression parsed,
                                  final ResolutionContext context,
                                  final List<Diagnostic> diagnostics) {
        String workflowId = parsed.segment(0);
        String member = parsed.segment(1);
        if (Objects.isNull(workflowId) || !WORKFLOW_MEMBERS.contains(member)) {
            diagnostics.add(expressionError("Expected '$workflows.<workflowId>.outputs.<name>' or '$workflows.<workflowId>.inputs.<name>' but was '%s'"
                    .formatted(parsed.getText()), context));
            return;
        }
        Optional<Workflow> workflow = context.getDocument().findWorkflow(workflowId);
        if (workflow.isEmpty()) {
            diagnostics.add(expressionError("Workflow '%s' is not declared".formatted(workflowId), context));
            return;
        }
        String name = parsed.segment(2);
        if (Objects.isNull(name)) return;
        if ("outputs".equals(member) && !workflow.get().getOutputs().containsKey(name)) {
            diagnostics.add(expressionWarning("Output '%s' is not declared by workflow '%s'".formatted(name, workflowId), context));
        } else if ("inputs".equals(member)
                && !workflow.get().getInputProperties().isEmpty()
                && !workflow.get().getInputProperties().contains(name)) {
            diagnostics.add(expressionWarning("Input '%s' is not declared in the inputs of workflow '%s'".formatted(name, workflowId), context));
        }
    }

    private void resolveSourceDescriptions(final RuntimeExpression parsed,
                                           final ResolutionContext context,
                                           final List<Diagnostic> diagnostics) {
        String name = parsed.segment(0);
        if (Objects.isNull(name)) {
            diagnostics.add(expressionError("'$sourceDescriptions' requires a source name: '%s'".formatted(parsed.getText()), context));
            return;
        }
        if (context.getDocument().findSourceDescription(name).isEmpty()) {
            diagnostics.add(expressionError("Source description '%s' is not declared".formatted(name), context));
        }
    }

    private void resolveComponents(final RuntimeExpression parsed,
                                   final ResolutionContext context,
                                   final List<Diagnostic> diagnostics) {
        String categoryName = parsed.segment(0);
        String name = parsed.segment(1);
        if (Objects.isNull(categoryName) || Objects.isNull(name)) {
            diagnostics.add(expressionError("Expected '$components.<category>.<name>' but was '%s'".formatted(parsed.getText()), context));
            return;
        }
        Optional<ComponentCategory> category = ComponentCategory.fromValue(categoryName);
        if (category.isEmpty()) {
            diagnostics.add(expressionError("Unknown components category '%s'; expected one of %s".formatted(
                    categoryName,
                    Joiner.on(", ").join(Arrays.stream(ComponentCategory.values()).map(ComponentCategory::getValue).toList())),
                    context));
            return;
        }
        Components components = context.getDocument().getComponentsOrEmpty();
        if (!components.contains(category.get(), name)) {
            diagnostics.add(Diagnostic.error(DiagnosticCategory.REFERENCE_ERROR,
                    "Component '%s' is not declared in components.%s".formatted(name, categoryName), context.getRange()));
        }
    }

    private static Diagnostic expressionError(final String message, final ResolutionContext context) {
        return Diagnostic.error(DiagnosticCategory.EXPRESSION_ERROR, message, context.getRange());
    }

    private static Diagnostic expressionWarning(final String message, final ResolutionContext context) {
        return Diagnostic.warning(DiagnosticCategory.EXPRESSION_ERROR, message, context.getRange());
    }
}
