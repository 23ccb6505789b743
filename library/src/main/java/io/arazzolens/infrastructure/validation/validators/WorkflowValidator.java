package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.Parameter;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.reference.ActionTargetResolver;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class WorkflowValidator implements ArazzoValidator<Workflow> {

    private final StepValidator stepValidator = new StepValidator();
    private final ActionValidator actionValidator = new ActionValidator();
    private final ParameterValidator parameterValidator = new ParameterValidator();
    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final Workflow workflow,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!workflow.isValid()) return result;

        var workflowContext = context.toBuilder().workflow(workflow).step(null).build();
        String workflowId = workflow.getWorkflowId();

        if (Strings.isNullOrEmpty(workflowId)) {
            if (!workflow.isMalformed("workflowId")) result.addMissing("workflowId", workflow);
        } else {
            if (validationOptions.isRecommendIdentifierFormat() && !isRecommendedIdFormat(workflowId)) {
                result.addWarning("workflowId '%s' does not comply to [A-Za-z0-9_\\-]+".formatted(workflowId), workflow.rangeOf("workflowId"));
            }
            long occurrences = context.getDocument().getWorkflows().stream()
                    .filter(other -> workflowId.equals(other.getWorkflowId()))
                    .count();
            if (occurrences > 1) {
                result.addError("workflowId '%s' must be unique".formatted(workflowId), workflow.rangeOf("workflowId"));
            }
        }

        validateDependsOn(workflow, workflowContext, result);

        if (!workflow.has("steps")) {
            result.addMissing("steps", workflow);
        } else if (workflow.getSteps().isEmpty() && !workflow.isMalformed("steps")) {
            result.addError("'steps' must contain at least one step", workflow.rangeOf("steps"));
        }
        workflow.getSteps().forEach(step ->
                result.merge(stepValidator.validate(step, workflowContext, validationOptions)));

        workflow.getSuccessActions().forEach(action ->
                result.merge(actionValidator.validate(action, workflowContext, validationOptions)));
        workflow.getFailureActions().forEach(action ->
                result.merge(actionValidator.validate(action, workflowContext, validationOptions)));

        // workflow outputs may read steps of the workflows it depends on
        var outputsContext = workflowContext.toBuilder().dependencyStepsInScope(true).build();
        for (Map.Entry<String, Located<String>> output : workflow.getOutputs().entrySet()) {
            if (!isValidKeyFormat(output.getKey())) {
                result.addError("Output key '%s' must comply to ^[a-zA-Z0-9.\\-_]+$".formatted(output.getKey()),
                        output.getValue().range());
            }
            if (validationOptions.isResolveExpressions()) {
                result.addAll(expressionResolver.resolveValue(output.getValue().value(), outputsContext.at(output.getValue().range())));
            }
        }

        Set<String> parameterKeys = new HashSet<>();
        for (Parameter parameter : workflow.getParameters()) {
            String key = parameter.isReference() ? parameter.getReference() : parameter.getName() + "@" + parameter.getIn();
            if (Objects.nonNull(parameter.getName()) || parameter.isReference()) {
                if (!parameterKeys.add(key)) {
                    result.addError("Parameter '%s' is declared more than once".formatted(
                            parameter.isReference() ? parameter.getReference() : parameter.getName()), parameter.getRange());
                }
            }
            result.merge(parameterValidator.validate(parameter, workflowContext, validationOptions));
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Workflow.class.isAssignableFrom(clazz);
    }

    private void validateDependsOn(final Workflow workflow,
                                   final ResolutionContext workflowContext,
                                   final ArazzoValidationResult result) {
        Set<String> seen = new HashSet<>();
        for (Located<String> dependency : workflow.getDependsOn()) {
            String dependencyId = dependency.value();
            if (!seen.add(dependencyId)) {
                result.addWarning("'dependsOn' lists '%s' more than once".formatted(dependencyId), dependency.range());
                continue;
            }
            if (dependencyId.startsWith(ActionTargetResolver.SOURCE_DESCRIPTIONS_PREFIX)) {
                result.addAll(expressionResolver.resolve(dependencyId, workflowContext.at(dependency.range())).getDiagnostics());
            } else if (dependencyId.equals(workflow.getWorkflowId())) {
                result.addError(DiagnosticCategory.REFERENCE_ERROR,
                        "Workflow '%s' must not depend on itself".formatted(dependencyId), dependency.range());
            } else if (workflowContext.getDocument().findWorkflow(dependencyId).isEmpty()) {
                result.addError(DiagnosticCategory.REFERENCE_ERROR,
                        "'dependsOn' references workflow '%s' which does not exist".formatted(dependencyId), dependency.range());
            }
        }
    }

    private boolean isRecommendedIdFormat(final String workflowId) {
        return workflowId.matches("^[A-Za-z0-9_\\-]+$");
    }

    private boolean isValidKeyFormat(final String key) {
        return key.matches("^[a-zA-Z0-9.\\-_]+$");
    }
}
