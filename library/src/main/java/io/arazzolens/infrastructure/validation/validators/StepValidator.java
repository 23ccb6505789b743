package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.reference.ActionTargetResolver;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import java.util.Map;
import java.util.Objects;

public class StepValidator implements ArazzoValidator<Step> {

    public static final String MISSING_OPERATION_REFERENCE =
            "Step must contain one of \"operationId\", \"operationPath\", or \"workflowId\"";
    public static final String AMBIGUOUS_OPERATION_REFERENCE =
            "Step must contain only one of \"operationId\", \"operationPath\", or \"workflowId\"";

    private final ParameterValidator parameterValidator = new ParameterValidator();
    private final RequestBodyValidator requestBodyValidator = new RequestBodyValidator();
    private final CriterionValidator criterionValidator = new CriterionValidator();
    private final ActionValidator actionValidator = new ActionValidator();
    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final Step step,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!step.isValid()) return result;

        var stepContext = context.toBuilder().step(step).build();
        Workflow workflow = context.getWorkflow();

        if (Strings.isNullOrEmpty(step.getStepId())) {
            if (!step.isMalformed("stepId")) result.addMissing("stepId", step);
        } else {
            if (validationOptions.isRecommendIdentifierFormat() && !isRecommendedIdFormat(step.getStepId())) {
                result.addWarning("stepId '%s' does not comply to [A-Za-z0-9_\\-]+".formatted(step.getStepId()), step.rangeOf("stepId"));
            }
            long occurrences = Objects.isNull(workflow) ? 1 : workflow.getSteps().stream()
                    .filter(other -> step.getStepId().equals(other.getStepId()))
                    .count();
            if (occurrences > 1) {
                result.addError("stepId '%s' must be unique within workflow '%s'".formatted(step.getStepId(), workflow.displayName()),
                        step.rangeOf("stepId"));
            }
        }

        int countSet = step.operationReferenceCount();
        if (countSet == 0) {
            if (!step.isMalformed("operationId") && !step.isMalformed("operationPath") && !step.isMalformed("workflowId")) {
                result.addError(MISSING_OPERATION_REFERENCE, step.getRange());
            }
        } else if (countSet > 1) {
            result.addError(AMBIGUOUS_OPERATION_REFERENCE, step.getRange());
        }

        validateOperationReference(step, stepContext, validationOptions, result);

        step.getParameters().forEach(parameter ->
                result.merge(parameterValidator.validate(parameter, stepContext, validationOptions)));

        if (Objects.nonNull(step.getRequestBody())) {
            result.merge(requestBodyValidator.validate(step.getRequestBody(), stepContext, validationOptions));
        }

        step.getSuccessCriteria().forEach(criterion ->
                result.merge(criterionValidator.validate(criterion, stepContext, validationOptions)));

        step.getOnSuccess().forEach(action ->
                result.merge(actionValidator.validate(action, stepContext, validationOptions)));
        step.getOnFailure().forEach(action ->
                result.merge(actionValidator.validate(action, stepContext, validationOptions)));

        for (Map.Entry<String, Located<String>> output : step.getOutputs().entrySet()) {
            if (!isValidKeyFormat(output.getKey())) {
                result.addError("Output key '%s' must comply to ^[a-zA-Z0-9.\\-_]+$".formatted(output.getKey()),
                        output.getValue().range());
            }
            if (validationOptions.isResolveExpressions()) {
                result.addAll(expressionResolver.resolveValue(output.getValue().value(), stepContext.at(output.getValue().range())));
            }
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Step.class.isAssignableFrom(clazz);
    }

    private void validateOperationReference(final Step step,
                                            final ResolutionContext stepContext,
                                            final ArazzoValidationOptions validationOptions,
                                            final ArazzoValidationResult result) {
        String workflowId = step.getWorkflowId();
        if (Objects.nonNull(workflowId)) {
            if (workflowId.startsWith(ActionTargetResolver.SOURCE_DESCRIPTIONS_PREFIX)) {
                result.addAll(expressionResolver.resolve(workflowId, stepContext.at(step.rangeOf("workflowId"))).getDiagnostics());
            } else if (stepContext.getDocument().findWorkflow(workflowId).isEmpty()) {
                result.addError(DiagnosticCategory.REFERENCE_ERROR,
                        "Step '%s' references workflow '%s' which does not exist".formatted(step.displayName(), workflowId),
                        step.rangeOf("workflowId"));
            }
        }

        // qualified references name their source description, e.g. $sourceDescriptions.petStore.loginUser
        String operationId = step.getOperationId();
        if (Objects.nonNull(operationId) && operationId.startsWith(ActionTargetResolver.SOURCE_DESCRIPTIONS_PREFIX)) {
            result.addAll(expressionResolver.resolve(operationId, stepContext.at(step.rangeOf("operationId"))).getDiagnostics());
        }
        if (Objects.nonNull(step.getOperationPath()) && validationOptions.isResolveExpressions()) {
            result.addAll(expressionResolver.resolveValue(step.getOperationPath(), stepContext.at(step.rangeOf("operationPath"))));
        }
    }

    private boolean isRecommendedIdFormat(final String stepId) {
        return stepId.matches("^[A-Za-z0-9_\\-]+$");
    }

    private boolean isValidKeyFormat(final String key) {
        return key.matches("^[a-zA-Z0-9.\\-_]+$");
    }
}
