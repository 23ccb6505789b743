package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Action;
import io.arazzolens.core.model.ActionKind;
import io.arazzolens.core.model.EndAction;
import io.arazzolens.core.model.GotoAction;
import io.arazzolens.core.model.InvalidAction;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.ReferencedAction;
import io.arazzolens.core.model.RetryAction;
import io.arazzolens.core.model.TransferAction;
import io.arazzolens.core.reference.ActionTargetResolver;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Validates success and failure actions, including reusable references to components.
 */
public class ActionValidator implements ArazzoValidator<Action> {

    private final CriterionValidator criterionValidator = new CriterionValidator();
    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final Action action,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!action.isValid()) return result;

        if (action instanceof ReferencedAction) {
            // the components entry itself is validated once, under components
            result.addAll(ActionTargetResolver.resolve(action, context.getWorkflow(), context.getDocument()).getDiagnostics());
            return result;
        }

        // unnamed actions are labelled by their type
        if (Strings.isNullOrEmpty(action.getName()) && !action.isMalformed("name")) {
            result.addWarning("Action has no 'name'", action.getRange());
        }

        if (action instanceof InvalidAction invalidAction) {
            if (Objects.isNull(invalidAction.getTypeValue())) {
                if (!action.isMalformed("type")) result.addMissing("type", action);
            } else {
                result.addError("'type' must be one of end, goto, retry but was '%s'".formatted(invalidAction.getTypeValue()),
                        action.rangeOf("type"));
            }
        } else if (action instanceof EndAction) {
            if (action.has("stepId") || action.has("workflowId")) {
                result.addError("'end' actions must not declare 'stepId' or 'workflowId'", action.getRange());
            }
            validateNoRetryFields(action, result);
        } else if (action instanceof GotoAction gotoAction) {
            validateTargetCount(gotoAction, result);
            validateNoRetryFields(action, result);
            result.addAll(ActionTargetResolver.resolve(action, context.getWorkflow(), context.getDocument()).getDiagnostics());
        } else if (action instanceof RetryAction retryAction) {
            if (action.getKind() == ActionKind.SUCCESS) {
                result.addError("'retry' actions are not permitted in success actions", action.rangeOf("type"));
            }
            validateTargetCount(retryAction, result);
            if (retryAction.getRetryLimit() < 1) {
                result.addError("'retryLimit' must be an integer >= 1", action.rangeOf("retryLimit"));
            }
            if (Objects.nonNull(retryAction.getRetryAfter()) && retryAction.getRetryAfter().compareTo(BigDecimal.ZERO) < 0) {
                result.addError("'retryAfter' must be a non-negative number of seconds", action.rangeOf("retryAfter"));
            }
            result.addAll(ActionTargetResolver.resolve(action, context.getWorkflow(), context.getDocument()).getDiagnostics());
        }

        action.getCriteria().forEach(criterion ->
                result.merge(criterionValidator.validate(criterion, context, validationOptions)));

        if (validationOptions.isResolveExpressions()) {
            for (Located<String> output : action.getOutputs().values()) {
                result.addAll(expressionResolver.resolveValue(output.value(), context.at(output.range())));
            }
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Action.class.isAssignableFrom(clazz);
    }

    private void validateTargetCount(final TransferAction action, final ArazzoValidationResult result) {
        String type = action.getType().getValue();
        if (action.targetCount() == 0 && !action.isMalformed("stepId") && !action.isMalformed("workflowId")) {
            result.addError("'%s' actions require one of 'stepId' or 'workflowId'".formatted(type), action.getRange());
        } else if (action.targetCount() > 1) {
            result.addError("'%s' actions must not declare both 'stepId' and 'workflowId'".formatted(type), action.getRange());
        }
    }

    private void validateNoRetryFields(final Action action, final ArazzoValidationResult result) {
        if (action.has("retryAfter") || action.has("retryLimit")) {
            result.addError("'retryAfter' and 'retryLimit' are only allowed on 'retry' actions", action.getRange());
        }
    }
}
