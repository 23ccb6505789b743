package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.PayloadReplacement;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

public class PayloadReplacementValidator implements ArazzoValidator<PayloadReplacement> {

    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final PayloadReplacement replacement,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!replacement.isValid()) return result;

        if (Strings.isNullOrEmpty(replacement.getTarget()) && !replacement.isMalformed("target")) {
            result.addMissing("target", replacement);
        }
        if (!replacement.has("value")) {
            result.addMissing("value", replacement);
        } else if (validationOptions.isResolveExpressions() && replacement.getValue() instanceof String value) {
            result.addAll(expressionResolver.resolveValue(value, context.at(replacement.rangeOf("value"))));
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return PayloadReplacement.class.isAssignableFrom(clazz);
    }
}
