package io.arazzolens.infrastructure.validation.validators;

import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Located;
import io.arazzolens.core.model.RequestBody;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

public class RequestBodyValidator implements ArazzoValidator<RequestBody> {

    private final PayloadReplacementValidator payloadReplacementValidator = new PayloadReplacementValidator();
    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final RequestBody requestBody,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!requestBody.isValid()) return result;

        if (validationOptions.isResolveExpressions()) {
            for (Located<String> payloadString : requestBody.getPayloadStrings()) {
                result.addAll(expressionResolver.resolveValue(payloadString.value(), context.at(payloadString.range())));
            }
        }

        requestBody.getReplacements().forEach(replacement ->
                result.merge(payloadReplacementValidator.validate(replacement, context, validationOptions)));

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return RequestBody.class.isAssignableFrom(clazz);
    }
}
