package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Parameter;
import io.arazzolens.core.model.Parameter.ParameterLocation;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import java.util.Objects;

public class ParameterValidator implements ArazzoValidator<Parameter> {

    private static final String COMPONENTS_PARAMETERS_PREFIX = "$components.parameters.";

    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final Parameter parameter,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!parameter.isValid()) return result;

        if (parameter.isReference()) {
            String reference = parameter.getReference();
            if (!reference.startsWith(COMPONENTS_PARAMETERS_PREFIX)) {
                result.addError(DiagnosticCategory.REFERENCE_ERROR,
                        "Reusable parameter reference '%s' must point into components.parameters".formatted(reference),
                        parameter.rangeOf("reference"));
            } else {
                result.addAll(expressionResolver.resolve(reference, context.at(parameter.rangeOf("reference"))).getDiagnostics());
            }
        } else {
            if (Strings.isNullOrEmpty(parameter.getName()) && !parameter.isMalformed("name")) {
                result.addMissing("name", parameter);
            }
            if (!parameter.has("value")) {
                result.addMissing("value", parameter);
            }
            validateIn(parameter, context, result);
        }

        if (validationOptions.isResolveExpressions() && parameter.getValue() instanceof String value) {
            result.addAll(expressionResolver.resolveValue(value, context.at(parameter.rangeOf("value"))));
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Parameter.class.isAssignableFrom(clazz);
    }

    private void validateIn(final Parameter parameter,
                            final ResolutionContext context,
                            final ArazzoValidationResult result) {
        String in = parameter.getIn();
        if (Objects.isNull(in)) {
            // parameters of a step calling a workflow map onto that workflow's inputs
            boolean required = Objects.nonNull(context.getStep()) && !context.getStep().targetsWorkflow();
            if (required && !parameter.isMalformed("in")) result.addMissing("in", parameter);
        } else if (ParameterLocation.fromValue(in).isEmpty()) {
            result.addError("'in' must be one of path, query, header, cookie but was '%s'".formatted(in), parameter.rangeOf("in"));
        }
    }
}
