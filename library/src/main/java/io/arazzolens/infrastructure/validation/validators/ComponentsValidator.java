package io.arazzolens.infrastructure.validation.validators;

import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Components;
import io.arazzolens.core.model.Components.ComponentCategory;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

public class ComponentsValidator implements ArazzoValidator<Components> {

    private final ParameterValidator parameterValidator = new ParameterValidator();
    private final ActionValidator actionValidator = new ActionValidator();

    @Override
    public ArazzoValidationResult validate(final Components components,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!components.isValid()) return result;

        // component entries are not bound to a workflow or step
        var componentsContext = context.toBuilder().workflow(null).step(null).build();

        for (ComponentCategory category : ComponentCategory.values()) {
            components.entries(category).keySet().stream()
                    .filter(name -> !isValidKeyFormat(name))
                    .forEach(name -> result.addError("Component name '%s' must comply to ^[a-zA-Z0-9.\\-_]+$".formatted(name),
                            components.rangeOf(category.getValue())));
        }

        components.getParameters().values().forEach(parameter ->
                result.merge(parameterValidator.validate(parameter, componentsContext, validationOptions)));
        components.getSuccessActions().values().forEach(action ->
                result.merge(actionValidator.validate(action, componentsContext, validationOptions)));
        components.getFailureActions().values().forEach(action ->
                result.merge(actionValidator.validate(action, componentsContext, validationOptions)));

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Components.class.isAssignableFrom(clazz);
    }

    private boolean isValidKeyFormat(final String key) {
        return key.matches("^[a-zA-Z0-9.\\-_]+$");
    }
}
