package io.arazzolens.infrastructure.validation;

import io.arazzolens.core.expression.ResolutionContext;

/**
 * Validates one kind of entity. The context carries the document and, where applicable, the
 * enclosing workflow and step.
 */
public interface ArazzoValidator<T> {

    ArazzoValidationResult validate(
            final T partOfArazzo,
            final ResolutionContext context,
            final ArazzoValidationOptions validationOptions);

    boolean supports(final Class<?> clazz);
}
