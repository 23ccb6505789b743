package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.SourceDescription;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import java.util.Objects;

public class SourceDescriptionValidator implements ArazzoValidator<SourceDescription> {

    @Override
    public ArazzoValidationResult validate(final SourceDescription sourceDescription,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!sourceDescription.isValid()) return result;

        String name = sourceDescription.getName();
        if (Strings.isNullOrEmpty(name)) {
            if (!sourceDescription.isMalformed("name")) result.addMissing("name", sourceDescription);
        } else {
            if (validationOptions.isRecommendIdentifierFormat() && !isRecommendedNameFormat(name)) {
                result.addWarning("Source description name '%s' does not comply to [A-Za-z0-9_\\-]+".formatted(name),
                        sourceDescription.rangeOf("name"));
            }
            long occurrences = context.getDocument().getSourceDescriptions().stream()
                    .filter(other -> name.equals(other.getName()))
                    .count();
            if (occurrences > 1) {
                result.addError("Source description name '%s' must be unique".formatted(name), sourceDescription.rangeOf("name"));
            }
        }

        if (Strings.isNullOrEmpty(sourceDescription.getUrl()) && !sourceDescription.isMalformed("url")) {
            result.addMissing("url", sourceDescription);
        }

        if (Objects.nonNull(sourceDescription.getTypeValue()) && Objects.isNull(sourceDescription.getType())) {
            result.addError("'type' must be one of openapi, arazzo but was '%s'".formatted(sourceDescription.getTypeValue()),
                    sourceDescription.rangeOf("type"));
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return SourceDescription.class.isAssignableFrom(clazz);
    }

    private boolean isRecommendedNameFormat(final String name) {
        return name.matches("^[A-Za-z0-9_\\-]+$");
    }
}
