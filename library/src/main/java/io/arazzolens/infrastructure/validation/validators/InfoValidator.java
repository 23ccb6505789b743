package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Info;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

public class InfoValidator implements ArazzoValidator<Info> {

    @Override
    public ArazzoValidationResult validate(final Info info,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!info.isValid()) return result;

        if (Strings.isNullOrEmpty(info.getTitle()) && !info.isMalformed("title")) result.addMissing("title", info);
        if (Strings.isNullOrEmpty(info.getVersion()) && !info.isMalformed("version")) result.addMissing("version", info);

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Info.class.isAssignableFrom(clazz);
    }
}
