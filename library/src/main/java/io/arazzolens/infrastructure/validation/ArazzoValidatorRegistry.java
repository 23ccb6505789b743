package io.arazzolens.infrastructure.validation;

import com.google.common.base.Strings;
import io.arazzolens.core.exception.ArazzoIllegalStateException;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.infrastructure.validation.validators.ComponentsValidator;
import io.arazzolens.infrastructure.validation.validators.InfoValidator;
import io.arazzolens.infrastructure.validation.validators.SourceDescriptionValidator;
import io.arazzolens.infrastructure.validation.validators.WorkflowValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of structural validation. Visits every entity of the model exactly once and never
 * stops at the first problem.
 */
@Slf4j
public class ArazzoValidatorRegistry {

    private final List<ArazzoValidator<?>> validators;

    public ArazzoValidatorRegistry() {
        // register default validators
        this(List.of(
                new InfoValidator(),
                new SourceDescriptionValidator(),
                new WorkflowValidator(),
                new ComponentsValidator()
        ));
    }

    public ArazzoValidatorRegistry(final List<ArazzoValidator<?>> validators) {
        this.validators = new ArrayList<>(validators);
    }

    public void register(final ArazzoValidator<?> validator) {
        validators.add(validator);
    }

    public ArazzoValidationResult validate(final ArazzoDocument arazzo, final ArazzoValidationOptions options) {
        var result = ArazzoValidationResult.builder().build();
        // the builder already reported a root that is not an object
        if (!arazzo.isValid()) return result;

        var context = ResolutionContext.of(arazzo);

        if (Strings.isNullOrEmpty(arazzo.getArazzo())) {
            if (!arazzo.isMalformed("arazzo")) result.addMissing("arazzo", arazzo);
        } else if (!isSemanticVersioningFormat(arazzo.getArazzo())) {
            result.addWarning("'arazzo' does not adhere to semantic versioning", arazzo.rangeOf("arazzo"));
        }

        // info
        if (Objects.isNull(arazzo.getInfo())) {
            result.addMissing("info", arazzo);
        } else {
            result.merge(validateObject(arazzo.getInfo(), context, options));
        }

        // sourceDescriptions
        if (!arazzo.has("sourceDescriptions")) {
            result.addMissing("sourceDescriptions", arazzo);
        } else if (arazzo.getSourceDescriptions().isEmpty() && !arazzo.isMalformed("sourceDescriptions")) {
            result.addError("'sourceDescriptions' must contain at least one entry", arazzo.rangeOf("sourceDescriptions"));
        }
        arazzo.getSourceDescriptions().forEach(sourceDescription ->
                result.merge(validateObject(sourceDescription, context, options)));

        // workflows
        if (!arazzo.has("workflows")) {
            result.addMissing("workflows", arazzo);
        } else if (arazzo.getWorkflows().isEmpty() && !arazzo.isMalformed("workflows")) {
            result.addError("'workflows' must contain at least one entry", arazzo.rangeOf("workflows"));
        }
        arazzo.getWorkflows().forEach(workflow ->
                result.merge(validateObject(workflow, context.toBuilder().workflow(workflow).build(), options)));

        // components
        if (Objects.nonNull(arazzo.getComponents())) {
            result.merge(validateObject(arazzo.getComponents(), context, options));
        }

        log.debug("Validation produced {} diagnostic(s)", result.getDiagnostics().size());
        return result;
    }

    @SuppressWarnings("unchecked")
    private <T> ArazzoValidationResult validateObject(final T partOfArazzo,
                                                      final ResolutionContext context,
                                                      final ArazzoValidationOptions options) {
        ArazzoValidator<T> validator = (ArazzoValidator<T>) findValidatorForObject(partOfArazzo);
        if (Objects.isNull(validator)) {
            throw new ArazzoIllegalStateException(
                    "No validator registered for '%s'".formatted(partOfArazzo.getClass().getSimpleName()));
        }
        return validator.validate(partOfArazzo, context, options);
    }

    private <T> ArazzoValidator<?> findValidatorForObject(final T partOfArazzo) {
        for (ArazzoValidator<?> validator : validators) {
            if (validator.supports(partOfArazzo.getClass())) {
                return validator;
            }
        }
        return null;
    }

    private boolean isSemanticVersioningFormat(final String version) {
        return version.matches("\\d+\\.\\d+\\.\\d+");
    }
}
