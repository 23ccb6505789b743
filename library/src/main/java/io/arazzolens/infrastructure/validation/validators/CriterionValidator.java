package io.arazzolens.infrastructure.validation.validators;

import com.google.common.base.Strings;
import com.jayway.jsonpath.InvalidPathException;
import com.jayway.jsonpath.JsonPath;
import io.arazzolens.core.diagnostic.DiagnosticCategory;
import io.arazzolens.core.expression.ArazzoExpressionResolver;
import io.arazzolens.core.expression.ResolutionContext;
import io.arazzolens.core.model.Criterion;
import io.arazzolens.core.model.Criterion.CriterionType;
import io.arazzolens.infrastructure.validation.ArazzoValidationOptions;
import io.arazzolens.infrastructure.validation.ArazzoValidationResult;
import io.arazzolens.infrastructure.validation.ArazzoValidator;

import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class CriterionValidator implements ArazzoValidator<Criterion> {

    protected static final Map<CriterionType, Set<String>> KNOWN_VERSIONS = Map.of(
            CriterionType.JSONPATH, Set.of("draft-goessner-dispatch-jsonpath-00"),
            CriterionType.XPATH, Set.of("xpath-30", "xpath-20", "xpath-10")
    );

    private final ArazzoExpressionResolver expressionResolver = new ArazzoExpressionResolver();

    @Override
    public ArazzoValidationResult validate(final Criterion criterion,
                                           final ResolutionContext context,
                                           final ArazzoValidationOptions validationOptions) {
        var result = ArazzoValidationResult.builder().build();
        if (!criterion.isValid()) return result;

        if (Strings.isNullOrEmpty(criterion.getCondition()) && !criterion.isMalformed("condition")) {
            result.addMissing("condition", criterion);
        }

        CriterionType type = criterion.getEffectiveType();
        if (Objects.isNull(type)) {
            result.addError("'type' must be one of simple, regex, jsonpath, xpath but was '%s'".formatted(criterion.getTypeValue()),
                    criterion.rangeOf("type"));
        } else if (type != CriterionType.SIMPLE && Strings.isNullOrEmpty(criterion.getContext())) {
            result.addError("Criterion of type '%s' requires 'context' to be defined".formatted(type.getValue()), criterion.getRange());
        }

        if (criterion.isExpressionTypeObject()) {
            validateExpressionTypeObject(criterion, type, result);
        }

        if (!Strings.isNullOrEmpty(criterion.getContext())) {
            if (!criterion.getContext().startsWith("$")) {
                result.addWarning("Expected 'context' to be a runtime expression", criterion.rangeOf("context"));
            } else if (validationOptions.isResolveExpressions()) {
                result.addAll(expressionResolver.resolve(criterion.getContext(), context.at(criterion.rangeOf("context")))
                        .getDiagnostics());
            }
        }

        if (!Strings.isNullOrEmpty(criterion.getCondition()) && Objects.nonNull(type)) {
            validateCondition(criterion, type, context, validationOptions, result);
        }

        return result;
    }

    @Override
    public boolean supports(final Class<?> clazz) {
        return Criterion.class.isAssignableFrom(clazz);
    }

    private void validateExpressionTypeObject(final Criterion criterion,
                                              final CriterionType type,
                                              final ArazzoValidationResult result) {
        if (Objects.isNull(type)) return;
        if (type != CriterionType.JSONPATH && type != CriterionType.XPATH) {
            result.addError("Criterion expression type must be 'jsonpath' or 'xpath'", criterion.rangeOf("type"));
            return;
        }
        if (Strings.isNullOrEmpty(criterion.getVersion())) {
            result.addError("Missing required field: version", criterion.rangeOf("type"));
        } else if (!KNOWN_VERSIONS.get(type).contains(criterion.getVersion())) {
            result.addError("Unknown version '%s' for criterion type '%s'".formatted(criterion.getVersion(), type.getValue()),
                    criterion.rangeOf("type"));
        }
    }

    private void validateCondition(final Criterion criterion,
                                   final CriterionType type,
                                   final ResolutionContext context,
                                   final ArazzoValidationOptions validationOptions,
                                   final ArazzoValidationResult result) {
        String condition = criterion.getCondition();
        switch (type) {
            case SIMPLE:
                if (validationOptions.isResolveExpressions()) {
                    result.addAll(expressionResolver.resolveEmbedded(condition, context.at(criterion.rangeOf("condition"))));
                }
                break;
            case REGEX:
                if (validationOptions.isValidateCriterionSyntax() && !validateRegex(condition)) {
                    result.addError(DiagnosticCategory.EXPRESSION_ERROR,
                            "Condition '%s' is an invalid regex".formatted(condition), criterion.rangeOf("condition"));
                }
                break;
            case JSONPATH:
                if (validationOptions.isValidateCriterionSyntax() && !validateJsonPath(condition)) {
                    result.addError(DiagnosticCategory.EXPRESSION_ERROR,
                            "Condition '%s' contains invalid JSONPath".formatted(condition), criterion.rangeOf("condition"));
                }
                break;
            case XPATH:
                if (validationOptions.isValidateCriterionSyntax() && !validateXPath(condition)) {
                    result.addError(DiagnosticCategory.EXPRESSION_ERROR,
                            "Condition '%s' contains invalid XPath".formatted(condition), criterion.rangeOf("condition"));
                }
                break;
            default:
                break;
        }
    }

    private boolean validateRegex(final String condition) {
        try {
            Pattern.compile(condition);
            return true;
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private boolean validateJsonPath(final String condition) {
        try {
            var compiled = JsonPath.compile(condition);
            return !Strings.isNullOrEmpty(compiled.getPath());
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private boolean validateXPath(final String condition) {
        try {
            XPathFactory.newDefaultInstance().newXPath().compile(condition);
            return true;
        } catch (XPathExpressionException e) {
            return false;
        }
    }
}
