package io.arazzolens.infrastructure.validation;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ArazzoValidationOptions {
    private final boolean resolveExpressions;
    // compiles regex, JSONPath and XPath conditions
    private final boolean validateCriterionSyntax;
    private final boolean recommendIdentifierFormat;

    public static ArazzoValidationOptions ofDefault() {
        return ArazzoValidationOptions.builder()
                .resolveExpressions(true)
                .validateCriterionSyntax(true)
                .recommendIdentifierFormat(true)
                .build();
    }
}
