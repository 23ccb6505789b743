package io.arazzolens.core.expression;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum ExpressionKind {
    URL("url"),
    METHOD("method"),
    STATUS_CODE("statusCode"),
    REQUEST("request"),
    RESPONSE("response"),
    INPUTS("inputs"),
    OUTPUTS("outputs"),
    STEPS("steps"),
    WORKFLOWS("workflows"),
    SOURCE_DESCRIPTIONS("sourceDescriptions"),
    COMPONENTS("components"),
    INVALID("invalid");

    private final String value;

    public static Optional<ExpressionKind> fromPrefix(final String prefix) {
        return Arrays.stream(values())
                .filter(kind -> kind != INVALID)
                .filter(kind -> kind.value.equals(prefix))
                .findFirst();
    }
}
