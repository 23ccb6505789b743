package io.arazzolens.core.expression;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;

import java.util.Objects;

/**
 * Parsed form of a runtime expression such as {@code $steps.login.outputs.token} or
 * {@code $response.body#/data/0}.
 */
@Value
public class RuntimeExpression {
    @NonNull
    String text;
    @NonNull
    ExpressionKind kind;
    @NonNull
    ImmutableList<String> segments;
    // JSON pointer following '#', without the '#'
    String pointer;

    public boolean hasPointer() {
        return Objects.nonNull(pointer);
    }

    public String segment(final int index) {
        return index < segments.size() ? segments.get(index) : null;
    }
}
