package io.arazzolens.core.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * A parameter, or a reusable object pointing at {@code $components.parameters.<name>}
 * when {@link #getReference()} is set.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Parameter extends ArazzoElement {
    private final String name;
    private final String in;
    private final Object value;
    private final String reference;

    public boolean isReference() {
        return Objects.nonNull(reference);
    }

    @Getter
    @AllArgsConstructor
    public enum ParameterLocation {
        PATH("path"),
        QUERY("query"),
        HEADER("header"),
        COOKIE("cookie");

        private final String value;

        public static Optional<ParameterLocation> fromValue(final String value) {
            return Arrays.stream(values()).filter(location -> location.value.equals(value)).findFirst();
        }
    }
}
