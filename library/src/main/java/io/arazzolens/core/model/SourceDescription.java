package io.arazzolens.core.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Arrays;
import java.util.Optional;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class SourceDescription extends ArazzoElement {
    private final String name;
    private final String url;
    private final SourceDescriptionType type;
    // as written; differs from type when the value is unknown
    private final String typeValue;

    @Getter
    @AllArgsConstructor
    public enum SourceDescriptionType {
        OPENAPI("openapi"),
        ARAZZO("arazzo");

        private final String value;

        public static Optional<SourceDescriptionType> fromValue(final String value) {
            return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
        }
    }
}
