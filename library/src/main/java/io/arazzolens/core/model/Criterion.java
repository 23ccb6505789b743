package io.arazzolens.core.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Criterion extends ArazzoElement {
    private final String condition;
    private final String context;
    // null when absent or unknown, see typeValue
    private final CriterionType type;
    private final String typeValue;
    // set when type was given as a criterion expression type object
    private final String version;
    private final boolean expressionTypeObject;

    public CriterionType getEffectiveType() {
        if (Objects.nonNull(type)) return type;
        return Objects.isNull(typeValue) ? CriterionType.SIMPLE : null;
    }

    @Getter
    @AllArgsConstructor
    public enum CriterionType {
        SIMPLE("simple"),
        REGEX("regex"),
        JSONPATH("jsonpath"),
        XPATH("xpath");

        private final String value;

        public static Optional<CriterionType> fromValue(final String value) {
            return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
        }
    }
}
