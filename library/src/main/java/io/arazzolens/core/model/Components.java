package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Components extends ArazzoElement {
    // input schema name to its property names
    @Builder.Default
    private final ImmutableMap<String, ImmutableList<String>> inputs = ImmutableMap.of();
    @Builder.Default
    private final ImmutableMap<String, Parameter> parameters = ImmutableMap.of();
    @Builder.Default
    private final ImmutableMap<String, Action> successActions = ImmutableMap.of();
    @Builder.Default
    private final ImmutableMap<String, Action> failureActions = ImmutableMap.of();

    public boolean contains(final ComponentCategory category, final String name) {
        return entries(category).containsKey(name);
    }

    public Map<String, ?> entries(final ComponentCategory category) {
        switch (category) {
            case INPUTS:
                return inputs;
            case PARAMETERS:
                return parameters;
            case SUCCESS_ACTIONS:
                return successActions;
            default:
                return failureActions;
        }
    }

    @Getter
    @AllArgsConstructor
    public enum ComponentCategory {
        INPUTS("inputs"),
        PARAMETERS("parameters"),
        SUCCESS_ACTIONS("successActions"),
        FAILURE_ACTIONS("failureActions");

        private final String value;

        public static Optional<ComponentCategory> fromValue(final String value) {
            return Arrays.stream(values()).filter(category -> category.value.equals(value)).findFirst();
        }
    }
}
