package io.arazzolens.core.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum ActionType {
    END("end"),
    GOTO("goto"),
    RETRY("retry");

    private final String value;

    public static Optional<ActionType> fromValue(final String value) {
        return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
    }
}
