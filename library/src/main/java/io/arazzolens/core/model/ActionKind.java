package io.arazzolens.core.model;

import io.arazzolens.core.model.Components.ComponentCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Which list an action was declared in.
 */
@Getter
@AllArgsConstructor
public enum ActionKind {
    SUCCESS("onSuccess", ComponentCategory.SUCCESS_ACTIONS),
    FAILURE("onFailure", ComponentCategory.FAILURE_ACTIONS);

    private final String value;
    private final ComponentCategory componentCategory;
}
