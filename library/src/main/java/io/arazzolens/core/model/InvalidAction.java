package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Stub for an action node whose type is missing or unknown, or which is not a map at all.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class InvalidAction extends Action {
    private final String typeValue;

    @Override
    public ActionType getType() {
        return null;
    }
}
