package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Reusable object pointing at {@code $components.successActions.<name>} or
 * {@code $components.failureActions.<name>}.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class ReferencedAction extends Action {
    private final String reference;

    @Override
    public ActionType getType() {
        return null;
    }
}
