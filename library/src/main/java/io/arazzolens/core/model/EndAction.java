package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class EndAction extends Action {

    @Override
    public ActionType getType() {
        return ActionType.END;
    }
}
