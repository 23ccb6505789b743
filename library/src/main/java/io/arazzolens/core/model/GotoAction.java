package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class GotoAction extends TransferAction {

    @Override
    public ActionType getType() {
        return ActionType.GOTO;
    }
}
