package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Objects;

/**
 * An action moving control to a step of the current workflow or to another workflow.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public abstract class TransferAction extends Action {
    private final String stepId;
    private final String workflowId;

    public int targetCount() {
        int count = 0;
        if (Objects.nonNull(stepId)) count++;
        if (Objects.nonNull(workflowId)) count++;
        return count;
    }
}
