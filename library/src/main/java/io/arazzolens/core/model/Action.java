package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A success or failure action. The concrete class is chosen from the {@code type} field while
 * the model is built: {@link EndAction}, {@link GotoAction}, {@link RetryAction}; reusable objects
 * become {@link ReferencedAction} and anything else an {@link InvalidAction} stub.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public abstract class Action extends ArazzoElement {

    private final String name;
    private final ActionKind kind;
    @Builder.Default
    private final ImmutableList<Criterion> criteria = ImmutableList.of();
    @Builder.Default
    private final ImmutableMap<String, Located<String>> outputs = ImmutableMap.of();

    /**
     * @return the action type, {@code null} for reusable references and invalid actions
     */
    public abstract ActionType getType();

    public boolean isConditional() {
        return !criteria.isEmpty();
    }

    public String displayName() {
        if (name != null) return name;
        return getType() != null ? getType().getValue() : kind.getValue();
    }
}
