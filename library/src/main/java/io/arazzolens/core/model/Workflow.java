package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Objects;
import java.util.Optional;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Workflow extends ArazzoElement {
    private final int index;
    private final String workflowId;
    private final String summary;
    private final String description;
    // property names of the inputs schema, resolved through components when the schema is a $ref
    @Builder.Default
    private final ImmutableList<String> inputProperties = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Located<String>> dependsOn = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Step> steps = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Action> successActions = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Action> failureActions = ImmutableList.of();
    @Builder.Default
    private final ImmutableMap<String, Located<String>> outputs = ImmutableMap.of();
    @Builder.Default
    private final ImmutableList<Parameter> parameters = ImmutableList.of();

    public Optional<Step> findStep(final String stepId) {
        if (Objects.isNull(stepId)) return Optional.empty();
        return steps.stream()
                .filter(step -> stepId.equals(step.getStepId()))
                .findFirst();
    }

    public boolean declaresOutputs() {
        return has("outputs");
    }

    public String displayName() {
        return Objects.nonNull(workflowId) ? workflowId : String.valueOf(index);
    }
}
