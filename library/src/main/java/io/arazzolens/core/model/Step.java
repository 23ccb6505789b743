package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Objects;
import java.util.stream.Stream;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Step extends ArazzoElement {
    private final int index;
    private final String stepId;
    private final String description;
    private final String operationId;
    private final String operationPath;
    private final String workflowId;
    @Builder.Default
    private final ImmutableList<Parameter> parameters = ImmutableList.of();
    private final RequestBody requestBody;
    @Builder.Default
    private final ImmutableList<Criterion> successCriteria = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Action> onSuccess = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Action> onFailure = ImmutableList.of();
    @Builder.Default
    private final ImmutableMap<String, Located<String>> outputs = ImmutableMap.of();

    public int operationReferenceCount() {
        return (int) Stream.of(operationId, operationPath, workflowId)
                .filter(Objects::nonNull)
                .count();
    }

    public boolean targetsWorkflow() {
        return Objects.nonNull(workflowId);
    }

    public String displayName() {
        return Objects.nonNull(stepId) ? stepId : String.valueOf(index);
    }
}
