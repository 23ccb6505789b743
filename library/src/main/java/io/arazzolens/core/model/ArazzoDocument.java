package io.arazzolens.core.model;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.Objects;
import java.util.Optional;

/**
 * Root of the semantic model of one Arazzo description.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class ArazzoDocument extends ArazzoElement {

    private final String arazzo;
    private final Info info;
    @Builder.Default
    private final ImmutableList<SourceDescription> sourceDescriptions = ImmutableList.of();
    @Builder.Default
    private final ImmutableList<Workflow> workflows = ImmutableList.of();
    private final Components components;

    public Optional<Workflow> findWorkflow(final String workflowId) {
        if (Objects.isNull(workflowId)) return Optional.empty();
        return workflows.stream()
                .filter(workflow -> workflowId.equals(workflow.getWorkflowId()))
                .findFirst();
    }

    public Optional<SourceDescription> findSourceDescription(final String name) {
        if (Objects.isNull(name)) return Optional.empty();
        return sourceDescriptions.stream()
                .filter(sourceDescription -> name.equals(sourceDescription.getName()))
                .findFirst();
    }

    public Components getComponentsOrEmpty() {
        return Objects.nonNull(components) ? components : Components.builder().build();
    }
}
