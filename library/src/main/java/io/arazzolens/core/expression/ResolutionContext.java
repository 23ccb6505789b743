package io.arazzolens.core.expression;

import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.Step;
import io.arazzolens.core.model.Workflow;
import io.arazzolens.core.tree.SourceRange;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Where an expression occurs: the document, the enclosing workflow and step (both optional)
 * and the range diagnostics are attached to.
 */
@Value
@Builder(toBuilder = true)
public class ResolutionContext {
    @NonNull
    ArazzoDocument document;
    Workflow workflow;
    Step step;
    @NonNull
    @Builder.Default
    SourceRange range = SourceRange.EMPTY;
    // workflow level outputs may reference steps of the workflows listed in dependsOn
    boolean dependencyStepsInScope;

    public static ResolutionContext of(final ArazzoDocument document) {
        return ResolutionContext.builder().document(document).range(document.getRange()).build();
    }

    public ResolutionContext at(final SourceRange range) {
        return toBuilder().range(range).build();
    }
}
