package io.arazzolens.core.graph;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import lombok.NonNull;
import lombok.Value;

@Value
public class GraphBuildResult {
    @NonNull
    TransitionGraph graph;
    @NonNull
    ImmutableList<Diagnostic> diagnostics;
}
