package io.arazzolens.infrastructure.parsing;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.core.model.EntityRef;
import lombok.NonNull;
import lombok.Value;

@Value
public class ModelBuildResult {
    @NonNull
    ArazzoDocument document;
    // entities emitted with valid == false
    @NonNull
    ImmutableList<EntityRef> stubs;
    @NonNull
    ImmutableList<Diagnostic> diagnostics;

    public boolean hasStubs() {
        return !stubs.isEmpty();
    }
}
