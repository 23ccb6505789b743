package io.arazzolens.core.reference;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.model.Action;
import lombok.NonNull;
import lombok.Value;

import java.util.Objects;

/**
 * Outcome of resolving one declared action: the action to act on (the components entry for
 * reusable references) and whether its target exists.
 */
@Value
public class ActionResolution {
    @NonNull
    Action declared;
    // null when a reusable reference does not resolve
    Action effective;
    boolean targetResolved;
    @NonNull
    ImmutableList<Diagnostic> diagnostics;

    public boolean isResolved() {
        return Objects.nonNull(effective) && targetResolved;
    }
}
