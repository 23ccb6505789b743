package io.arazzolens.infrastructure.parsing;

import com.google.common.collect.ImmutableList;
import io.arazzolens.core.diagnostic.Diagnostic;
import io.arazzolens.core.tree.RangedNode;
import lombok.NonNull;
import lombok.Value;

@Value
public class ParsedDocument {
    @NonNull
    RangedNode root;
    // passed through verbatim from the underlying parser
    @NonNull
    ImmutableList<Diagnostic> syntaxErrors;
}
