package io.arazzolens.core.ir;

import lombok.NonNull;
import lombok.Value;

@Value
public class IrEdge {
    @NonNull
    String from;
    @NonNull
    String to;
    @NonNull
    String kind;
    String label;
}
