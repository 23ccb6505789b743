package io.arazzolens.core.ir;

import lombok.NonNull;
import lombok.Value;

@Value
public class IrNode {
    @NonNull
    String id;
    @NonNull
    String kind;
    @NonNull
    String label;
}
