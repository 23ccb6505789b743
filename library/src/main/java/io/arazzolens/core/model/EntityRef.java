package io.arazzolens.core.model;

import io.arazzolens.core.tree.SourceRange;
import lombok.Value;

/**
 * Points at an entity of the model, e.g. a stub emitted for a node that could not be interpreted.
 */
@Value
public class EntityRef {
    EntityType type;
    String path;
    SourceRange range;
}
