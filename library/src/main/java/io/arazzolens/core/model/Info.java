package io.arazzolens.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
public class Info extends ArazzoElement {
    private final String title;
    private final String summary;
    private final String description;
    private final String version;
}
