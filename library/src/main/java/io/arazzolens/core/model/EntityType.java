package io.arazzolens.core.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum EntityType {
    DOCUMENT("document"),
    INFO("info"),
    SOURCE_DESCRIPTION("sourceDescription"),
    WORKFLOW("workflow"),
    STEP("step"),
    PARAMETER("parameter"),
    REQUEST_BODY("requestBody"),
    PAYLOAD_REPLACEMENT("payloadReplacement"),
    CRITERION("criterion"),
    ACTION("action"),
    COMPONENTS("components");

    private final String value;
}
