package io.arazzolens.session;

import io.arazzolens.ArazzoAnalysis;
import lombok.NonNull;
import lombok.Value;

import java.net.URI;

/**
 * Result of the most recent completed build of a document.
 */
@Value
public class DocumentSnapshot {
    @NonNull
    URI uri;
    long revision;
    @NonNull
    ArazzoAnalysis analysis;
}
