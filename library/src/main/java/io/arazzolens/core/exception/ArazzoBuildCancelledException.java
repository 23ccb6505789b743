package io.arazzolens.core.exception;

/**
 * Raised at a stage boundary when a newer document revision superseded the running build.
 */
public class ArazzoBuildCancelledException extends RuntimeException {

    private final long revision;

    public ArazzoBuildCancelledException(final long revision) {
        super("Build of revision %d was superseded".formatted(revision));
        this.revision = revision;
    }

    public long getRevision() {
        return revision;
    }
}
