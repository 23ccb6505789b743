package io.arazzolens.session;

import io.arazzolens.ArazzoAnalysis;
import io.arazzolens.ArazzoAnalyzer;
import io.arazzolens.core.exception.ArazzoBuildCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rebuild lifecycle of one document.
 * <p>
 * Every change bumps the revision. A build started for an older revision stops at its next stage
 * boundary and is never published, so listeners only see the latest completed build. Publishing
 * replaces the snapshot by a single assignment.
 */
@Slf4j
public class ArazzoDocumentSession {

    private final URI uri;
    private final ArazzoAnalyzer analyzer;
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong revision = new AtomicLong(0);
    private volatile DocumentSnapshot snapshot;
    private volatile boolean disposed;

    public ArazzoDocumentSession(final URI uri, final ArazzoAnalyzer analyzer) {
        this.uri = Objects.requireNonNull(uri);
        this.analyzer = Objects.requireNonNull(analyzer);
    }

    public URI getUri() {
        return uri;
    }

    public long getRevision() {
        return revision.get();
    }

    public Optional<DocumentSnapshot> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }

    public void addListener(final SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(final SnapshotListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records a change of the document and returns the revision a build for it must carry.
     * Builds of earlier revisions become stale.
     */
    public long documentChanged() {
        return revision.incrementAndGet();
    }

    /**
     * Records a change and rebuilds right away.
     */
    public Optional<DocumentSnapshot> update(final String content) {
        return rebuild(documentChanged(), content);
    }

    /**
     * Builds the given revision. Returns empty when the build was superseded or the session was
     * disposed before it completed.
     */
    public Optional<DocumentSnapshot> rebuild(final long buildRevision, final String content) {
        try {
            ArazzoAnalysis analysis = analyzer.analyze(content, () -> ensureCurrent(buildRevision));
            return publish(new DocumentSnapshot(uri, buildRevision, analysis));
        } catch (ArazzoBuildCancelledException e) {
            log.debug("Dropped build of '{}': {}", uri, e.getMessage());
            return Optional.empty();
        }
    }

    public void dispose() {
        disposed = true;
        revision.incrementAndGet();
        listeners.clear();
        snapshot = null;
        log.debug("Disposed session of '{}'", uri);
    }

    public boolean isDisposed() {
        return disposed;
    }

    private void ensureCurrent(final long buildRevision) {
        if (disposed || buildRevision != revision.get()) {
            throw new ArazzoBuildCancelledException(buildRevision);
        }
    }

    private synchronized Optional<DocumentSnapshot> publish(final DocumentSnapshot next) {
        // a newer change may have arrived after the last stage boundary
        ensureCurrent(next.getRevision());
        snapshot = next;
        log.debug("Published revision {} of '{}' with {} diagnostic(s)",
                next.getRevision(), uri, next.getAnalysis().getDiagnostics().size());
        listeners.forEach(listener -> listener.onSnapshot(next));
        return Optional.of(next);
    }
}
