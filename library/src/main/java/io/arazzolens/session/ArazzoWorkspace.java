package io.arazzolens.session;

import io.arazzolens.ArazzoAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Open documents keyed by URI, sharing one analyzer. Listeners registered here receive the
 * snapshots of every document.
 */
@Slf4j
public class ArazzoWorkspace {

    private final ArazzoAnalyzer analyzer;
    private final Map<URI, ArazzoDocumentSession> sessions = new ConcurrentHashMap<>();
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();

    public ArazzoWorkspace() {
        this(new ArazzoAnalyzer());
    }

    public ArazzoWorkspace(final ArazzoAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer);
    }

    public void addListener(final SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public ArazzoDocumentSession open(final URI uri) {
        return sessions.computeIfAbsent(uri, key -> {
            var session = new ArazzoDocumentSession(key, analyzer);
            session.addListener(snapshot -> listeners.forEach(listener -> listener.onSnapshot(snapshot)));
            log.debug("Opened session of '{}'", key);
            return session;
        });
    }

    public Optional<DocumentSnapshot> update(final URI uri, final String content) {
        return open(uri).update(content);
    }

    public Optional<ArazzoDocumentSession> findSession(final URI uri) {
        return Optional.ofNullable(sessions.get(uri));
    }

    public Optional<DocumentSnapshot> findSnapshot(final URI uri) {
        return findSession(uri).flatMap(ArazzoDocumentSession::getSnapshot);
    }

    public void close(final URI uri) {
        ArazzoDocumentSession session = sessions.remove(uri);
        if (Objects.nonNull(session)) session.dispose();
    }

    public Set<URI> openDocuments() {
        return Set.copyOf(sessions.keySet());
    }
}
