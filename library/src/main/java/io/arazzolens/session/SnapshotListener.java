package io.arazzolens.session;

@FunctionalInterface
public interface SnapshotListener {

    void onSnapshot(final DocumentSnapshot snapshot);
}
