package com.serpintel.common.model;

/**
 * Two temporally adjacent snapshots of the same keyword target. Derived per
 * request, never persisted.
 */
public record SnapshotPair(SnapshotObservation from, SnapshotObservation to) {}
