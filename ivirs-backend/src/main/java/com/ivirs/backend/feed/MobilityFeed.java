package com.ivirs.backend.feed;

import com.ivirs.backend.model.EntitySnapshot;

import java.util.Optional;

/**
 * Source of per-tick vehicle snapshots.
 */
public interface MobilityFeed {

    /** Next snapshot, or empty if none is available this tick. */
    Optional<EntitySnapshot> poll();

    /** True once the feed will never produce another snapshot. */
    boolean isExhausted();
}
