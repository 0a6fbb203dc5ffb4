package com.ivirs.backend.feed;

import com.ivirs.backend.model.EntitySnapshot;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Feed filled by an external simulator through the REST API. One queued snapshot is
 * consumed per tick.
 */
public class PushMobilityFeed implements MobilityFeed {

    private final BlockingQueue<EntitySnapshot> snapshots;
    private volatile boolean ended;

    public PushMobilityFeed(int capacity) {
        this.snapshots = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * @return false if the queue is full or the feed has been ended
     */
    public boolean offer(EntitySnapshot snapshot) {
        if (ended) {
            return false;
        }
        return snapshots.offer(snapshot);
    }

    public void end() {
        ended = true;
    }

    public boolean isEnded() {
        return ended;
    }

    public int queued() {
        return snapshots.size();
    }

    @Override
    public Optional<EntitySnapshot> poll() {
        return Optional.ofNullable(snapshots.poll());
    }

    @Override
    public boolean isExhausted() {
        return ended && snapshots.isEmpty();
    }
}
