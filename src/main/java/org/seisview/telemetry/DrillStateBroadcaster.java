package org.seisview.telemetry;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide drill state with publish/subscribe fan-out.
 * <p>
 * Every accepted update is merged into the current state and delivered to all subscribers. A
 * subscriber whose delivery throws is removed, and fan-out continues with the remaining ones.
 * <p>
 * <strong>Thread Safety:</strong> Updates are serialized, so every subscriber observes states in
 * the order they were produced. Subscribing and unsubscribing may happen concurrently with a
 * broadcast; a broadcast iterates over a snapshot of the subscriber set.
 */
public class DrillStateBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(DrillStateBroadcaster.class);

    private final Set<DrillStateListener> subscribers = new CopyOnWriteArraySet<>();
    private final Object updateLock = new Object();
    private volatile DrillState state = DrillState.initial();

    /**
     * @return the current state
     */
    public DrillState current() {
        return state;
    }

    /**
     * Registers a subscriber and sends it the current state.
     *
     * @param listener subscriber
     * @return false if the initial delivery failed and the subscriber was dropped again
     */
    public boolean subscribe(DrillStateListener listener) {
        synchronized (updateLock) {
            subscribers.add(listener);
            log.debug("Drill subscriber added ({} total)", subscribers.size());
            return deliver(listener, state);
        }
    }

    public void unsubscribe(DrillStateListener listener) {
        if (subscribers.remove(listener)) {
            log.debug("Drill subscriber removed ({} remaining)", subscribers.size());
        }
    }

    /**
     * Merges an update into the current state and broadcasts the result.
     *
     * @param update partial update
     * @return the merged state
     * @throws IllegalArgumentException if the update is malformed
     */
    public DrillState update(DrillStateUpdate update) {
        update.validate();
        synchronized (updateLock) {
            final DrillState merged = state.merge(update);
            state = merged;
            int delivered = 0;
            for (DrillStateListener listener : subscribers) {
                if (deliver(listener, merged)) {
                    delivered++;
                }
            }
            log.debug("Drill state md={} broadcast to {} subscribers", merged.md(), delivered);
            return merged;
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    private boolean deliver(DrillStateListener listener, DrillState snapshot) {
        try {
            listener.onDrillState(snapshot);
            return true;
        } catch (Exception e) {
            subscribers.remove(listener);
            log.warn("Dropping drill subscriber after failed delivery: {}", e.getMessage());
            return false;
        }
    }
}
