package org.seisview.telemetry;

/**
 * Receives drill state snapshots from a {@link DrillStateBroadcaster}.
 */
@FunctionalInterface
public interface DrillStateListener {

    /**
     * Delivers a snapshot. Throwing unsubscribes this listener.
     *
     * @param state the current state
     * @throws Exception if delivery failed, e.g. because the connection is gone
     */
    void onDrillState(DrillState state) throws Exception;
}
