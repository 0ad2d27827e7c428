package org.seisview.node.processes.http.api.drill.dto;

import org.seisview.telemetry.DrillState;

/**
 * WebSocket frame pushed to drill subscribers.
 *
 * @param type    message discriminator, {@code "drill_state"}
 * @param payload the state
 */
public record DrillStateMessageDto(String type, DrillState payload) {

    public static final String TYPE = "drill_state";

    public static DrillStateMessageDto of(final DrillState state) {
        return new DrillStateMessageDto(TYPE, state);
    }
}
