package org.seisview.node.processes.http.api.drill.dto;

import org.seisview.telemetry.DrillState;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of {@code POST /api/drill/update}.
 *
 * @param status     always {@code "ok"}
 * @param drillState the merged state after the update
 */
public record DrillUpdateResponseDto(
    String status,
    @JsonProperty("drill_state") DrillState drillState) {
}
