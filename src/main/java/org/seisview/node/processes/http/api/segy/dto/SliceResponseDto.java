package org.seisview.node.processes.http.api.segy.dto;

import org.seisview.segy.slice.Slice;
import org.seisview.segy.slice.SliceAxis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of the slice endpoints.
 * <p>
 * Exactly one of {@code iline} and {@code xline} is present. {@code data[sample][column]} holds
 * normalized amplitudes in [0, 1]; {@code positions[column]} is the perpendicular-axis number.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SliceResponseDto(
    @JsonProperty("status") String status,
    @JsonProperty("iline") Integer iline,
    @JsonProperty("xline") Integer xline,
    @JsonProperty("positions") int[] positions,
    @JsonProperty("data") float[][] data
) {

    public static SliceResponseDto from(final Slice slice) {
        final boolean inline = slice.getAxis() == SliceAxis.INLINE;
        return new SliceResponseDto(
            "ok",
            inline ? slice.getAxisValue() : null,
            inline ? null : slice.getAxisValue(),
            slice.getPositions(),
            slice.getRows());
    }
}
