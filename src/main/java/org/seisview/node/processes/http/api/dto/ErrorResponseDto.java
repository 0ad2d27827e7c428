package org.seisview.node.processes.http.api.dto;

import org.seisview.segy.SegyException;

/**
 * Error body returned by every endpoint.
 *
 * @param status  always {@code "error"}
 * @param error   taxonomy name, e.g. {@code "AxisValueNotFound"}
 * @param message human-readable detail
 */
public record ErrorResponseDto(String status, String error, String message) {

    public static ErrorResponseDto of(final SegyException e) {
        return new ErrorResponseDto("error", e.getErrorCode(), e.getMessage());
    }

    public static ErrorResponseDto of(final String error, final String message) {
        return new ErrorResponseDto("error", error, message);
    }
}
