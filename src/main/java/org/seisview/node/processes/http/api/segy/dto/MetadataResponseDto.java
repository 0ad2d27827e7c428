package org.seisview.node.processes.http.api.segy.dto;

/**
 * Response of the metadata endpoint.
 *
 * @param status   always {@code "ok"}
 * @param metadata the active volume's metadata
 */
public record MetadataResponseDto(String status, VolumeMetadataDto metadata) {}
