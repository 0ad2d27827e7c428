package org.seisview.node.processes.http.api.segy.dto;

/**
 * Response of the upload endpoint.
 *
 * @param status   always {@code "ok"}
 * @param path     where the volume was stored
 * @param metadata metadata of the newly active volume
 */
public record UploadResponseDto(String status, String path, VolumeMetadataDto metadata) {}
