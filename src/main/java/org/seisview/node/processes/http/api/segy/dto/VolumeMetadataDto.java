package org.seisview.node.processes.http.api.segy.dto;

import org.seisview.segy.volume.VolumeMetadata;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON view of {@link VolumeMetadata}.
 * <p>
 * {@code sample_rate_us} is null when the volume defines no sample interval.
 */
public record VolumeMetadataDto(
    @JsonProperty("path") String path,
    @JsonProperty("generation") long generation,
    @JsonProperty("num_traces") int numTraces,
    @JsonProperty("num_inlines") int numInlines,
    @JsonProperty("num_crosslines") int numCrosslines,
    @JsonProperty("ilines") int[] ilines,
    @JsonProperty("xlines") int[] xlines,
    @JsonProperty("samples_per_trace") int samplesPerTrace,
    @JsonProperty("sample_rate_us") Integer sampleRateUs,
    @JsonProperty("sample_format") String sampleFormat,
    @JsonProperty("revision") int revision,
    @JsonProperty("duplicate_positions") int duplicatePositions,
    @JsonProperty("textual_header") String textualHeader
) {

    public static VolumeMetadataDto from(final String path, final VolumeMetadata metadata) {
        return new VolumeMetadataDto(
            path,
            metadata.generation(),
            metadata.traceCount(),
            metadata.inlineCount(),
            metadata.crosslineCount(),
            metadata.inlines(),
            metadata.crosslines(),
            metadata.samplesPerTrace(),
            metadata.sampleIntervalMicros().isPresent() ? metadata.sampleIntervalMicros().getAsInt() : null,
            metadata.sampleFormat().name(),
            metadata.revision(),
            metadata.duplicatePositions(),
            metadata.textualHeader());
    }
}
