package org.seisview.segy.volume;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.seisview.segy.AxisValueNotFoundException;
import org.seisview.segy.EmptyVolumeException;
import org.seisview.segy.MalformedHeaderException;
import org.seisview.segy.SegyException;
import org.seisview.segy.TruncatedTraceException;
import org.seisview.segy.format.FileHeader;
import org.seisview.segy.format.HeaderDecoder;
import org.seisview.segy.format.TraceHeader;
import org.seisview.segy.geometry.GeometryIndex;
import org.seisview.segy.io.TraceDirectory;
import org.seisview.segy.io.TraceReader;
import org.seisview.segy.slice.AmplitudeNormalizer;
import org.seisview.segy.slice.Slice;
import org.seisview.segy.slice.SliceAxis;
import org.seisview.segy.slice.SliceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

/**
 * One opened SEG-Y volume: file channel, decoded file header, trace directory and geometry index.
 * <p>
 * A handle is built completely by {@link #open} before anyone can see it, and its header and
 * geometry never change afterwards.
 * <p>
 * <strong>Lifetime:</strong> Handles are reference counted. The creator holds one reference,
 * readers take another via {@link #tryAcquire()} for the duration of a request, and
 * {@link #retire()} drops the creator's reference when the handle is superseded. The file channel
 * is closed when the last reference is released, so reads that started before a replacement
 * finish against the old file.
 * <p>
 * <strong>Slice cache:</strong> Normalized slices are cached per handle (Caffeine LRU). The cache
 * dies with the handle, so a replaced volume can never serve stale entries.
 */
public final class VolumeHandle {

    private static final Logger log = LoggerFactory.getLogger(VolumeHandle.class);

    private record SliceKey(SliceAxis axis, int value) {}

    private final Path path;
    private final long generation;
    private final AsynchronousFileChannel channel;
    private final FileHeader fileHeader;
    private final GeometryIndex geometry;
    private final SliceExtractor extractor;
    private final Cache<SliceKey, Slice> sliceCache;
    private final AtomicInteger references = new AtomicInteger(1);

    private VolumeHandle(Path path, long generation, AsynchronousFileChannel channel, FileHeader fileHeader,
                         GeometryIndex geometry, TraceReader traceReader, int sliceCacheSize) {
        this.path = path;
        this.generation = generation;
        this.channel = channel;
        this.fileHeader = fileHeader;
        this.geometry = geometry;
        this.extractor = new SliceExtractor(geometry, traceReader, fileHeader.samplesPerTrace());
        this.sliceCache = Caffeine.newBuilder()
            .maximumSize(sliceCacheSize)
            .build();
    }

    /**
     * Opens a volume: decodes the file header, then walks the trace headers in file order and
     * builds the trace directory and the geometry index.
     * <p>
     * A trace header with a non-zero sample count sets that trace's length; otherwise the binary
     * header's count applies. When the binary header leaves the sample interval at zero, the
     * first trace header's interval is used. A trace that runs past the end of the file is
     * rejected. On any failure the file channel is closed before the exception propagates.
     *
     * @param path           SEG-Y file to open
     * @param decoder        header decoder carrying the trace header layout
     * @param sliceCacheSize maximum number of normalized slices to cache
     * @param generation     sequence number assigned by the owning accessor
     * @return the fully initialized handle
     * @throws SegyException if the file is not a readable volume
     * @throws IOException   if the file cannot be read
     */
    static VolumeHandle open(Path path, HeaderDecoder decoder, int sliceCacheSize, long generation)
            throws SegyException, IOException {
        final AsynchronousFileChannel channel = AsynchronousFileChannel.open(path, StandardOpenOption.READ);
        try {
            final long fileSize = channel.size();
            if (fileSize < FileHeader.SIZE) {
                throw new MalformedHeaderException("File is " + fileSize + " bytes, shorter than the "
                    + FileHeader.SIZE + "-byte SEG-Y file header");
            }

            FileHeader header = decoder.decode(readBytes(channel, 0, FileHeader.SIZE));
            final long headerRegion = header.headerRegionSize();
            if (fileSize < headerRegion) {
                throw new MalformedHeaderException("File declares " + header.extendedTextualHeaders()
                    + " extended textual headers but ends at byte " + fileSize);
            }
            if (fileSize == headerRegion) {
                throw new EmptyVolumeException("Volume contains no traces");
            }

            final int bytesPerSample = header.sampleFormat().bytesPerSample();
            final TraceDirectory.Builder directoryBuilder = new TraceDirectory.Builder();
            final List<TraceHeader> traceHeaders = new ArrayList<>();
            long offset = headerRegion;
            while (offset < fileSize) {
                final int index = traceHeaders.size();
                if (fileSize - offset < TraceHeader.SIZE) {
                    throw new TruncatedTraceException("Trace " + index + " header at offset " + offset
                        + " is cut short by the end of file; the last trace is truncated");
                }
                final TraceHeader traceHeader = decoder.decodeTraceHeader(readBytes(channel, offset, TraceHeader.SIZE));
                final int samples = traceHeader.sampleCount() != 0 ? traceHeader.sampleCount() : header.samplesPerTrace();
                if (samples == 0) {
                    throw new MalformedHeaderException("Trace " + index
                        + ": neither the binary header nor the trace header declares a sample count");
                }
                final long end = offset + TraceHeader.SIZE + (long) samples * bytesPerSample;
                if (end > fileSize) {
                    throw new TruncatedTraceException("Trace " + index + " declares " + samples
                        + " samples but the file ends " + (end - fileSize) + " bytes early; the last trace is truncated");
                }
                directoryBuilder.add(offset, samples);
                traceHeaders.add(traceHeader);
                offset = end;
            }

            final TraceDirectory directory = directoryBuilder.build();
            header = resolveSampling(header, directory, traceHeaders.get(0));
            final GeometryIndex geometry = GeometryIndex.build(traceHeaders);
            final TraceReader traceReader = new TraceReader(channel, header.sampleFormat(), directory);

            log.debug("Opened {}: {} traces, {} inlines, {} crosslines, {} samples ({}), revision {}",
                path, directory.getTraceCount(), geometry.getInlineCount(), geometry.getCrosslineCount(),
                header.samplesPerTrace(), header.sampleFormat(), header.revision());

            return new VolumeHandle(path, generation, channel, header, geometry, traceReader, sliceCacheSize);
        } catch (SegyException | IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Replaces the binary header's trace length with the longest trace actually found, and fills
     * in a missing sample interval from the first trace header.
     */
    private static FileHeader resolveSampling(FileHeader header, TraceDirectory directory, TraceHeader firstTrace) {
        FileHeader resolved = header;
        if (directory.getMaxSampleCount() != header.samplesPerTrace()) {
            log.debug("Trace headers override the binary header sample count: {} -> {} (uniform: {})",
                header.samplesPerTrace(), directory.getMaxSampleCount(), directory.isUniform());
            resolved = resolved.withSamplesPerTrace(directory.getMaxSampleCount());
        }
        if (resolved.sampleIntervalMicros() == 0 && firstTrace.sampleIntervalMicros() != 0) {
            resolved = resolved.withSampleIntervalMicros(firstTrace.sampleIntervalMicros());
        }
        return resolved;
    }

    private static byte[] readBytes(AsynchronousFileChannel channel, long position, int length) throws IOException {
        final ByteBuffer buffer = ByteBuffer.allocate(length);
        long offset = position;
        while (buffer.hasRemaining()) {
            final int read = TraceReader.readAt(channel, buffer, offset);
            if (read < 0) {
                throw new IOException("Unexpected end of file at offset " + offset);
            }
            offset += read;
        }
        return buffer.array();
    }

    /**
     * Returns the normalized slice, from cache when possible.
     *
     * @param axis       axis to cut along
     * @param value      inline or crossline number
     * @param normalizer amplitude normalizer applied to freshly extracted slices
     * @return the normalized slice
     * @throws AxisValueNotFoundException if {@code value} is not part of the geometry
     * @throws TruncatedTraceException    if a trace is cut short
     * @throws IOException                if reading fails
     */
    Slice normalizedSlice(SliceAxis axis, int value, AmplitudeNormalizer normalizer)
            throws AxisValueNotFoundException, TruncatedTraceException, IOException {
        final SliceKey key = new SliceKey(axis, value);
        final Slice cached = sliceCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Slice cache hit: {}={}, generation={}", axis.label(), value, generation);
            return cached;
        }
        final Slice normalized = normalizer.normalize(extractor.extract(axis, value));
        sliceCache.put(key, normalized);
        return normalized;
    }

    VolumeMetadata metadata() {
        return new VolumeMetadata(
            generation,
            geometry.getTraceCount(),
            geometry.getInlines(),
            geometry.getCrosslines(),
            fileHeader.samplesPerTrace(),
            fileHeader.sampleInterval(),
            fileHeader.sampleFormat(),
            fileHeader.revision(),
            geometry.getDuplicateCount(),
            fileHeader.textualHeader());
    }

    /**
     * Takes a read reference.
     *
     * @return false if the handle has already been released for good
     */
    boolean tryAcquire() {
        while (true) {
            final int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void release() {
        if (references.decrementAndGet() == 0) {
            closeChannel();
        }
    }

    /**
     * Drops the owner's reference. The channel closes once in-flight readers release theirs.
     */
    void retire() {
        release();
    }

    boolean isReleased() {
        return references.get() <= 0;
    }

    private void closeChannel() {
        try {
            channel.close();
            log.debug("Closed volume {} (generation {})", path, generation);
        } catch (IOException e) {
            log.warn("Failed to close volume file {}: {}", path, e.getMessage());
        }
    }

    public Path getPath() {
        return path;
    }

    public long getGeneration() {
        return generation;
    }

    public FileHeader getFileHeader() {
        return fileHeader;
    }

    public GeometryIndex getGeometry() {
        return geometry;
    }

    SliceExtractor getExtractor() {
        return extractor;
    }
}
