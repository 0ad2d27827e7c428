package org.seisview.segy.volume;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.seisview.segy.SegyException;
import org.seisview.segy.VolumeNotOpenException;
import org.seisview.segy.format.HeaderDecoder;
import org.seisview.segy.format.TraceHeaderLayout;
import org.seisview.segy.slice.AmplitudeNormalizer;
import org.seisview.segy.slice.Slice;
import org.seisview.segy.slice.SliceAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Façade over the active seismic volume.
 * <p>
 * States are {@link VolumeState#CLOSED} and {@link VolumeState#OPEN}. {@link #open(Path)} and
 * {@link #replace(Path)} build a complete {@link VolumeHandle} (header decode plus full geometry
 * scan) off to the side and publish it with a single atomic reference swap. If building fails,
 * nothing changes: a closed accessor stays closed and a previously open volume stays servable.
 * <p>
 * <strong>Thread Safety:</strong> {@link #metadata()} and {@link #slice(SliceAxis, int)} may run
 * concurrently from any number of threads. Open, replace and close are serialized among
 * themselves (single writer) but never block readers. A reader that picked up a handle before a
 * swap finishes against that handle; its file is closed only after the last such reader is done.
 * <p>
 * <strong>Configuration</strong> (all optional):
 * <pre>
 * segy {
 *   header-convention = "rev1"   # or "legacy"
 *   inline-byte = 189
 *   crossline-byte = 193
 * }
 * slice-cache.maximum-size = 64
 * </pre>
 */
public class VolumeAccessor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VolumeAccessor.class);

    static final int DEFAULT_SLICE_CACHE_SIZE = 64;

    private final HeaderDecoder decoder;
    private final AmplitudeNormalizer normalizer = new AmplitudeNormalizer();
    private final int sliceCacheSize;
    private final AtomicReference<VolumeHandle> current = new AtomicReference<>();
    private final AtomicLong generations = new AtomicLong();
    private final Object writeLock = new Object();

    public VolumeAccessor() {
        this(new HeaderDecoder(), DEFAULT_SLICE_CACHE_SIZE);
    }

    public VolumeAccessor(HeaderDecoder decoder, int sliceCacheSize) {
        if (sliceCacheSize < 0) {
            throw new IllegalArgumentException("slice cache size must be non-negative: " + sliceCacheSize);
        }
        this.decoder = decoder;
        this.sliceCacheSize = sliceCacheSize;
    }

    /**
     * Creates an accessor from the {@code seisview.volume} configuration block.
     *
     * @param options configuration, see class documentation for keys
     * @return the accessor, in state {@link VolumeState#CLOSED}
     */
    public static VolumeAccessor fromConfig(Config options) {
        final TraceHeaderLayout layout = options.hasPath("segy")
            ? TraceHeaderLayout.fromConfig(options.getConfig("segy"))
            : TraceHeaderLayout.REV1;
        final int cacheSize = options.hasPath("slice-cache.maximum-size")
            ? options.getInt("slice-cache.maximum-size")
            : DEFAULT_SLICE_CACHE_SIZE;
        log.debug("Volume accessor: inline byte {}, crossline byte {}, slice cache {}",
            layout.inlineByte(), layout.crosslineByte(), cacheSize);
        return new VolumeAccessor(new HeaderDecoder(layout), cacheSize);
    }

    /**
     * Opens a volume and makes it the active one.
     * <p>
     * Calling this while a volume is already open behaves like {@link #replace(Path)}.
     *
     * @param path SEG-Y file
     * @return metadata of the newly opened volume
     * @throws SegyException if the file is not a readable volume; the accessor is unchanged
     * @throws IOException   if the file cannot be read; the accessor is unchanged
     */
    public VolumeMetadata open(Path path) throws SegyException, IOException {
        return install(path, null);
    }

    /**
     * Swaps in a new volume once it has been opened completely.
     * <p>
     * The previous volume stays servable until the swap and is discarded only on success.
     *
     * @param path SEG-Y file
     * @return metadata of the new volume
     * @throws SegyException if the file is not a readable volume; the previous volume stays active
     * @throws IOException   if the file cannot be read; the previous volume stays active
     */
    public VolumeMetadata replace(Path path) throws SegyException, IOException {
        return install(path, null);
    }

    /**
     * Like {@link #replace(Path)}, but runs {@code beforeSwap} after the new volume has opened and
     * before it becomes active. If that step fails the new volume is discarded and the previous
     * one stays active.
     *
     * @param path       SEG-Y file
     * @param beforeSwap step that must succeed for the swap to happen, e.g. persisting the file
     * @return metadata of the new volume
     * @throws SegyException if the file is not a readable volume; the previous volume stays active
     * @throws IOException   if the file cannot be read or {@code beforeSwap} fails; the previous
     *                       volume stays active
     */
    public VolumeMetadata replace(Path path, BeforeSwap beforeSwap) throws SegyException, IOException {
        return install(path, beforeSwap);
    }

    /**
     * Work that has to succeed before a freshly opened volume is made active.
     */
    @FunctionalInterface
    public interface BeforeSwap {

        void run() throws IOException;
    }

    private VolumeMetadata install(Path path, BeforeSwap beforeSwap) throws SegyException, IOException {
        synchronized (writeLock) {
            final long startNs = System.nanoTime();
            final VolumeHandle fresh;
            try {
                fresh = VolumeHandle.open(path, decoder, sliceCacheSize, generations.incrementAndGet());
            } catch (SegyException e) {
                log.warn("Failed to open volume {}: {} ({})", path, e.getMessage(), e.getErrorCode());
                throw e;
            } catch (IOException e) {
                log.warn("Failed to read volume {}: {}", path, e.getMessage());
                throw e;
            }

            if (beforeSwap != null) {
                try {
                    beforeSwap.run();
                } catch (IOException | RuntimeException e) {
                    fresh.retire();
                    log.warn("Volume {} opened but not activated: {}", path, e.getMessage());
                    throw e;
                }
            }

            final VolumeHandle previous = current.getAndSet(fresh);
            if (previous != null) {
                previous.retire();
            }

            final VolumeMetadata metadata = fresh.metadata();
            log.info("{} volume {} (generation {}): {} traces, {} inlines x {} crosslines, {} samples, {} in {}ms",
                previous == null ? "Opened" : "Replaced with", path, fresh.getGeneration(),
                metadata.traceCount(), metadata.inlineCount(), metadata.crosslineCount(),
                metadata.samplesPerTrace(), metadata.sampleFormat(), (System.nanoTime() - startNs) / 1_000_000);
            return metadata;
        }
    }

    /**
     * Returns the active volume's metadata.
     *
     * @return metadata
     * @throws VolumeNotOpenException if no volume is open
     */
    public VolumeMetadata metadata() throws VolumeNotOpenException {
        final VolumeHandle handle = current.get();
        if (handle == null) {
            throw new VolumeNotOpenException("No volume is open");
        }
        return handle.metadata();
    }

    /**
     * Extracts and normalizes a slice of the active volume.
     *
     * @param axis  axis to cut along
     * @param value inline or crossline number
     * @return the normalized slice, values in [0, 1]
     * @throws VolumeNotOpenException                           if no volume is open
     * @throws org.seisview.segy.AxisValueNotFoundException     if {@code value} is not part of the geometry
     * @throws org.seisview.segy.TruncatedTraceException        if a trace is cut short
     * @throws IOException                                      if reading fails
     */
    public Slice slice(SliceAxis axis, int value) throws SegyException, IOException {
        final VolumeHandle handle = acquire();
        try {
            return handle.normalizedSlice(axis, value, normalizer);
        } finally {
            handle.release();
        }
    }

    /**
     * Extracts a slice without normalization.
     *
     * @param axis  axis to cut along
     * @param value inline or crossline number
     * @return the raw amplitudes
     * @throws SegyException as for {@link #slice(SliceAxis, int)}
     * @throws IOException   if reading fails
     */
    public Slice rawSlice(SliceAxis axis, int value) throws SegyException, IOException {
        final VolumeHandle handle = acquire();
        try {
            return handle.getExtractor().extract(axis, value);
        } finally {
            handle.release();
        }
    }

    public VolumeState state() {
        return current.get() == null ? VolumeState.CLOSED : VolumeState.OPEN;
    }

    /**
     * Returns to {@link VolumeState#CLOSED}. In-flight reads complete against the old volume.
     */
    @Override
    public void close() {
        synchronized (writeLock) {
            final VolumeHandle previous = current.getAndSet(null);
            if (previous != null) {
                previous.retire();
                log.info("Closed volume {} (generation {})", previous.getPath(), previous.getGeneration());
            }
        }
    }

    private VolumeHandle acquire() throws VolumeNotOpenException {
        while (true) {
            final VolumeHandle handle = current.get();
            if (handle == null) {
                throw new VolumeNotOpenException("No volume is open");
            }
            if (handle.tryAcquire()) {
                return handle;
            }
            // Retired between read and acquire; the reference has been swapped already.
        }
    }

    VolumeHandle currentHandle() {
        return current.get();
    }
}
