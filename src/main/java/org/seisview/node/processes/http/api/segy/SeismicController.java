package org.seisview.node.processes.http.api.segy;

import java.io.IOException;
import java.io.InputStream;

import org.seisview.node.processes.http.api.AbstractController;
import org.seisview.node.processes.http.api.dto.ErrorResponseDto;
import org.seisview.node.processes.http.api.segy.dto.MetadataResponseDto;
import org.seisview.node.processes.http.api.segy.dto.SliceResponseDto;
import org.seisview.node.processes.http.api.segy.dto.UploadResponseDto;
import org.seisview.node.processes.http.api.segy.dto.VolumeMetadataDto;
import org.seisview.node.spi.ServiceRegistry;
import org.seisview.segy.SegyException;
import org.seisview.segy.slice.Slice;
import org.seisview.segy.slice.SliceAxis;
import org.seisview.segy.volume.VolumeAccessor;
import org.seisview.segy.volume.VolumeMetadata;
import org.seisview.storage.VolumeFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.javalin.http.UploadedFile;

/**
 * HTTP controller for the active SEG-Y volume.
 * <p>
 * Routes (relative to the configured base path, default {@code /api/segy}):
 * <ul>
 *   <li>{@code POST /upload} - store an uploaded file (multipart field {@code file}, or the raw
 *       request body) and make it the active volume</li>
 *   <li>{@code GET /metadata} - metadata of the active volume</li>
 *   <li>{@code GET /slice/inline/{iline}} - normalized inline slice</li>
 *   <li>{@code GET /slice/crossline/{xline}} - normalized crossline slice</li>
 * </ul>
 * <p>
 * An upload that is not a readable volume is answered with 400 and leaves the previous volume
 * active. Read-side failures follow the mapping of {@link AbstractController}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless apart from the shared {@link VolumeAccessor} and
 * {@link VolumeFileStore}, both of which are thread-safe.
 */
public class SeismicController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SeismicController.class);

    private static final String UPLOAD_FIELD = "file";

    private final VolumeAccessor accessor;
    private final VolumeFileStore store;

    /**
     * @param registry must provide {@link VolumeAccessor} and {@link VolumeFileStore}
     * @param options  controller options (currently unused)
     */
    public SeismicController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.accessor = registry.get(VolumeAccessor.class);
        this.store = registry.get(VolumeFileStore.class);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String uploadPath = joinPath(basePath, "upload");
        final String metadataPath = joinPath(basePath, "metadata");
        final String inlinePath = joinPath(basePath, "slice/inline/{iline}");
        final String crosslinePath = joinPath(basePath, "slice/crossline/{xline}");

        LOGGER.debug("Registering SEG-Y endpoints: upload={}, metadata={}, inline={}, crossline={}",
            uploadPath, metadataPath, inlinePath, crosslinePath);

        app.post(uploadPath, this::upload);
        app.get(metadataPath, this::getMetadata);
        app.get(inlinePath, ctx -> getSlice(ctx, SliceAxis.INLINE, ctx.pathParam("iline")));
        app.get(crosslinePath, ctx -> getSlice(ctx, SliceAxis.CROSSLINE, ctx.pathParam("xline")));

        setupExceptionHandlers(app);
    }

    /**
     * Handles {@code POST /upload}.
     * <p>
     * Response format:
     * <pre>
     * {"status": "ok", "path": "/srv/data/latest.sgy", "metadata": {...}}
     * </pre>
     */
    void upload(final Context ctx) throws IOException {
        final UploadedFile uploaded = ctx.uploadedFile(UPLOAD_FIELD);
        final String source = uploaded != null ? uploaded.filename() : "request body";

        try (InputStream content = uploaded != null ? uploaded.content() : ctx.bodyInputStream()) {
            final VolumeMetadata metadata = store.store(content, accessor::replace);
            final String path = store.getCurrentVolumePath().toString();
            LOGGER.info("Upload from {} accepted as generation {}", source, metadata.generation());
            ctx.status(HttpStatus.OK).json(new UploadResponseDto("ok", path, VolumeMetadataDto.from(path, metadata)));
        } catch (SegyException e) {
            LOGGER.warn("Rejected upload from {}: {} ({})", source, e.getMessage(), e.getErrorCode());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(e));
        }
    }

    /**
     * Handles {@code GET /metadata}.
     *
     * @throws org.seisview.segy.VolumeNotOpenException if no volume is active (404)
     */
    void getMetadata(final Context ctx) throws SegyException {
        final VolumeMetadata metadata = accessor.metadata();
        final String path = store.getCurrentVolumePath().toString();
        ctx.json(new MetadataResponseDto("ok", VolumeMetadataDto.from(path, metadata)));
    }

    /**
     * Handles both slice routes.
     *
     * @throws IllegalArgumentException if the axis value is not an integer (400)
     * @throws org.seisview.segy.AxisValueNotFoundException if the value is not in the geometry (404)
     * @throws org.seisview.segy.VolumeNotOpenException if no volume is active (404)
     */
    void getSlice(final Context ctx, final SliceAxis axis, final String rawValue) throws SegyException, IOException {
        final long startNs = System.nanoTime();
        final int value = parseIntParam(rawValue, axis.label());

        final Slice slice = accessor.slice(axis, value);

        final long totalTimeMs = (System.nanoTime() - startNs) / 1_000_000;
        ctx.header("X-Timing-Total-Ms", String.valueOf(totalTimeMs));
        ctx.header("X-Slice-Shape", slice.getSampleCount() + "x" + slice.getWidth());
        LOGGER.debug("Served {} {} ({}x{}) in {}ms", axis.label(), value,
            slice.getSampleCount(), slice.getWidth(), totalTimeMs);
        ctx.json(SliceResponseDto.from(slice));
    }
}
