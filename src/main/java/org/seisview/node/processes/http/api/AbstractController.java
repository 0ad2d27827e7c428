package org.seisview.node.processes.http.api;

import java.io.IOException;

import org.seisview.node.processes.http.api.dto.ErrorResponseDto;
import org.seisview.node.spi.ServiceRegistry;
import org.seisview.segy.AxisValueNotFoundException;
import org.seisview.segy.SegyException;
import org.seisview.segy.VolumeNotOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.HttpStatus;

/**
 * Base class for HTTP controllers.
 * <p>
 * Controllers are instantiated reflectively by the HTTP server process with the shared
 * {@link ServiceRegistry} and their own {@code options} block, then asked to register their
 * routes under a configured base path.
 * <p>
 * The base class maps the engine's error taxonomy to responses:
 * <ul>
 *   <li>{@link VolumeNotOpenException}, {@link AxisValueNotFoundException} - 404</li>
 *   <li>other {@link SegyException} - 500 (the active volume is unreadable)</li>
 *   <li>{@link IllegalArgumentException} - 400 (invalid request parameters)</li>
 *   <li>{@link IOException} - 500</li>
 * </ul>
 * Every error body is an {@link ErrorResponseDto}.
 */
public abstract class AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractController.class);

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Registers this controller's routes.
     *
     * @param app      the Javalin instance
     * @param basePath path prefix configured for this controller
     */
    public abstract void registerRoutes(Javalin app, String basePath);

    /**
     * Joins a base path and a sub path without doubling slashes or leaving a trailing one.
     */
    protected static String joinPath(final String basePath, final String subPath) {
        final String joined = ("/" + basePath + "/" + subPath).replaceAll("/{2,}", "/");
        return joined.length() > 1 && joined.endsWith("/") ? joined.substring(0, joined.length() - 1) : joined;
    }

    /**
     * Installs the shared exception mappings. Safe to call from several controllers.
     *
     * @param app the Javalin instance
     */
    protected void setupExceptionHandlers(final Javalin app) {
        app.exception(VolumeNotOpenException.class, (e, ctx) -> {
            LOGGER.debug("Request {} before a volume was opened", ctx.path());
            ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(e));
        });
        app.exception(AxisValueNotFoundException.class, (e, ctx) -> {
            LOGGER.debug("Unknown {} {} requested", e.getAxis().label(), e.getValue());
            ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(e));
        });
        app.exception(SegyException.class, (e, ctx) -> {
            LOGGER.error("Volume read failed for {}: {} ({})", ctx.path(), e.getMessage(), e.getErrorCode());
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(e));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            LOGGER.debug("Bad request for {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of("BadRequest", e.getMessage()));
        });
        app.exception(IOException.class, (e, ctx) -> {
            LOGGER.error("I/O failure while serving {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of("IOError", e.getMessage()));
        });
    }

    /**
     * Parses a required integer path parameter.
     *
     * @param raw  the raw value
     * @param name parameter name for error messages
     * @return the parsed value
     * @throws IllegalArgumentException if the value is missing or not an integer
     */
    protected static int parseIntParam(final String raw, final String name) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " parameter is required");
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + raw, e);
        }
    }
}
