package org.seisview.node.processes.http;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.TreeSet;

import org.seisview.node.processes.AbstractProcess;
import org.seisview.node.processes.http.api.AbstractController;
import org.seisview.node.spi.ServiceRegistry;
import org.seisview.segy.SegyException;
import org.seisview.segy.volume.VolumeAccessor;
import org.seisview.storage.VolumeFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.javalin.config.SizeUnit;

/**
 * Node process running the embedded Javalin server.
 * <p>
 * Controllers are declared in configuration and instantiated reflectively; each must extend
 * {@link AbstractController} and expose a {@code (ServiceRegistry, Config)} constructor.
 * <p>
 * On {@link #start()} the persisted volume, if any, is opened before the server accepts requests.
 * If that file cannot be opened the server still starts, with no active volume.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * http {
 *   host = "0.0.0.0"
 *   port = 8000
 *   cors.allowed-origins = ["*"]
 *   upload.max-file-size-mb = 4096
 *   routes {
 *     segy {
 *       className = "org.seisview.node.processes.http.api.segy.SeismicController"
 *       basePath = "/api/segy"
 *       options { }
 *     }
 *   }
 * }
 * </pre>
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private final Object lifecycleLock = new Object();
    private Javalin app;

    public HttpServerProcess(final String processName, final ServiceRegistry registry, final Config options) {
        super(processName, registry, options);
    }

    /**
     * Creates the Javalin instance with every configured controller registered, without starting it.
     *
     * @return the configured application
     * @throws IllegalStateException if a controller cannot be instantiated
     */
    public Javalin createApp() {
        final List<String> origins = options.hasPath("cors.allowed-origins")
            ? options.getStringList("cors.allowed-origins")
            : List.of("*");
        final long maxUploadMb = options.hasPath("upload.max-file-size-mb")
            ? options.getLong("upload.max-file-size-mb")
            : 4096L;

        final Javalin javalin = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jetty.multipartConfig.maxFileSize(maxUploadMb, SizeUnit.MB);
            config.jetty.multipartConfig.maxTotalRequestSize(maxUploadMb, SizeUnit.MB);
            config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                if (origins.isEmpty() || origins.contains("*")) {
                    rule.anyHost();
                } else {
                    rule.allowHost(origins.get(0), origins.subList(1, origins.size()).toArray(new String[0]));
                }
            }));
        });

        if (options.hasPath("routes")) {
            final Config routes = options.getConfig("routes");
            for (final String name : new TreeSet<>(routes.root().keySet())) {
                final Config route = routes.getConfig(name);
                final AbstractController controller = instantiateController(name, route);
                final String basePath = route.getString("basePath");
                controller.registerRoutes(javalin, basePath);
                LOGGER.debug("Registered route '{}' ({}) at {}", name,
                    controller.getClass().getSimpleName(), basePath);
            }
        } else {
            LOGGER.warn("No HTTP routes configured; the server will answer 404 to every request");
        }
        return javalin;
    }

    private AbstractController instantiateController(final String name, final Config route) {
        final String className = route.getString("className");
        final Config controllerOptions = route.hasPath("options")
            ? route.getConfig("options")
            : ConfigFactory.empty();
        try {
            final Class<?> type = Class.forName(className);
            if (!AbstractController.class.isAssignableFrom(type)) {
                throw new IllegalStateException("Route '" + name + "': " + className
                    + " does not extend " + AbstractController.class.getSimpleName());
            }
            final Constructor<?> constructor = type.getConstructor(ServiceRegistry.class, Config.class);
            return (AbstractController) constructor.newInstance(registry, controllerOptions);
        } catch (final ClassNotFoundException | NoSuchMethodException | InstantiationException
                       | IllegalAccessException e) {
            throw new IllegalStateException("Route '" + name + "': cannot instantiate " + className, e);
        } catch (final InvocationTargetException e) {
            throw new IllegalStateException("Route '" + name + "': constructor of " + className + " failed",
                e.getCause());
        }
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (app != null) {
                LOGGER.debug("HTTP server '{}' already running", processName);
                return;
            }
            openPersistedVolume();

            final String host = options.hasPath("host") ? options.getString("host") : "0.0.0.0";
            final int port = options.hasPath("port") ? options.getInt("port") : 8000;
            final Javalin javalin = createApp();
            javalin.start(host, port);
            app = javalin;
            LOGGER.info("HTTP server '{}' listening on {}:{}", processName, host, javalin.port());
        }
    }

    /**
     * Opens the stored volume from a previous run. Failures are logged and leave the accessor closed.
     */
    void openPersistedVolume() {
        if (!registry.contains(VolumeFileStore.class) || !registry.contains(VolumeAccessor.class)) {
            return;
        }
        final VolumeFileStore store = registry.get(VolumeFileStore.class);
        if (!store.hasCurrentVolume()) {
            LOGGER.info("No stored volume at {}; waiting for an upload", store.getCurrentVolumePath());
            return;
        }
        try {
            registry.get(VolumeAccessor.class).open(store.getCurrentVolumePath());
        } catch (final SegyException e) {
            LOGGER.warn("Stored volume {} could not be opened ({}): {}",
                store.getCurrentVolumePath(), e.getErrorCode(), e.getMessage());
        } catch (final IOException e) {
            LOGGER.warn("Stored volume {} could not be read: {}", store.getCurrentVolumePath(), e.getMessage());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (app == null) {
                return;
            }
            app.stop();
            app = null;
            if (registry.contains(VolumeAccessor.class)) {
                registry.get(VolumeAccessor.class).close();
            }
            LOGGER.info("HTTP server '{}' stopped", processName);
        }
    }

    /**
     * @return the bound port, or -1 if the server is not running
     */
    public int port() {
        synchronized (lifecycleLock) {
            return app == null ? -1 : app.port();
        }
    }
}
