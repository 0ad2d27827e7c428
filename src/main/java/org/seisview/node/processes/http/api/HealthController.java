package org.seisview.node.processes.http.api;

import java.util.Map;

import org.seisview.node.spi.ServiceRegistry;

import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;

/**
 * Liveness probe. Answers {@code {"status": "ok"}} whenever the server accepts requests,
 * whether or not a volume is open.
 */
public class HealthController extends AbstractController {

    public HealthController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(joinPath(basePath, ""), this::health);
    }

    void health(final Context ctx) {
        ctx.json(Map.of("status", "ok"));
    }
}
