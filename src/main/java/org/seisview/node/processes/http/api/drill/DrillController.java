package org.seisview.node.processes.http.api.drill;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.seisview.node.processes.http.api.AbstractController;
import org.seisview.node.processes.http.api.drill.dto.DrillStateMessageDto;
import org.seisview.node.processes.http.api.drill.dto.DrillUpdateResponseDto;
import org.seisview.node.spi.ServiceRegistry;
import org.seisview.telemetry.DrillState;
import org.seisview.telemetry.DrillStateBroadcaster;
import org.seisview.telemetry.DrillStateListener;
import org.seisview.telemetry.DrillStateUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsContext;

/**
 * HTTP and WebSocket endpoints for the live drilling overlay.
 * <p>
 * {@code POST {basePath}/update} accepts a partial {@link DrillStateUpdate}, merges it into the
 * shared state and answers with the merged state. Every WebSocket client connected to
 * {@code websocket-path} receives the current state on connect and every merged state afterwards,
 * wrapped as {@code {"type": "drill_state", "payload": {...}}}.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * options {
 *   websocket-path = "/ws/drill"
 * }
 * </pre>
 */
public class DrillController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DrillController.class);

    static final String DEFAULT_WEBSOCKET_PATH = "/ws/drill";

    private final DrillStateBroadcaster broadcaster;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, DrillStateListener> sessions = new ConcurrentHashMap<>();
    private final String websocketPath;

    public DrillController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.broadcaster = registry.get(DrillStateBroadcaster.class);
        this.websocketPath = options.hasPath("websocket-path")
            ? options.getString("websocket-path")
            : DEFAULT_WEBSOCKET_PATH;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String updatePath = joinPath(basePath, "update");
        final String wsPath = joinPath(websocketPath, "");
        LOGGER.debug("Registering drill endpoints: update={}, websocket={}", updatePath, wsPath);

        app.post(updatePath, this::update);
        app.ws(wsPath, ws -> {
            ws.onConnect(this::connect);
            ws.onClose(ctx -> disconnect(ctx, "closed"));
            ws.onError(ctx -> disconnect(ctx, "error"));
        });

        setupExceptionHandlers(app);
    }

    void update(final Context ctx) {
        final DrillStateUpdate update = parseUpdate(ctx.body());
        final DrillState merged = broadcaster.update(update);
        ctx.json(new DrillUpdateResponseDto("ok", merged));
    }

    private DrillStateUpdate parseUpdate(final String body) {
        final DrillStateUpdate update;
        try {
            update = objectMapper.readValue(body, DrillStateUpdate.class);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed drill update: " + e.getOriginalMessage(), e);
        }
        if (update == null) {
            throw new IllegalArgumentException("Drill update body is required");
        }
        return update;
    }

    private void connect(final WsContext ctx) {
        final DrillStateListener listener = state -> ctx.send(DrillStateMessageDto.of(state));
        sessions.put(ctx.sessionId(), listener);
        if (broadcaster.subscribe(listener)) {
            LOGGER.debug("Drill client {} connected", ctx.sessionId());
        } else {
            sessions.remove(ctx.sessionId());
        }
    }

    private void disconnect(final WsContext ctx, final String reason) {
        final DrillStateListener listener = sessions.remove(ctx.sessionId());
        if (listener != null) {
            broadcaster.unsubscribe(listener);
            LOGGER.debug("Drill client {} disconnected ({})", ctx.sessionId(), reason);
        }
    }

    int connectedClients() {
        return sessions.size();
    }
}
