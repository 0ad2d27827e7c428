package org.seisview.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.seisview.cli.CommandLineInterface;
import org.seisview.node.processes.http.HttpServerProcess;
import org.seisview.node.spi.ServiceRegistry;
import org.seisview.segy.volume.VolumeAccessor;
import org.seisview.storage.VolumeFileStore;
import org.seisview.telemetry.DrillStateBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Starts the HTTP server and blocks until the JVM shuts down.
 */
@Command(
    name = "serve",
    description = "Start the SEG-Y volume server"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Option(
        names = {"-p", "--port"},
        description = "HTTP port (overrides seisview.http.port)"
    )
    private Integer port;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        Config config = parent.getConfig().getConfig("seisview");
        if (port != null) {
            config = ConfigFactory.parseMap(Map.of("http.port", port)).withFallback(config);
        }

        final ServiceRegistry registry;
        try {
            registry = createServices(config);
        } catch (IOException e) {
            err.println("Error: cannot prepare data directory: " + e.getMessage());
            log.error("Failed to prepare storage", e);
            return 1;
        }

        final HttpServerProcess server = new HttpServerProcess("http", registry, config.getConfig("http"));
        final CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            shutdown.countDown();
        }, "seisview-shutdown"));

        server.start();
        out.println("SeisView listening on port " + server.port());
        out.flush();

        try {
            shutdown.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
        return 0;
    }

    /**
     * Builds the services shared by all controllers.
     *
     * @param config the {@code seisview} configuration block
     * @return a registry with {@link VolumeAccessor}, {@link VolumeFileStore} and
     *         {@link DrillStateBroadcaster}
     * @throws IOException if the data directory cannot be created
     */
    public static ServiceRegistry createServices(final Config config) throws IOException {
        final ServiceRegistry registry = new ServiceRegistry();
        registry.register(VolumeAccessor.class, VolumeAccessor.fromConfig(config.getConfig("volume")));
        registry.register(VolumeFileStore.class, new VolumeFileStore(config.getConfig("storage")));
        registry.register(DrillStateBroadcaster.class, new DrillStateBroadcaster());
        return registry;
    }
}
