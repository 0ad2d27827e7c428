package org.seisview.node.processes.http.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.seisview.node.spi.ServiceRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;

@Tag("unit")
class AbstractControllerTest {

    @Test
    void joinPath_normalizesSlashes() {
        assertThat(AbstractController.joinPath("/api/segy", "metadata")).isEqualTo("/api/segy/metadata");
        assertThat(AbstractController.joinPath("/api/segy/", "/metadata")).isEqualTo("/api/segy/metadata");
        assertThat(AbstractController.joinPath("api", "")).isEqualTo("/api");
        assertThat(AbstractController.joinPath("/health", "")).isEqualTo("/health");
        assertThat(AbstractController.joinPath("/", "")).isEqualTo("/");
    }

    @Test
    void parseIntParam_acceptsSignedIntegers() {
        assertThat(AbstractController.parseIntParam(" -12 ", "iline")).isEqualTo(-12);
    }

    @Test
    void parseIntParam_rejectsGarbage() {
        assertThatThrownBy(() -> AbstractController.parseIntParam("1.5", "iline"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("iline");
        assertThatThrownBy(() -> AbstractController.parseIntParam("", "xline"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("required");
    }

    @Test
    void health_answersOk() {
        Javalin app = Javalin.create();
        new HealthController(new ServiceRegistry(), ConfigFactory.empty()).registerRoutes(app, "/health");

        JavalinTest.test(app, (server, client) -> {
            var response = client.get("/health");
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.body().string()).isEqualTo("{\"status\":\"ok\"}");
        });
    }
}
