package org.seisview.node.processes.http.api.segy;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.seisview.node.spi.ServiceRegistry;
import org.seisview.segy.SegyFileBuilder;
import org.seisview.segy.volume.VolumeAccessor;
import org.seisview.storage.VolumeFileStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;

import io.javalin.Javalin;
import io.javalin.testtools.HttpClient;
import io.javalin.testtools.JavalinTest;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * End-to-end tests of the SEG-Y endpoints against a real accessor and store in a temp directory.
 */
@Tag("integration")
@DisplayName("SeismicController")
class SeismicControllerTest {

    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private VolumeAccessor accessor;
    private Javalin app;

    @BeforeEach
    void setUp() throws Exception {
        accessor = new VolumeAccessor();
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(VolumeAccessor.class, accessor);
        registry.register(VolumeFileStore.class, new VolumeFileStore(tempDir.resolve("data"), "latest.sgy"));

        app = Javalin.create();
        new SeismicController(registry, ConfigFactory.empty()).registerRoutes(app, "/api/segy");
    }

    @AfterEach
    void tearDown() {
        accessor.close();
    }

    private static Response upload(HttpClient client, byte[] content) {
        RequestBody body = new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart("file", "survey.sgy", RequestBody.create(content, OCTET_STREAM))
            .build();
        return client.request("/api/segy/upload", builder -> builder.post(body));
    }

    private JsonNode json(Response response) throws Exception {
        return objectMapper.readTree(response.body().string());
    }

    @Nested
    @DisplayName("Without a volume")
    class WithoutVolume {

        @Test
        @DisplayName("Metadata should answer 404 VolumeNotOpen")
        void metadataNotOpen() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/metadata");

                assertThat(response.code()).isEqualTo(404);
                JsonNode body = json(response);
                assertThat(body.get("status").asText()).isEqualTo("error");
                assertThat(body.get("error").asText()).isEqualTo("VolumeNotOpen");
            });
        }

        @Test
        @DisplayName("Slices should answer 404 VolumeNotOpen")
        void sliceNotOpen() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/slice/inline/100");

                assertThat(response.code()).isEqualTo(404);
                assertThat(json(response).get("error").asText()).isEqualTo("VolumeNotOpen");
            });
        }
    }

    @Nested
    @DisplayName("Upload")
    class Upload {

        @Test
        @DisplayName("Should store the upload and return its metadata")
        void acceptsValidFile() {
            byte[] content = SegyFileBuilder.grid(new int[] {100, 101}, new int[] {10, 11, 12}).toBytes();

            JavalinTest.test(app, (server, client) -> {
                Response response = upload(client, content);

                assertThat(response.code()).isEqualTo(200);
                JsonNode body = json(response);
                assertThat(body.get("status").asText()).isEqualTo("ok");
                assertThat(body.get("path").asText()).endsWith("latest.sgy");
                JsonNode metadata = body.get("metadata");
                assertThat(metadata.get("num_traces").asInt()).isEqualTo(6);
                assertThat(metadata.get("num_inlines").asInt()).isEqualTo(2);
                assertThat(metadata.get("num_crosslines").asInt()).isEqualTo(3);
                assertThat(metadata.get("sample_rate_us").asInt()).isEqualTo(2000);
                assertThat(metadata.get("ilines")).hasSize(2);

                Response metadataResponse = client.get("/api/segy/metadata");
                assertThat(metadataResponse.code()).isEqualTo(200);
                assertThat(json(metadataResponse).get("metadata").get("samples_per_trace").asInt()).isEqualTo(4);
            });
        }

        @Test
        @DisplayName("Should answer 400 for an unreadable file and keep the previous volume")
        void rejectsInvalidFile() {
            byte[] good = SegyFileBuilder.grid(new int[] {1}, new int[] {1, 2}).toBytes();
            byte[] unsupported = SegyFileBuilder.create().formatCode(4).constantTrace(1, 1, 0f).toBytes();

            JavalinTest.test(app, (server, client) -> {
                assertThat(upload(client, good).code()).isEqualTo(200);

                Response response = upload(client, unsupported);

                assertThat(response.code()).isEqualTo(400);
                assertThat(json(response).get("error").asText()).isEqualTo("UnsupportedFormat");
                Response metadata = client.get("/api/segy/metadata");
                assertThat(json(metadata).get("metadata").get("num_crosslines").asInt()).isEqualTo(2);
            });
        }
    }

    @Nested
    @DisplayName("Slices")
    class Slices {

        @BeforeEach
        void openVolume() throws Exception {
            Path file = SegyFileBuilder.grid(new int[] {100, 101}, new int[] {10, 11, 12})
                .write(tempDir.resolve("grid.sgy"));
            accessor.open(file);
        }

        @Test
        @DisplayName("Inline slice should return positions and normalized data")
        void inlineSlice() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/slice/inline/100");

                assertThat(response.code()).isEqualTo(200);
                assertThat(response.header("X-Slice-Shape")).isEqualTo("4x3");
                JsonNode body = json(response);
                assertThat(body.get("iline").asInt()).isEqualTo(100);
                assertThat(body.has("xline")).isFalse();
                assertThat(body.get("positions").toString()).isEqualTo("[10,11,12]");
                assertThat(body.get("data")).hasSize(4);
                for (JsonNode row : body.get("data")) {
                    assertThat(row).hasSize(3);
                    row.forEach(v -> assertThat(v.asDouble()).isBetween(0.0, 1.0));
                }
            });
        }

        @Test
        @DisplayName("Crossline slice should return one column per inline")
        void crosslineSlice() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/slice/crossline/11");

                assertThat(response.code()).isEqualTo(200);
                JsonNode body = json(response);
                assertThat(body.get("xline").asInt()).isEqualTo(11);
                assertThat(body.get("positions").toString()).isEqualTo("[100,101]");
            });
        }

        @Test
        @DisplayName("Unknown axis values should answer 404 AxisValueNotFound")
        void unknownValue() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/slice/crossline/13");

                assertThat(response.code()).isEqualTo(404);
                assertThat(json(response).get("error").asText()).isEqualTo("AxisValueNotFound");
            });
        }

        @Test
        @DisplayName("Non-numeric axis values should answer 400")
        void invalidValue() {
            JavalinTest.test(app, (server, client) -> {
                Response response = client.get("/api/segy/slice/inline/abc");

                assertThat(response.code()).isEqualTo(400);
                assertThat(json(response).get("error").asText()).isEqualTo("BadRequest");
            });
        }
    }
}
