package io.github.drompincen.reportscheduler.gateway.renderer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.github.drompincen.reportscheduler.protocol.api.Frequency;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.runtime.scheduler.RenderOutcome;
import io.github.drompincen.reportscheduler.runtime.scheduler.Schedule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpReportRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private HttpServer server;
    private volatile int status = 200;
    private volatile String reply = "{\"artifactRef\":\"s3://reports/weekly-sales.pdf\"}";
    private volatile long delayMs;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/render", exchange -> {
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void success_returnsArtifactRef_andPostsSchedulePayload() throws Exception {
        RenderOutcome outcome = renderer(Duration.ofSeconds(5)).render(schedule());

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.artifactRef()).isEqualTo("s3://reports/weekly-sales.pdf");

        JsonNode sent = mapper.readTree(lastBody.get());
        assertThat(sent.get("scheduleId").asText()).isEqualTo("s1");
        assertThat(sent.get("reportId").asText()).isEqualTo("sales");
        assertThat(sent.get("outputFormats").get(0).asText()).isEqualTo("PDF");
        assertThat(sent.get("recipients").get(0).asText()).isEqualTo("sales@example.com");
        assertThat(sent.get("scheduledFor").asText()).isEqualTo("2024-01-08T09:00:00Z");
    }

    @Test
    void successWithoutJsonBody_hasNoArtifactRef() {
        reply = "done";

        RenderOutcome outcome = renderer(Duration.ofSeconds(5)).render(schedule());

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.artifactRef()).isNull();
    }

    @Test
    void serverError_isFailureWithStatusInReason() {
        status = 503;
        reply = "renderer overloaded";

        RenderOutcome outcome = renderer(Duration.ofSeconds(5)).render(schedule());

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.reason()).contains("503").contains("renderer overloaded");
    }

    @Test
    void slowRenderer_timesOut() {
        delayMs = 1500;

        RenderOutcome outcome = renderer(Duration.ofMillis(200)).render(schedule());

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.reason()).contains("timed out");
    }

    @Test
    void unreachableRenderer_isFailure() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpReportRenderer renderer = new HttpReportRenderer(mapper,
                "http://127.0.0.1:" + closedPort + "/render", Duration.ofSeconds(2));

        RenderOutcome outcome = renderer.render(schedule());

        assertThat(outcome.succeeded()).isFalse();
    }

    private HttpReportRenderer renderer(Duration timeout) {
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/render";
        return new HttpReportRenderer(mapper, url, timeout);
    }

    private static Schedule schedule() {
        return new Schedule("s1", "Weekly sales", "sales", Frequency.WEEKLY, LocalTime.of(9, 0), "UTC", 1, null,
                true, Instant.parse("2024-01-08T09:00:00Z"), null, 0, 0, Set.of(OutputFormat.PDF),
                List.of("sales@example.com"), false, null);
    }
}
