package io.github.drompincen.reportscheduler.gateway.renderer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.reportscheduler.protocol.api.OutputFormat;
import io.github.drompincen.reportscheduler.runtime.scheduler.RenderOutcome;
import io.github.drompincen.reportscheduler.runtime.scheduler.ReportRenderer;
import io.github.drompincen.reportscheduler.runtime.scheduler.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Delegates rendering and delivery to an external report service over HTTP.
 *
 * <p>POSTs the schedule as JSON; any 2xx answer is a success and its {@code artifactRef} field, if
 * present, is kept as the artifact reference.
 */
@Component
public class HttpReportRenderer implements ReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(HttpReportRenderer.class);
    private static final int MAX_REASON_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final URI rendererUri;
    private final Duration timeout;
    private final HttpClient client;

    public HttpReportRenderer(ObjectMapper objectMapper,
                              @Value("${reportscheduler.renderer.url:http://localhost:8090/render}") String rendererUrl,
                              @Value("${reportscheduler.renderer.timeout:5m}") Duration timeout) {
        this.objectMapper = objectMapper;
        this.rendererUri = URI.create(rendererUrl);
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public RenderOutcome render(Schedule schedule) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(rendererUri)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload(schedule))))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status / 100 != 2) {
                return RenderOutcome.failure("renderer returned HTTP " + status + ": " + truncate(response.body()));
            }
            return RenderOutcome.success(artifactRef(response.body()));
        } catch (HttpTimeoutException e) {
            return RenderOutcome.failure("renderer timed out after " + timeout);
        } catch (IOException e) {
            return RenderOutcome.failure("renderer unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RenderOutcome.failure("render interrupted");
        }
    }

    private ObjectNode payload(Schedule schedule) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("scheduleId", schedule.id());
        body.put("reportId", schedule.reportId());
        body.put("name", schedule.name());
        var formats = body.putArray("outputFormats");
        for (OutputFormat format : schedule.outputFormats()) {
            formats.add(format.name());
        }
        var recipients = body.putArray("recipients");
        schedule.recipients().forEach(recipients::add);
        body.put("scheduledFor", schedule.nextRun() != null ? schedule.nextRun().toString() : null);
        return body;
    }

    private String artifactRef(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode ref = node.get("artifactRef");
            return ref != null && !ref.isNull() ? ref.asText() : null;
        } catch (IOException e) {
            log.debug("Renderer response is not JSON, keeping no artifact reference: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String text) {
        if (text == null) return "";
        return text.length() <= MAX_REASON_LENGTH ? text : text.substring(0, MAX_REASON_LENGTH);
    }
}
