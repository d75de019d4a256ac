package com.scorebench.evaluator.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP client a compute worker uses to report run status:
 *
 *   POST {base-url}/jobs/{job id}/callback
 *   {"status": "failed", "secret": "...", "extra": {"traceback": "..."}}
 */
public class WorkerCallbackClient {

    private static final Logger log = LoggerFactory.getLogger(WorkerCallbackClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public WorkerCallbackClient(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, objectMapper, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    WorkerCallbackClient(String baseUrl, ObjectMapper objectMapper, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.json    = objectMapper;
        this.http    = http;
    }

    /**
     * @param traceback optional, attached as extra.traceback
     * @throws WorkerException if the service does not answer 2xx
     */
    public void report(UUID jobId, String status, String secret, String traceback) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("secret", secret);
        if (traceback != null) {
            body.put("extra", Map.of("traceback", traceback));
        }
        log.info("Reporting '{}' for job {}", status, jobId);
        post("/jobs/" + jobId + "/callback", toJson(body), "callback for job " + jobId);
    }

    private void post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new WorkerException(opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
        } catch (WorkerException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new WorkerException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new WorkerException("JSON serialization failed", e);
        }
    }
}
