package com.skein.reindex;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skein.config.PipelineConfig;
import com.skein.model.EntityReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Fetches records with {@code com.atproto.repo.getRecord} from an XRPC service.
 *
 * <p>A 404, or a 400 carrying {@code RecordNotFound}, means the record is gone.  Every
 * other non-2xx answer is an {@link IOException}.</p>
 */
@Slf4j
public class XrpcRecordFetcher implements RecordFetcher {

    static final String GET_RECORD_PATH = "/xrpc/com.atproto.repo.getRecord";

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public XrpcRecordFetcher(PipelineConfig.ReindexSection config, ObjectMapper objectMapper) {
        this(config, objectMapper, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getTimeoutMs()))
                .build());
    }

    XrpcRecordFetcher(PipelineConfig.ReindexSection config, ObjectMapper objectMapper, HttpClient httpClient) {
        if (config.getRecordSourceUrl() == null || config.getRecordSourceUrl().isBlank()) {
            throw new IllegalArgumentException("skein.reindex.record-source-url is required");
        }
        String url = config.getRecordSourceUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.timeout = Duration.ofMillis(config.getTimeoutMs());
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        log.info("Initialised XrpcRecordFetcher → {}", baseUrl);
    }

    @Override
    public Optional<FetchedRecord> fetch(EntityReference ref) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(requestUri(ref))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted fetching " + ref, e);
        }

        int status = response.statusCode();
        if (status == 404 || (status == 400 && response.body() != null && response.body().contains("RecordNotFound"))) {
            log.info("Origin reports {} as deleted (HTTP {})", ref, status);
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new IOException("getRecord for " + ref + " returned HTTP " + status + ": " + response.body());
        }

        JsonNode body = objectMapper.readTree(response.body());
        JsonNode value = body.get("value");
        if (value == null || !value.isObject()) {
            throw new IOException("getRecord for " + ref + " returned no record value");
        }
        return Optional.of(new FetchedRecord(body.path("cid").asText(null), value));
    }

    URI requestUri(EntityReference ref) {
        return URI.create(baseUrl + GET_RECORD_PATH
                + "?repo=" + encode(ref.getRepo())
                + "&collection=" + encode(ref.getCollection())
                + "&rkey=" + encode(ref.getRkey()));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
