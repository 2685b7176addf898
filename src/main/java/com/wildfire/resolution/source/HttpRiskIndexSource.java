package com.wildfire.resolution.source;

import com.wildfire.resolution.core.model.GeoCoordinate;
import com.wildfire.resolution.error.Result;
import com.wildfire.resolution.fetch.HttpStatusException;
import com.wildfire.resolution.fetch.ResilientFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Risk index source backed by an HTTP endpoint answering
 * {@code GET <baseUrl>?lat=<lat>&lon=<lon>} with a reading body.
 *
 * <p>Every query runs inside the shared {@link ResilientFetcher}, so non-2xx statuses, transport
 * faults and unparseable bodies are classified and retried there.</p>
 *
 * Usage:
 * <pre>
 * HttpRiskIndexSource primary = HttpRiskIndexSource.builder()
 *     .name("effis")
 *     .baseUrl("https://fwi.example.org/api/fwi")
 *     .fetcher(fetcher)
 *     .build();
 * </pre>
 */
public class HttpRiskIndexSource implements RiskIndexSource {
    private static final Logger log = LoggerFactory.getLogger(HttpRiskIndexSource.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final String baseUrl;
    private final int maxRetries;
    private final ResilientFetcher fetcher;
    private final ReadingParser parser;
    private final HttpClient httpClient;

    private HttpRiskIndexSource(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.baseUrl = Objects.requireNonNull(builder.baseUrl, "baseUrl is required");
        this.fetcher = Objects.requireNonNull(builder.fetcher, "fetcher is required");
        this.maxRetries = builder.maxRetries != null ? builder.maxRetries : fetcher.defaultMaxRetries();
        this.parser = builder.parser != null ? builder.parser : new JsonReadingParser();
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build();
    }

    @Override
    public Result<RawIndexReading> query(GeoCoordinate coordinate, Duration timeout) {
        URI uri = requestUri(coordinate);
        return fetcher.fetch(() -> get(uri, timeout), maxRetries, timeout);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl))
                    .timeout(AVAILABILITY_TIMEOUT)
                    .GET()
                    .build();
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() < 500;
        } catch (IOException e) {
            log.debug("Risk source {} not available: {}", name, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    URI requestUri(GeoCoordinate coordinate) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(String.format(Locale.ROOT, "%s%slat=%.6f&lon=%.6f",
                baseUrl, separator, coordinate.latitude(), coordinate.longitude()));
    }

    private RawIndexReading get(URI uri, Duration timeout) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new HttpStatusException(status, name + " returned status " + status);
        }
        log.debug("{} responded, body length: {}", name, response.body() != null ? response.body().length() : 0);
        return parser.parse(response.body());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String baseUrl;
        private Integer maxRetries;
        private ResilientFetcher fetcher;
        private ReadingParser parser;
        private HttpClient httpClient;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder fetcher(ResilientFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder parser(ReadingParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public HttpRiskIndexSource build() {
            return new HttpRiskIndexSource(this);
        }
    }
}
