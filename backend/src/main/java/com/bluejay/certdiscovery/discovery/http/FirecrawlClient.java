package com.bluejay.certdiscovery.discovery.http;

import com.bluejay.certdiscovery.config.DiscoveryProperties;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.scrape.CrawlPage;
import com.bluejay.certdiscovery.discovery.scrape.CrawlRequest;
import com.bluejay.certdiscovery.discovery.scrape.FetchOptions;
import com.bluejay.certdiscovery.discovery.scrape.MapLink;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.scrape.ScrapingClient;
import com.bluejay.certdiscovery.discovery.util.ReasonCodeClassifier;
import com.bluejay.certdiscovery.discovery.util.UrlNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * REST adapter for the Firecrawl v1 API (map, crawl with status polling, scrape).
 */
@Service
public class FirecrawlClient implements ScrapingClient {
    private static final Logger log = LoggerFactory.getLogger(FirecrawlClient.class);
    private static final int ERROR_BODY_LIMIT = 300;

    private final DiscoveryProperties.Firecrawl properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public FirecrawlClient(
        DiscoveryProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getFirecrawl();
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public ScrapeOutcome<List<MapLink>> map(String url, String search, int limit) {
        if (!UrlNormalizer.isHttpUrl(url)) {
            return ScrapeOutcome.failure("invalid_url", "not an http(s) url: " + url);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", url);
        body.put("limit", Math.max(1, limit));
        body.put("includeSubdomains", false);
        if (search != null && !search.isBlank()) {
            body.put("search", search.trim());
        }
        ScrapeOutcome<JsonNode> response = post("/v1/map", body, requestTimeout());
        if (!response.isSuccessful()) {
            return response.mapFailure();
        }
        JsonNode root = response.value();
        if (!root.path("success").asBoolean(true)) {
            return ScrapeOutcome.failure("map_failed", text(root, "error"));
        }
        List<MapLink> links = new ArrayList<>();
        for (JsonNode link : root.path("links")) {
            if (link.isTextual()) {
                links.add(MapLink.of(link.asText()));
            } else if (link.isObject() && link.hasNonNull("url")) {
                links.add(new MapLink(link.get("url").asText(), text(link, "title"), text(link, "description")));
            }
        }
        log.debug("Mapped {} links from {}", links.size(), url);
        return ScrapeOutcome.success(links);
    }

    @Override
    public ScrapeOutcome<List<CrawlPage>> crawl(CrawlRequest request) {
        if (request == null || !UrlNormalizer.isHttpUrl(request.url())) {
            return ScrapeOutcome.failure("invalid_url", "crawl request without an http(s) url");
        }
        Duration budget = request.timeout() == null ? requestTimeout() : request.timeout();
        Instant deadline = Instant.now().plus(budget);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", request.url());
        body.put("limit", Math.max(1, request.limit()));
        body.put("maxDepth", Math.max(1, request.maxDepth()));
        ArrayNode include = body.putArray("includePaths");
        request.includePaths().forEach(include::add);
        ArrayNode exclude = body.putArray("excludePaths");
        request.excludePaths().forEach(exclude::add);
        ObjectNode scrapeOptions = body.putObject("scrapeOptions");
        ArrayNode formats = scrapeOptions.putArray("formats");
        (request.formats().isEmpty() ? List.of("markdown") : request.formats()).forEach(formats::add);
        scrapeOptions.put("onlyMainContent", true);

        ScrapeOutcome<JsonNode> started = post("/v1/crawl", body, requestTimeout());
        if (!started.isSuccessful()) {
            return started.mapFailure();
        }
        String jobId = text(started.value(), "id");
        if (jobId == null) {
            return ScrapeOutcome.failure("invalid_payload", "crawl response carried no job id");
        }
        log.info("Crawl job {} started for {}", jobId, request.url());

        List<CrawlPage> pages = new ArrayList<>();
        String statusUrl = properties.getBaseUrl() + "/v1/crawl/" + jobId;
        while (true) {
            if (Instant.now().isAfter(deadline)) {
                return ScrapeOutcome.failure("crawl_timeout", "crawl " + jobId + " exceeded " + budget.toSeconds() + "s");
            }
            ScrapeOutcome<JsonNode> polled = get(statusUrl, requestTimeout());
            if (!polled.isSuccessful()) {
                return polled.mapFailure();
            }
            JsonNode status = polled.value();
            String state = text(status, "status");
            String normalizedState = state == null ? "" : state.toLowerCase(Locale.ROOT);
            if ("failed".equals(normalizedState) || "cancelled".equals(normalizedState)) {
                return ScrapeOutcome.failure("crawl_failed", "crawl " + jobId + " ended with status " + state);
            }
            if ("completed".equals(normalizedState)) {
                collectCrawlPages(status, pages);
                String next = text(status, "next");
                while (next != null && pages.size() < request.limit() && Instant.now().isBefore(deadline)) {
                    ScrapeOutcome<JsonNode> nextPage = get(next, requestTimeout());
                    if (!nextPage.isSuccessful()) {
                        log.warn("Crawl {} pagination stopped: {}", jobId, nextPage.errorCode());
                        break;
                    }
                    collectCrawlPages(nextPage.value(), pages);
                    next = text(nextPage.value(), "next");
                }
                List<CrawlPage> bounded = pages.size() > request.limit() ? pages.subList(0, request.limit()) : pages;
                log.info("Crawl job {} completed with {} pages", jobId, bounded.size());
                return ScrapeOutcome.success(List.copyOf(bounded));
            }
            if (!pause()) {
                return ScrapeOutcome.failure("interrupted", "interrupted while polling crawl " + jobId);
            }
        }
    }

    @Override
    public ScrapeOutcome<PageContent> fetch(String url, List<String> formats, FetchOptions options) {
        if (!UrlNormalizer.isHttpUrl(url)) {
            return ScrapeOutcome.failure("invalid_url", "not an http(s) url: " + url);
        }
        FetchOptions safeOptions = options == null ? FetchOptions.defaults() : options;
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", url);
        ArrayNode requested = body.putArray("formats");
        (formats == null || formats.isEmpty() ? List.of("markdown") : formats).forEach(requested::add);
        body.put("onlyMainContent", safeOptions.onlyMainContent());
        body.put("parsePDF", safeOptions.parsePdf());
        if (safeOptions.timeoutMs() > 0) {
            body.put("timeout", safeOptions.timeoutMs());
        }
        Duration timeout = requestTimeout();
        if (safeOptions.timeoutMs() > 0) {
            timeout = timeout.plusMillis(safeOptions.timeoutMs());
        }
        ScrapeOutcome<JsonNode> response = post("/v1/scrape", body, timeout);
        if (!response.isSuccessful()) {
            return response.mapFailure();
        }
        JsonNode root = response.value();
        if (!root.path("success").asBoolean(true)) {
            return ScrapeOutcome.failure("scrape_failed", text(root, "error"));
        }
        PageContent content = toPageContent(root.path("data"));
        if (!content.hasBody() && !content.hasMetadata()) {
            return ScrapeOutcome.failure("empty_content", "scrape of " + url + " returned no content");
        }
        return ScrapeOutcome.success(content);
    }

    private void collectCrawlPages(JsonNode status, List<CrawlPage> into) {
        for (JsonNode item : status.path("data")) {
            PageContent content = toPageContent(item);
            String pageUrl = content.metadataText("sourceURL");
            if (pageUrl == null) {
                pageUrl = content.metadataText("url");
            }
            if (pageUrl == null) {
                pageUrl = text(item, "url");
            }
            if (pageUrl == null) {
                continue;
            }
            into.add(new CrawlPage(pageUrl, content.metadataText("title"), content.metadataText("description"), content));
        }
    }

    private PageContent toPageContent(JsonNode data) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        JsonNode meta = data.path("metadata");
        if (meta.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = meta.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value == null || value.isNull() || value.isMissingNode()) {
                    continue;
                }
                Object converted = value.isValueNode()
                    ? objectMapper.convertValue(value, Object.class)
                    : objectMapper.convertValue(value, Object.class).toString();
                if (converted != null) {
                    metadata.put(field.getKey(), converted);
                }
            }
        }
        return new PageContent(text(data, "markdown"), text(data, "html"), text(data, "rawText"), metadata);
    }

    private ScrapeOutcome<JsonNode> post(String path, JsonNode body, Duration timeout) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return ScrapeOutcome.failure("invalid_payload", e.getMessage());
        }
        return send(properties.getBaseUrl() + path, HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8),
            "POST", timeout);
    }

    private ScrapeOutcome<JsonNode> get(String url, Duration timeout) {
        return send(url, null, "GET", timeout);
    }

    private ScrapeOutcome<JsonNode> send(String url, HttpRequest.BodyPublisher body, String method, Duration timeout) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        ScrapeOutcome<JsonNode> lastOutcome = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastOutcome = executeOnce(url, body, method, timeout);
            if (lastOutcome.isSuccessful() || !shouldRetry(lastOutcome) || attempt >= maxAttempts) {
                return lastOutcome;
            }
            log.info("Retrying Firecrawl {} {} after {} (attempt {}/{})", method, url, lastOutcome.errorCode(),
                attempt + 1, maxAttempts);
            if (!sleepBackoff(attempt)) {
                return lastOutcome;
            }
        }
        return lastOutcome;
    }

    private ScrapeOutcome<JsonNode> executeOnce(String url, HttpRequest.BodyPublisher body, String method, Duration timeout) {
        String apiKey = properties.getApiKey();
        if (apiKey == null) {
            return ScrapeOutcome.failure("missing_api_key", "discovery.firecrawl.api-key is not configured");
        }
        URI uri = UrlNormalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return ScrapeOutcome.failure("invalid_url", "URL missing host or malformed");
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json");
        HttpRequest request = "POST".equals(method)
            ? builder.header("Content-Type", "application/json").POST(body).build()
            : builder.GET().build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("Firecrawl {} {} returned HTTP {}", method, uri.getPath(), status);
                return ScrapeOutcome.failure("http_" + status, truncate(response.body()));
            }
            String responseBody = response.body();
            if (responseBody == null || responseBody.isBlank()) {
                return ScrapeOutcome.failure("invalid_payload", "empty response body");
            }
            return ScrapeOutcome.success(objectMapper.readTree(responseBody));
        } catch (HttpTimeoutException e) {
            return ScrapeOutcome.failure("timeout", e.getMessage());
        } catch (JsonProcessingException e) {
            return ScrapeOutcome.failure("invalid_payload", e.getOriginalMessage());
        } catch (IOException e) {
            return ScrapeOutcome.failure("io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScrapeOutcome.failure("interrupted", e.getMessage());
        }
    }

    private static boolean shouldRetry(ScrapeOutcome<?> outcome) {
        String reason = ReasonCodeClassifier.fromErrorCode(outcome.errorCode(), outcome.errorMessage());
        return ReasonCodeClassifier.isRetryable(reason);
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(properties.getCrawlPollIntervalMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() <= ERROR_BODY_LIMIT ? body : body.substring(0, ERROR_BODY_LIMIT);
    }
}
