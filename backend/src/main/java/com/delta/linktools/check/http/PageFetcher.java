package com.delta.linktools.check.http;

import com.delta.linktools.check.model.ExtractedLink;
import com.delta.linktools.check.model.FetchedPage;
import com.delta.linktools.check.model.HttpFetchResult;
import com.delta.linktools.check.util.ErrorMessages;
import com.delta.linktools.check.util.UrlNormalizer;
import com.delta.linktools.config.CheckerProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-GET page fetcher. Follows redirects, identifies itself with the configured user agent and
 * bounds the whole exchange (connect, headers and body) by the caller's timeout.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final CheckerProperties properties;
    private final HttpClient client;

    public PageFetcher(CheckerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    /**
     * Fetches {@code url} and extracts every {@code a[href]} on the page.
     *
     * @throws PageFetchException when the request fails, times out or ends with a non-2xx status
     */
    public FetchedPage fetchPage(String url, Duration timeout) throws PageFetchException {
        HttpFetchResult result = get(url, timeout);
        if (!result.isSuccessful()) {
            String code = result.errorCode() == null ? "http_status" : result.errorCode();
            String message = result.errorCode() == null
                ? "HTTP " + result.statusCode() + " for url: " + result.finalUrlOrRequested()
                : result.errorMessage();
            throw new PageFetchException(code, message == null ? code : message);
        }
        String finalUrl = result.finalUrlOrRequested();
        return new FetchedPage(url, finalUrl, result.statusCode(), extractLinks(result.body(), finalUrl));
    }

    public List<ExtractedLink> fetchLinks(String url, Duration timeout) throws PageFetchException {
        return fetchPage(url, timeout).links();
    }

    HttpFetchResult get(String url, Duration timeout) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, "invalid_url", "Invalid URL: " + url);
        }

        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", ACCEPT_HTML)
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();

        CompletableFuture<HttpResponse<byte[]>> pending =
            client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> response = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            byte[] bytes = response.body();
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                null,
                null
            );
        } catch (TimeoutException e) {
            pending.cancel(true);
            return errorResult(url, "timeout", "Timed out after " + timeout.toSeconds() + "s: " + url);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            return errorResult(url, "interrupted", "Interrupted while fetching " + url);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, "timeout", describe(cause, url));
            }
            if (cause instanceof IOException) {
                return errorResult(url, "io_error", describe(cause, url));
            }
            return errorResult(url, "http_error", describe(cause, url));
        }
    }

    /**
     * Extracts anchors from an HTML body. Bodies jsoup cannot make sense of yield no links.
     */
    List<ExtractedLink> extractLinks(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc;
        try {
            doc = Jsoup.parse(html, baseUrl);
        } catch (RuntimeException e) {
            log.debug("Could not parse page body from {}: {}", baseUrl, e.getMessage());
            return List.of();
        }
        List<ExtractedLink> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String href = anchor.attr("href").trim();
            String resolved = anchor.absUrl("href");
            if (resolved == null || resolved.isBlank()) {
                resolved = href;
            }
            links.add(new ExtractedLink(resolved, UrlNormalizer.normalize(resolved), anchor.text().trim()));
        }
        return links;
    }

    private String describe(Throwable cause, String url) {
        return ErrorMessages.describe(cause, properties.getErrorMessageMaxLength()) + " (" + url + ")";
    }

    private HttpFetchResult errorResult(String url, String code, String message) {
        log.debug("Fetch of {} failed with {}: {}", url, code, message);
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!UrlNormalizer.isHttpLike(value)) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
