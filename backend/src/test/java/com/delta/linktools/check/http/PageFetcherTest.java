package com.delta.linktools.check.http;

import com.delta.linktools.check.model.ExtractedLink;
import com.delta.linktools.check.model.FetchedPage;
import com.delta.linktools.config.CheckerProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        CheckerProperties properties = new CheckerProperties();
        properties.setUserAgent("link-tools-test/1.0");
        fetcher = new PageFetcher(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void extractsAnchorsWithResolvedUrlsAndTrimmedText() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html")
            .setBody("""
                <html><body>
                  <a href="/about">  About Us </a>
                  <a href="https://www.partner.com/x#top">Partner</a>
                  <a href="contact"><img src="logo.png"></a>
                  <a name="no-href">ignored</a>
                </body></html>
                """));

        String url = server.url("/home/").toString();
        FetchedPage page = fetcher.fetchPage(url, Duration.ofSeconds(5));

        List<ExtractedLink> links = page.links();
        assertThat(links).hasSize(3);
        assertThat(links.get(0).resolvedUrl()).isEqualTo(server.url("/about").toString());
        assertThat(links.get(0).anchorText()).isEqualTo("About Us");
        assertThat(links.get(1).normalizedKey()).isEqualTo("https://partner.com/x");
        assertThat(links.get(2).resolvedUrl()).isEqualTo(server.url("/home/contact").toString());
        assertThat(links.get(2).anchorText()).isEmpty();

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("User-Agent")).isEqualTo("link-tools-test/1.0");
    }

    @Test
    void resolvesRelativeLinksAgainstFinalUrlAfterRedirect() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(301)
            .setHeader("Location", server.url("/landing/index.html").toString()));
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html")
            .setBody("<a href=\"pricing\">Pricing</a>"));

        FetchedPage page = fetcher.fetchPage(server.url("/start").toString(), Duration.ofSeconds(5));

        assertThat(page.finalUrl()).isEqualTo(server.url("/landing/index.html").toString());
        assertThat(page.links()).extracting(ExtractedLink::resolvedUrl)
            .containsExactly(server.url("/landing/pricing").toString());
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void nonSuccessStatusFailsTheFetch() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));

        String url = server.url("/gone").toString();

        assertThatThrownBy(() -> fetcher.fetchPage(url, Duration.ofSeconds(5)))
            .isInstanceOf(PageFetchException.class)
            .hasMessageContaining("HTTP 404")
            .satisfies(error -> assertThat(((PageFetchException) error).getErrorCode()).isEqualTo("http_status"));
    }

    @Test
    void slowResponseTimesOut() {
        server.enqueue(new MockResponse()
            .setBody("<a href=\"/late\">Late</a>")
            .setHeadersDelay(3, TimeUnit.SECONDS));

        String url = server.url("/slow").toString();

        assertThatThrownBy(() -> fetcher.fetchPage(url, Duration.ofSeconds(1)))
            .isInstanceOf(PageFetchException.class)
            .satisfies(error -> assertThat(((PageFetchException) error).getErrorCode()).isEqualTo("timeout"));
    }

    @Test
    void nonHtmlBodyYieldsNoLinks() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"links\": []}"));

        FetchedPage page = fetcher.fetchPage(server.url("/api").toString(), Duration.ofSeconds(5));

        assertThat(page.statusCode()).isEqualTo(200);
        assertThat(page.links()).isEmpty();
    }

    @Test
    void connectionFailureIsReportedAsFetchError() throws Exception {
        String url = server.url("/down").toString();
        server.shutdown();

        assertThatThrownBy(() -> fetcher.fetchPage(url, Duration.ofSeconds(2)))
            .isInstanceOf(PageFetchException.class)
            .satisfies(error -> assertThat(((PageFetchException) error).getErrorCode()).isIn("io_error", "timeout"));
        server = null;
    }
}
