package com.delta.linktools.check.service;

import com.delta.linktools.check.http.PageFetchException;
import com.delta.linktools.check.http.PageFetcher;
import com.delta.linktools.check.model.ExpectedLinkRow;
import com.delta.linktools.check.model.ExtractedLink;
import com.delta.linktools.check.model.JobStatusSnapshot;
import com.delta.linktools.check.model.LinkCheckLogEntry;
import com.delta.linktools.check.model.LinkCheckResult;
import com.delta.linktools.check.model.LinkCheckStatus;
import com.delta.linktools.check.model.LinkCheckStatusResponse;
import com.delta.linktools.check.model.LinkCheckSubmitResponse;
import com.delta.linktools.check.model.ResultPage;
import com.delta.linktools.check.model.StopResponse;
import com.delta.linktools.check.runner.CompletionBatch;
import com.delta.linktools.check.runner.JobRunner;
import com.delta.linktools.check.runner.UnitOutcome;
import com.delta.linktools.check.runner.WorkItem;
import com.delta.linktools.check.util.ErrorMessages;
import com.delta.linktools.check.util.UrlNormalizer;
import com.delta.linktools.config.CheckerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Verifies that expected (site, link, anchor) rows appear on their source pages. Each distinct site
 * is fetched once; its rows are classified against the anchors found on the page.
 */
@Service
public class LinkCheckService {
    private static final Logger log = LoggerFactory.getLogger(LinkCheckService.class);
    private static final String ALL = "all";
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private final PageFetcher pageFetcher;
    private final JobRunner jobRunner;
    private final ExecutorService checkRunExecutor;
    private final CheckerProperties properties;
    private final JobStatusStore<LinkCheckResult, LinkCheckLogEntry> store = new JobStatusStore<>();

    public LinkCheckService(
        PageFetcher pageFetcher,
        JobRunner jobRunner,
        @Qualifier("checkRunExecutor") ExecutorService checkRunExecutor,
        CheckerProperties properties
    ) {
        this.pageFetcher = pageFetcher;
        this.jobRunner = jobRunner;
        this.checkRunExecutor = checkRunExecutor;
        this.properties = properties;
    }

    /**
     * Starts a run in the background and returns as soon as the job slot is claimed.
     *
     * @throws InvalidCheckRequestException when there are no rows
     * @throws ActiveCheckRunException      when a link check is already running
     */
    public LinkCheckSubmitResponse startAsync(List<ExpectedLinkRow> rows, Integer concurrency, Integer timeoutSeconds) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidCheckRequestException("no_valid_rows", "No valid rows found in CSV");
        }
        Map<String, List<ExpectedLinkRow>> sites = groupBySite(rows);
        int workers = properties.resolveConcurrency(concurrency);
        Duration timeout = Duration.ofSeconds(properties.resolveTimeoutSeconds(timeoutSeconds));

        long generation = store.tryStart(rows.size(), sites.size())
            .orElseThrow(() -> new ActiveCheckRunException("Link check already in progress"));
        log.info("Link check started: rows={} sites={} concurrency={} timeout={}s",
            rows.size(), sites.size(), workers, timeout.toSeconds());
        try {
            checkRunExecutor.submit(() -> runCheck(generation, sites, workers, timeout));
        } catch (RejectedExecutionException e) {
            store.finish(generation);
            throw e;
        }
        return new LinkCheckSubmitResponse(true, rows.size(), sites.size());
    }

    public LinkCheckStatusResponse getStatus() {
        JobStatusSnapshot<LinkCheckResult, LinkCheckLogEntry> snapshot = store.snapshot();
        return new LinkCheckStatusResponse(
            snapshot.running(),
            snapshot.total(),
            snapshot.checked(),
            snapshot.totalUnits(),
            snapshot.checkedUnits(),
            snapshot.counts(),
            snapshot.log(),
            snapshot.startedAt(),
            snapshot.finishedAt()
        );
    }

    public ResultPage<LinkCheckResult> getResults(String status, Integer page, Integer pageSize) {
        String filter = normalizeFilter(status);
        int safePageSize = pageSize == null
            ? properties.getResults().getDefaultPageSize()
            : Math.min(Math.max(0, pageSize), properties.getResults().getMaxPageSize());
        return ResultPages.page(store.snapshot().results(), filter, predicateFor(filter), page == null ? 1 : page, safePageSize);
    }

    public List<LinkCheckResult> getAllResults(String status) {
        String filter = normalizeFilter(status);
        return store.snapshot().results().stream().filter(predicateFor(filter)).toList();
    }

    public StopResponse stop() {
        boolean wasRunning = store.requestStop();
        if (wasRunning) {
            log.warn("Link check stop requested; in-flight fetches will still complete");
        }
        return new StopResponse(wasRunning, false);
    }

    private void runCheck(long generation, Map<String, List<ExpectedLinkRow>> sites, int workers, Duration timeout) {
        Instant startedAt = Instant.now();
        List<LinkCheckResult> allResults = new ArrayList<>();
        try {
            List<WorkItem<String, List<LinkCheckResult>>> units = new ArrayList<>();
            for (Map.Entry<String, List<ExpectedLinkRow>> site : sites.entrySet()) {
                units.add(new WorkItem<>(site.getKey(), () -> checkSite(site.getKey(), site.getValue(), timeout)));
            }

            try (CompletionBatch<String, List<LinkCheckResult>> batch = jobRunner.start("link-check", units, workers)) {
                while (batch.hasNext()) {
                    UnitOutcome<String, List<LinkCheckResult>> outcome = batch.next();
                    String site = outcome.id();
                    List<ExpectedLinkRow> siteRows = sites.get(site);
                    List<LinkCheckResult> siteResults;
                    if (outcome.isSuccess()) {
                        siteResults = outcome.result();
                    } else {
                        log.warn("Link check unit crashed for {}", site, outcome.error());
                        String error = ErrorMessages.describe(outcome.error(), properties.getErrorMessageMaxLength());
                        siteResults = fetchErrorResults(site, siteRows, error);
                    }
                    allResults.addAll(siteResults);
                    store.recordUnit(generation, siteRows.size(), logEntryFor(site, siteResults));
                }
            }

            allResults.sort(Comparator.comparingInt(LinkCheckResult::rowNum));
            Map<String, Integer> counts = countByStatus(allResults);
            boolean published = store.publish(generation, allResults, counts);
            log.info("Link check finished: rows={} counts={} durationMs={} published={}",
                allResults.size(), counts, Duration.between(startedAt, Instant.now()).toMillis(), published);
        } catch (RuntimeException e) {
            log.warn("Link check run failed", e);
        } finally {
            store.finish(generation);
        }
    }

    /**
     * Fetches one site and classifies each of its expected rows. Fetch failures become
     * {@code fetch_error} rows rather than exceptions.
     */
    List<LinkCheckResult> checkSite(String site, List<ExpectedLinkRow> rows, Duration timeout) {
        List<ExtractedLink> pageLinks;
        try {
            pageLinks = pageFetcher.fetchLinks(site, timeout);
        } catch (PageFetchException e) {
            log.debug("Fetch failed for {}: {}", site, e.getMessage());
            return fetchErrorResults(site, rows, e.getMessage());
        }

        Map<String, List<String>> anchorsByKey = new LinkedHashMap<>();
        for (ExtractedLink link : pageLinks) {
            anchorsByKey.computeIfAbsent(link.normalizedKey(), ignored -> new ArrayList<>()).add(link.anchorText());
        }

        List<LinkCheckResult> results = new ArrayList<>(rows.size());
        for (ExpectedLinkRow row : rows) {
            String expectedAnchor = collapseWhitespace(row.anchor());
            List<String> foundAnchors = anchorsByKey.get(UrlNormalizer.normalize(row.link()));
            LinkCheckStatus status;
            if (foundAnchors == null) {
                status = LinkCheckStatus.LINK_NOT_FOUND;
                foundAnchors = List.of();
            } else if (expectedAnchor.isEmpty() || containsIgnoreCase(foundAnchors, expectedAnchor)) {
                status = LinkCheckStatus.OK;
            } else {
                status = LinkCheckStatus.ANCHOR_MISMATCH;
            }
            results.add(new LinkCheckResult(row.rowNum(), site, row.link(), expectedAnchor, status, foundAnchors, null));
        }
        return results;
    }

    static Map<String, List<ExpectedLinkRow>> groupBySite(List<ExpectedLinkRow> rows) {
        Map<String, List<ExpectedLinkRow>> groups = new LinkedHashMap<>();
        for (ExpectedLinkRow row : rows) {
            groups.computeIfAbsent(row.site().trim(), ignored -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    static Map<String, Integer> countByStatus(List<LinkCheckResult> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (LinkCheckStatus status : LinkCheckStatus.values()) {
            counts.put(status.wireName(), 0);
        }
        for (LinkCheckResult result : results) {
            counts.merge(result.status().wireName(), 1, Integer::sum);
        }
        return counts;
    }

    private List<LinkCheckResult> fetchErrorResults(String site, List<ExpectedLinkRow> rows, String message) {
        String error = ErrorMessages.truncate(message, properties.getErrorMessageMaxLength());
        List<LinkCheckResult> results = new ArrayList<>(rows.size());
        for (ExpectedLinkRow row : rows) {
            results.add(new LinkCheckResult(
                row.rowNum(),
                site,
                row.link(),
                collapseWhitespace(row.anchor()),
                LinkCheckStatus.FETCH_ERROR,
                List.of(),
                error
            ));
        }
        return results;
    }

    private LinkCheckLogEntry logEntryFor(String site, List<LinkCheckResult> siteResults) {
        String error = siteResults.stream()
            .filter(result -> result.status() == LinkCheckStatus.FETCH_ERROR)
            .map(LinkCheckResult::error)
            .findFirst()
            .orElse(null);
        return new LinkCheckLogEntry(site, error == null ? "ok" : "error", error, Instant.now());
    }

    // Matches the whitespace handling of jsoup's text() on the found anchors.
    static String collapseWhitespace(String anchor) {
        return WHITESPACE.matcher(anchor).replaceAll(" ").trim();
    }

    private static boolean containsIgnoreCase(List<String> anchors, String expected) {
        for (String anchor : anchors) {
            if (anchor.equalsIgnoreCase(expected)) {
                return true;
            }
        }
        return false;
    }

    private static String normalizeFilter(String status) {
        if (status == null || status.isBlank()) {
            return ALL;
        }
        String filter = status.trim().toLowerCase(Locale.ROOT);
        if (ALL.equals(filter)) {
            return filter;
        }
        for (LinkCheckStatus candidate : LinkCheckStatus.values()) {
            if (candidate.wireName().equals(filter)) {
                return filter;
            }
        }
        throw new InvalidCheckRequestException("invalid_status_filter", "Unsupported status filter: " + status);
    }

    private static Predicate<LinkCheckResult> predicateFor(String filter) {
        if (ALL.equals(filter)) {
            return result -> true;
        }
        return result -> result.status().wireName().equals(filter);
    }
}
