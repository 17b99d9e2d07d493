package com.delta.linktools.check.service;

import com.delta.linktools.check.http.PageFetchException;
import com.delta.linktools.check.http.PageFetcher;
import com.delta.linktools.check.model.DomainCheckLogEntry;
import com.delta.linktools.check.model.DomainCheckResult;
import com.delta.linktools.check.model.DomainCheckStatus;
import com.delta.linktools.check.model.DomainCheckStatusResponse;
import com.delta.linktools.check.model.DomainCheckSubmitResponse;
import com.delta.linktools.check.model.ExtractedLink;
import com.delta.linktools.check.model.FetchedPage;
import com.delta.linktools.check.model.JobStatusSnapshot;
import com.delta.linktools.check.model.ResultPage;
import com.delta.linktools.check.model.StopResponse;
import com.delta.linktools.check.model.TargetMatch;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Predicate;

/**
 * Crawls referring domains' homepages and reports which target domains they link out to.
 * Only cross-domain http(s) links count; links back to the referring domain are ignored.
 */
@Service
public class DomainCheckService {
    private static final Logger log = LoggerFactory.getLogger(DomainCheckService.class);
    static final String NO_ANCHOR = "[no anchor]";

    private final PageFetcher pageFetcher;
    private final JobRunner jobRunner;
    private final ExecutorService checkRunExecutor;
    private final CheckerProperties properties;
    private final JobStatusStore<DomainCheckResult, DomainCheckLogEntry> store = new JobStatusStore<>();

    public DomainCheckService(
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

    public DomainCheckSubmitResponse startAsync(
        List<String> domains,
        List<String> targetDomains,
        Integer concurrency,
        Integer timeoutSeconds
    ) {
        List<String> uniqueDomains = distinctNonBlank(domains);
        if (uniqueDomains.isEmpty()) {
            throw new InvalidCheckRequestException("no_domains", "No referring domains provided");
        }
        List<String> targets = distinctNonBlank(targetDomains);
        int workers = properties.resolveConcurrency(concurrency);
        Duration timeout = Duration.ofSeconds(properties.resolveTimeoutSeconds(timeoutSeconds));

        long generation = store.tryStart(uniqueDomains.size(), uniqueDomains.size())
            .orElseThrow(() -> new ActiveCheckRunException("Domain check already in progress"));
        log.info("Domain check started: domains={} targets={} concurrency={} timeout={}s",
            uniqueDomains.size(), targets.size(), workers, timeout.toSeconds());
        try {
            checkRunExecutor.submit(() -> runCheck(generation, uniqueDomains, targets, workers, timeout));
        } catch (RejectedExecutionException e) {
            store.finish(generation);
            throw e;
        }
        return new DomainCheckSubmitResponse(true, uniqueDomains.size(), targets.size());
    }

    public DomainCheckStatusResponse getStatus() {
        JobStatusSnapshot<DomainCheckResult, DomainCheckLogEntry> snapshot = store.snapshot();
        return new DomainCheckStatusResponse(
            snapshot.running(),
            snapshot.total(),
            snapshot.checked(),
            snapshot.counts(),
            snapshot.log(),
            snapshot.startedAt(),
            snapshot.finishedAt()
        );
    }

    public ResultPage<DomainCheckResult> getResults(String status, Integer page, Integer pageSize) {
        ResultFilter filter = ResultFilter.parse(status);
        int safePageSize = pageSize == null
            ? properties.getResults().getDefaultPageSize()
            : Math.min(Math.max(0, pageSize), properties.getResults().getMaxPageSize());
        return ResultPages.page(
            store.snapshot().results(),
            filter.wireName(),
            filter.predicate(),
            page == null ? 1 : page,
            safePageSize
        );
    }

    public List<DomainCheckResult> getAllResults(String status) {
        ResultFilter filter = ResultFilter.parse(status);
        return store.snapshot().results().stream().filter(filter.predicate()).toList();
    }

    public StopResponse stop() {
        boolean wasRunning = store.requestStop();
        if (wasRunning) {
            log.warn("Domain check stop requested; in-flight fetches will still complete");
        }
        return new StopResponse(wasRunning, false);
    }

    private void runCheck(long generation, List<String> domains, List<String> targets, int workers, Duration timeout) {
        Instant startedAt = Instant.now();
        List<DomainCheckResult> allResults = new ArrayList<>();
        try {
            List<WorkItem<String, DomainCheckResult>> units = new ArrayList<>();
            for (String domain : domains) {
                units.add(new WorkItem<>(domain, () -> checkDomain(domain, targets, timeout)));
            }

            try (CompletionBatch<String, DomainCheckResult> batch = jobRunner.start("domain-check", units, workers)) {
                while (batch.hasNext()) {
                    UnitOutcome<String, DomainCheckResult> outcome = batch.next();
                    DomainCheckResult result;
                    if (outcome.isSuccess()) {
                        result = outcome.result();
                    } else {
                        log.warn("Domain check unit crashed for {}", outcome.id(), outcome.error());
                        String error = ErrorMessages.describe(outcome.error(), properties.getErrorMessageMaxLength());
                        result = errorResult(outcome.id(), targets, error);
                    }
                    allResults.add(result);
                    store.recordUnit(generation, 1, new DomainCheckLogEntry(
                        result.domain(),
                        result.status().wireName(),
                        result.linksCount(),
                        result.error(),
                        Instant.now()
                    ));
                }
            }

            allResults.sort(Comparator.comparing(DomainCheckResult::domain));
            Map<String, Integer> counts = countByStatus(allResults);
            boolean published = store.publish(generation, allResults, counts);
            log.info("Domain check finished: domains={} counts={} durationMs={} published={}",
                allResults.size(), counts, Duration.between(startedAt, Instant.now()).toMillis(), published);
        } catch (RuntimeException e) {
            log.warn("Domain check run failed", e);
        } finally {
            store.finish(generation);
        }
    }

    /**
     * Fetches the domain's homepage and groups its external links by destination domain.
     */
    DomainCheckResult checkDomain(String domain, List<String> targets, Duration timeout) {
        String url = properties.getDomainCheck().getScheme() + "://" + domain + "/";
        FetchedPage page;
        try {
            page = pageFetcher.fetchPage(url, timeout);
        } catch (PageFetchException e) {
            log.debug("Fetch failed for {}: {}", url, e.getMessage());
            return errorResult(domain, targets, e.getMessage());
        }

        String sourceDomain = UrlNormalizer.domainOf(page.finalUrl());
        Map<String, List<String>> anchorsByDomain = new LinkedHashMap<>();
        int externalCount = 0;
        for (ExtractedLink link : page.links()) {
            if (!UrlNormalizer.isHttpLike(link.resolvedUrl())) {
                continue;
            }
            String linkDomain = UrlNormalizer.domainOf(link.resolvedUrl());
            if (linkDomain.isEmpty() || linkDomain.equals(sourceDomain)) {
                continue;
            }
            externalCount++;
            String anchor = link.anchorText().isEmpty() ? NO_ANCHOR : link.anchorText();
            anchorsByDomain.computeIfAbsent(linkDomain, ignored -> new ArrayList<>()).add(anchor);
        }

        Map<String, TargetMatch> matches = new LinkedHashMap<>();
        for (String target : targets) {
            List<String> anchors = anchorsByDomain.get(UrlNormalizer.toBareHost(target));
            matches.put(target, anchors == null ? TargetMatch.notFound() : new TargetMatch(true, anchors));
        }
        return new DomainCheckResult(domain, DomainCheckStatus.OK, null, externalCount, matches);
    }

    static Map<String, Integer> countByStatus(List<DomainCheckResult> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DomainCheckStatus status : DomainCheckStatus.values()) {
            counts.put(status.wireName(), 0);
        }
        for (DomainCheckResult result : results) {
            counts.merge(result.status().wireName(), 1, Integer::sum);
        }
        return counts;
    }

    private DomainCheckResult errorResult(String domain, List<String> targets, String message) {
        Map<String, TargetMatch> matches = new LinkedHashMap<>();
        for (String target : targets) {
            matches.put(target, TargetMatch.notFound());
        }
        String error = ErrorMessages.truncate(message, properties.getErrorMessageMaxLength());
        return new DomainCheckResult(domain, DomainCheckStatus.ERROR, error, 0, matches);
    }

    private static List<String> distinctNonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(unique);
    }

    enum ResultFilter {
        ALL(result -> true),
        OK(result -> result.status() == DomainCheckStatus.OK),
        ERROR(result -> result.status() == DomainCheckStatus.ERROR),
        HAS_TARGET(DomainCheckResult::hasAnyTarget),
        NO_TARGET(result -> !result.hasAnyTarget());

        private final Predicate<DomainCheckResult> predicate;

        ResultFilter(Predicate<DomainCheckResult> predicate) {
            this.predicate = predicate;
        }

        Predicate<DomainCheckResult> predicate() {
            return predicate;
        }

        String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        static ResultFilter parse(String status) {
            if (status == null || status.isBlank()) {
                return ALL;
            }
            String value = status.trim().toLowerCase(Locale.ROOT);
            for (ResultFilter filter : values()) {
                if (filter.wireName().equals(value)) {
                    return filter;
                }
            }
            throw new InvalidCheckRequestException("invalid_status_filter", "Unsupported status filter: " + status);
        }
    }
}
