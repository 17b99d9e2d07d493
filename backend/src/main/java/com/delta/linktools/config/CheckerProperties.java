package com.delta.linktools.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "checker")
public class CheckerProperties {
    private static final String DEFAULT_USER_AGENT = "link-tools/0.1 (+link checker)";

    private String userAgent;
    private int defaultConcurrency = 5;
    private int maxConcurrency = 50;
    private int defaultTimeoutSeconds = 15;
    private int maxTimeoutSeconds = 120;
    private int connectTimeoutSeconds = 10;
    private int errorMessageMaxLength = 200;
    private DomainCheck domainCheck = new DomainCheck();
    private Results results = new Results();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getDefaultConcurrency() {
        return Math.max(1, defaultConcurrency);
    }

    public void setDefaultConcurrency(int defaultConcurrency) {
        this.defaultConcurrency = Math.max(1, defaultConcurrency);
    }

    public int getMaxConcurrency() {
        return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public int getDefaultTimeoutSeconds() {
        return Math.max(1, defaultTimeoutSeconds);
    }

    public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
        this.defaultTimeoutSeconds = Math.max(1, defaultTimeoutSeconds);
    }

    public int getMaxTimeoutSeconds() {
        return Math.max(1, maxTimeoutSeconds);
    }

    public void setMaxTimeoutSeconds(int maxTimeoutSeconds) {
        this.maxTimeoutSeconds = Math.max(1, maxTimeoutSeconds);
    }

    public int getConnectTimeoutSeconds() {
        return Math.max(1, connectTimeoutSeconds);
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
    }

    public int getErrorMessageMaxLength() {
        return Math.max(1, errorMessageMaxLength);
    }

    public void setErrorMessageMaxLength(int errorMessageMaxLength) {
        this.errorMessageMaxLength = Math.max(1, errorMessageMaxLength);
    }

    public DomainCheck getDomainCheck() {
        return domainCheck;
    }

    public void setDomainCheck(DomainCheck domainCheck) {
        this.domainCheck = domainCheck;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    /**
     * Resolves a caller-supplied worker count, falling back to the default and clamping to the ceiling.
     */
    public int resolveConcurrency(Integer requested) {
        int value = requested == null ? getDefaultConcurrency() : requested;
        return Math.max(1, Math.min(value, getMaxConcurrency()));
    }

    public int resolveTimeoutSeconds(Integer requested) {
        int value = requested == null ? getDefaultTimeoutSeconds() : requested;
        return Math.max(1, Math.min(value, getMaxTimeoutSeconds()));
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class DomainCheck {
        private String scheme = "https";

        public String getScheme() {
            return scheme == null || scheme.isBlank() ? "https" : scheme.trim();
        }

        public void setScheme(String scheme) {
            this.scheme = scheme;
        }
    }

    public static class Results {
        private int defaultPageSize = 50;
        private int maxPageSize = 500;

        public int getDefaultPageSize() {
            return Math.max(1, defaultPageSize);
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = Math.max(1, defaultPageSize);
        }

        public int getMaxPageSize() {
            return Math.max(1, maxPageSize);
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = Math.max(1, maxPageSize);
        }
    }
}
