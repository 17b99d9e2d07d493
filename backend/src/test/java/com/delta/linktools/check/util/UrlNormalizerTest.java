package com.delta.linktools.check.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    void collapsesWwwTrailingSlashSchemeAndFragmentVariants() {
        String expected = UrlNormalizer.normalize("https://example.com/about");

        assertThat(UrlNormalizer.normalize("https://www.example.com/about")).isEqualTo(expected);
        assertThat(UrlNormalizer.normalize("https://example.com/about/")).isEqualTo(expected);
        assertThat(UrlNormalizer.normalize("http://example.com/about")).isEqualTo(expected);
        assertThat(UrlNormalizer.normalize("https://example.com/about#team")).isEqualTo(expected);
        assertThat(UrlNormalizer.normalize("  HTTP://WWW.Example.COM/About/#x ")).isEqualTo(expected);
        assertThat(UrlNormalizer.normalize("example.com/about")).isEqualTo(expected);
        assertThat(expected).isEqualTo("https://example.com/about");
    }

    @Test
    void normalizingAKeyAgainIsStable() {
        String key = UrlNormalizer.normalize("http://www.example.com/a/b/?q=1#frag");

        assertThat(UrlNormalizer.normalize(key)).isEqualTo(key);
        assertThat(key).isEqualTo("https://example.com/a/b?q=1");
    }

    @Test
    void keepsQueryOnlyWhenPresentAndDropsPortAndUserInfo() {
        assertThat(UrlNormalizer.normalize("https://example.com/search?")).isEqualTo("https://example.com/search");
        assertThat(UrlNormalizer.normalize("https://example.com?ref=home")).isEqualTo("https://example.com?ref=home");
        assertThat(UrlNormalizer.normalize("https://user:pw@example.com:8443/x")).isEqualTo("https://example.com/x");
    }

    @Test
    void stripsOnlyOneTrailingSlash() {
        assertThat(UrlNormalizer.normalize("https://example.com/docs//")).isEqualTo("https://example.com/docs/");
        assertThat(UrlNormalizer.normalize("https://example.com/")).isEqualTo("https://example.com");
    }

    @Test
    void malformedInputProducesAKeyInsteadOfThrowing() {
        assertThat(UrlNormalizer.normalize("https:///no-host")).isEqualTo("https:///no-host");
        assertThat(UrlNormalizer.normalize("")).isEqualTo("https://");
        assertThat(UrlNormalizer.normalize(null)).isEqualTo("https://");
    }

    @Test
    void domainOfReturnsBareLowercaseHost() {
        assertThat(UrlNormalizer.domainOf("https://www.Partner.com/x")).isEqualTo("partner.com");
        assertThat(UrlNormalizer.domainOf("http://blog.example.com:8080/")).isEqualTo("blog.example.com");
        assertThat(UrlNormalizer.domainOf("//cdn.example.net/lib.js")).isEqualTo("cdn.example.net");
        assertThat(UrlNormalizer.domainOf("mailto:someone@example.com")).isEmpty();
        assertThat(UrlNormalizer.domainOf("/relative/path")).isEmpty();
    }

    @Test
    void schemeDetection() {
        assertThat(UrlNormalizer.isHttpLike("HTTPS://example.com")).isTrue();
        assertThat(UrlNormalizer.isHttpLike("http://example.com")).isTrue();
        assertThat(UrlNormalizer.isHttpLike("javascript:void(0)")).isFalse();
        assertThat(UrlNormalizer.isHttpLike("mailto:a@b.c")).isFalse();
        assertThat(UrlNormalizer.isHttpLike("example.com:8080/path")).isFalse();
        assertThat(UrlNormalizer.schemeOf("127.0.0.1:8080")).isEmpty();
    }

    @Test
    void toBareHostCleansFreeFormInput() {
        assertThat(UrlNormalizer.toBareHost(" https://www.Example.com/ ")).isEqualTo("example.com");
        assertThat(UrlNormalizer.toBareHost("http://blog.example.com")).isEqualTo("blog.example.com");
        assertThat(UrlNormalizer.toBareHost("   ")).isEmpty();
    }
}
