package com.delta.linktools.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CheckerProperties properties = new CheckerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("link-tools/0.1"));
    }

    @Test
    void limitsAreClampedToAtLeastOne() {
        CheckerProperties properties = new CheckerProperties();
        properties.setDefaultConcurrency(0);
        properties.setMaxTimeoutSeconds(-5);
        properties.setErrorMessageMaxLength(0);
        assertEquals(1, properties.getDefaultConcurrency());
        assertEquals(1, properties.getMaxTimeoutSeconds());
        assertEquals(1, properties.getErrorMessageMaxLength());
    }

    @Test
    void requestedConcurrencyAndTimeoutStayWithinBounds() {
        CheckerProperties properties = new CheckerProperties();
        properties.setDefaultConcurrency(5);
        properties.setMaxConcurrency(50);
        properties.setDefaultTimeoutSeconds(15);
        properties.setMaxTimeoutSeconds(120);

        assertEquals(5, properties.resolveConcurrency(null));
        assertEquals(50, properties.resolveConcurrency(500));
        assertEquals(1, properties.resolveConcurrency(-3));
        assertEquals(15, properties.resolveTimeoutSeconds(null));
        assertEquals(120, properties.resolveTimeoutSeconds(9999));
        assertEquals(1, properties.resolveTimeoutSeconds(0));
    }

    @Test
    void domainCheckSchemeDefaultsToHttps() {
        CheckerProperties properties = new CheckerProperties();
        assertEquals("https", properties.getDomainCheck().getScheme());
        properties.getDomainCheck().setScheme(" ");
        assertEquals("https", properties.getDomainCheck().getScheme());
    }
}
