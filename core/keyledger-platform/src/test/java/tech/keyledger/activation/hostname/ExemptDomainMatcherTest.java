package tech.keyledger.activation.hostname;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.keyledger.testing.TestLicensingConfig;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExemptDomainMatcherTest {

    @Test
    @DisplayName("plain pattern should match itself and strict subdomains")
    void isExempt_shouldMatchPlainPatternAndSubdomains() {
        List<String> patterns = List.of("myapp.local");

        assertTrue(ExemptDomainMatcher.isExempt("myapp.local", patterns));
        assertTrue(ExemptDomainMatcher.isExempt("dev.myapp.local", patterns));
        assertFalse(ExemptDomainMatcher.isExempt("notmyapp.local", patterns));
        assertFalse(ExemptDomainMatcher.isExempt("myapp.local.com", patterns));
    }

    @Test
    @DisplayName("wildcard pattern should match subdomains only")
    void isExempt_shouldMatchWildcardSubdomainsOnly() {
        List<String> patterns = List.of("*.staging.example.com");

        assertTrue(ExemptDomainMatcher.isExempt("a.staging.example.com", patterns));
        assertTrue(ExemptDomainMatcher.isExempt("x.y.staging.example.com", patterns));
        assertFalse(ExemptDomainMatcher.isExempt("staging.example.com", patterns));
    }

    @Test
    @DisplayName("default patterns should cover localhost, .local and .test")
    void isExempt_shouldUseDefaults_whenNothingConfigured() {
        ExemptDomainMatcher matcher = new ExemptDomainMatcher(List.of());

        assertTrue(matcher.isExempt("localhost"));
        assertTrue(matcher.isExempt("shop.local"));
        assertTrue(matcher.isExempt("shop.test"));
        assertFalse(matcher.isExempt("local"));
        assertFalse(matcher.isExempt("example.com"));
        assertFalse(matcher.isExempt(""));
        assertFalse(matcher.isExempt(null));
    }

    @Test
    @DisplayName("should read comma and newline separated patterns from config")
    void patterns_shouldParseConfiguredValue() {
        TestLicensingConfig config = new TestLicensingConfig();
        config.domains.exemptPatterns = "Staging.Example.com,\n*.dev.example.com\r\n, ";
        ExemptDomainMatcher matcher = new ExemptDomainMatcher();
        matcher.config = config;

        assertEquals(List.of("staging.example.com", "*.dev.example.com"), matcher.patterns());
        assertTrue(matcher.isExempt("staging.example.com"));
        assertTrue(matcher.isExempt("a.dev.example.com"));
        assertFalse(matcher.isExempt("shop.local"));
    }

    @Test
    @DisplayName("blank config should fall back to defaults")
    void patterns_shouldFallBackToDefaults_whenConfigBlank() {
        TestLicensingConfig config = new TestLicensingConfig();
        config.domains.exemptPatterns = " ";
        ExemptDomainMatcher matcher = new ExemptDomainMatcher();
        matcher.config = config;

        assertEquals(ExemptDomainMatcher.DEFAULT_PATTERNS, matcher.patterns());
    }
}
