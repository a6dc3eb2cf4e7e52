package tech.keyledger.activation.hostname;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.keyledger.platform.config.LicensingConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Matches normalized domains against the developer/staging allow-list.
 *
 * <p>Patterns are newline or comma separated. A pattern {@code p} matches a domain equal
 * to {@code p} or any strict subdomain of it ({@code *.p} is accepted and matches
 * subdomains only). With nothing configured the built-in set
 * {@code localhost, *.local, *.test} applies.
 *
 * <p>Exempt domains are left out of activation capacity. They are never treated as
 * production entitlement anywhere else.
 */
@ApplicationScoped
public class ExemptDomainMatcher {

    public static final List<String> DEFAULT_PATTERNS = List.of("localhost", "*.local", "*.test");

    @Inject
    LicensingConfig config;

    private volatile List<String> patterns;

    public ExemptDomainMatcher() {
    }

    public ExemptDomainMatcher(List<String> patterns) {
        this.patterns = patterns.isEmpty() ? DEFAULT_PATTERNS : List.copyOf(patterns);
    }

    public boolean isExempt(String normalizedDomain) {
        return isExempt(normalizedDomain, patterns());
    }

    public List<String> patterns() {
        List<String> current = patterns;
        if (current == null) {
            List<String> parsed = parsePatterns(config.domains().exemptPatterns());
            current = parsed.isEmpty() ? DEFAULT_PATTERNS : parsed;
            patterns = current;
        }
        return current;
    }

    public static boolean isExempt(String normalizedDomain, List<String> patterns) {
        if (normalizedDomain == null || normalizedDomain.isEmpty()) {
            return false;
        }
        for (String raw : patterns) {
            String pattern = raw.trim().toLowerCase(Locale.ROOT);
            if (pattern.isEmpty()) {
                continue;
            }
            if (pattern.startsWith("*.")) {
                if (isStrictSubdomain(normalizedDomain, pattern.substring(2))) {
                    return true;
                }
            } else if (normalizedDomain.equals(pattern) || isStrictSubdomain(normalizedDomain, pattern)) {
                return true;
            }
        }
        return false;
    }

    public static List<String> parsePatterns(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split("[\\r\\n,]+")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed.toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private static boolean isStrictSubdomain(String domain, String parent) {
        return domain.length() > parent.length() + 1 && domain.endsWith("." + parent);
    }
}
