package tech.keyledger.activation.hostname;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes a client-supplied site address into a bare hostname.
 *
 * <p>Accepts either a hostname or a URL. Lowercases, drops scheme, credentials, path,
 * query, fragment and port, trims trailing dots and strips one leading {@code www.}.
 * Two domains are the same activation iff their normalized forms are equal.
 */
public final class DomainNormalizer {

    private static final int MAX_LENGTH = 253;
    private static final Pattern LABEL = Pattern.compile("^[a-z0-9_]([a-z0-9_-]{0,61}[a-z0-9_])?$");

    private DomainNormalizer() {
    }

    /**
     * @throws IllegalArgumentException if nothing resembling a hostname remains
     */
    public static String normalize(String input) {
        return tryNormalize(input)
            .orElseThrow(() -> new IllegalArgumentException("Malformed domain"));
    }

    public static Optional<String> tryNormalize(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String host = input.trim().toLowerCase(Locale.ROOT);

        int scheme = host.indexOf("://");
        if (scheme >= 0) {
            host = host.substring(scheme + 3);
        } else if (host.startsWith("//")) {
            host = host.substring(2);
        }

        host = cutAtFirst(host, "/?#");

        int at = host.lastIndexOf('@');
        if (at >= 0) {
            host = host.substring(at + 1);
        }

        int colon = host.indexOf(':');
        if (colon >= 0) {
            host = host.substring(0, colon);
        }

        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }

        if (host.startsWith("www.")) {
            host = host.substring(4);
        }

        return isValidHostname(host) ? Optional.of(host) : Optional.empty();
    }

    private static String cutAtFirst(String value, String delimiters) {
        int end = value.length();
        for (char c : delimiters.toCharArray()) {
            int idx = value.indexOf(c);
            if (idx >= 0 && idx < end) {
                end = idx;
            }
        }
        return value.substring(0, end);
    }

    private static boolean isValidHostname(String host) {
        if (host.isEmpty() || host.length() > MAX_LENGTH) {
            return false;
        }
        for (String label : host.split("\\.", -1)) {
            if (!LABEL.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }
}
