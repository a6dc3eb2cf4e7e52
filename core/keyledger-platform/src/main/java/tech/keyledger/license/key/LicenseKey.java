package tech.keyledger.license.key;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Plaintext license key, {@code XXXXXXXX-XXXXXXXX-XXXXXXXX-XXXXXXXX} in uppercase hex.
 *
 * <p>Holds the characters in an array that {@link #close()} overwrites, so the plaintext
 * can be scrubbed once it has been handed to the purchaser or hashed. {@link #toString()}
 * is always masked.
 */
public final class LicenseKey implements AutoCloseable {

    private static final Pattern FORMAT = Pattern.compile("^[0-9A-F]{8}(-[0-9A-F]{8}){3}$");
    static final int LENGTH = 35;

    private final char[] chars;
    private volatile boolean wiped;

    private LicenseKey(char[] chars) {
        this.chars = chars;
    }

    /**
     * Parse user input. Surrounding whitespace is ignored and lowercase hex accepted.
     *
     * @throws IllegalArgumentException if the input is not a well-formed key
     */
    public static LicenseKey parse(String input) {
        return tryParse(input)
            .orElseThrow(() -> new IllegalArgumentException("Malformed license key"));
    }

    public static Optional<LicenseKey> tryParse(String input) {
        if (!isValidFormat(input)) {
            return Optional.empty();
        }
        return Optional.of(new LicenseKey(normalize(input).toCharArray()));
    }

    /**
     * Pure format check, safe to run before any storage access.
     */
    public static boolean isValidFormat(String input) {
        if (input == null) {
            return false;
        }
        String normalized = normalize(input);
        return normalized.length() == LENGTH && FORMAT.matcher(normalized).matches();
    }

    static LicenseKey fromGroups(String g1, String g2, String g3, String g4) {
        return parse(g1 + "-" + g2 + "-" + g3 + "-" + g4);
    }

    private static String normalize(String input) {
        return input.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * The plaintext, for the single moment it is shown to the purchaser.
     *
     * @throws IllegalStateException if the key was already wiped
     */
    public String reveal() {
        ensureNotWiped();
        return new String(chars);
    }

    /**
     * ASCII bytes of the key. The caller owns the returned array and should zero it.
     */
    public byte[] toBytes() {
        ensureNotWiped();
        byte[] bytes = new byte[chars.length];
        for (int i = 0; i < chars.length; i++) {
            bytes[i] = (byte) chars[i];
        }
        return bytes;
    }

    /**
     * Display form showing only the last four characters.
     */
    public String masked() {
        if (wiped) {
            return "****-****-****-****";
        }
        return "****-****-****-" + new String(chars, chars.length - 4, 4);
    }

    public boolean isWiped() {
        return wiped;
    }

    @Override
    public void close() {
        Arrays.fill(chars, '\0');
        wiped = true;
    }

    private void ensureNotWiped() {
        if (wiped) {
            throw new IllegalStateException("License key has been wiped");
        }
    }

    @Override
    public String toString() {
        return masked();
    }
}
