package tech.keyledger.license.key;

/**
 * Thrown when no unique license key could be produced within the configured attempts.
 */
public class KeyGenerationException extends RuntimeException {

    public KeyGenerationException(String message) {
        super(message);
    }
}
