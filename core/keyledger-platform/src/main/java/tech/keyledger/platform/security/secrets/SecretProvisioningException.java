package tech.keyledger.platform.security.secrets;

/**
 * Exception thrown when a server secret can be neither loaded nor generated and persisted.
 */
public class SecretProvisioningException extends RuntimeException {

    public SecretProvisioningException(String message) {
        super(message);
    }

    public SecretProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
