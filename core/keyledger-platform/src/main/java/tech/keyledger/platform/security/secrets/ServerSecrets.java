package tech.keyledger.platform.security.secrets;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.platform.config.LicensingConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the server-side secrets used for hashing and signing.
 *
 * Four secrets are provisioned at startup, never on a read path:
 * 1. Hash salt - keys the primary license key hash
 * 2. Key secret - keys the verification hash derived from the primary hash
 * 3. Signing secret - signs download capability tokens
 * 4. IP salt - keys the hash stored instead of client IP addresses
 *
 * Each one comes from configuration if set, else from {@code <secrets.dir>/<name>.secret},
 * else it is generated (32 random bytes, hex) and persisted there. Startup fails if none
 * of that works.
 */
@ApplicationScoped
public class ServerSecrets {

    private static final Logger LOG = Logger.getLogger(ServerSecrets.class);
    private static final int SECRET_BYTES = 32;
    private static final int MIN_SECRET_LENGTH = 32;

    static final String HASH_SALT = "hash-salt";
    static final String KEY_SECRET = "key-secret";
    static final String SIGNING_SECRET = "signing-secret";
    static final String IP_SALT = "ip-salt";

    static final Set<PosixFilePermission> DIR_PERMISSIONS = PosixFilePermissions.fromString("rwx------");
    static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-------");

    @Inject
    LicensingConfig config;

    private final SecureRandom random = new SecureRandom();

    private String hashSalt;
    private String keySecret;
    private volatile String signingSecret;
    private String ipSalt;

    @PostConstruct
    void init() {
        LicensingConfig.SecretsConfig secrets = config.secrets();
        Path dir = Path.of(secrets.dir());
        this.hashSalt = provision(HASH_SALT, secrets.hashSalt(), dir);
        this.keySecret = provision(KEY_SECRET, secrets.keySecret(), dir);
        this.signingSecret = provision(SIGNING_SECRET, secrets.signingSecret(), dir);
        this.ipSalt = provision(IP_SALT, secrets.ipSalt(), dir);
        LOG.infof("Server secrets provisioned (dir=%s)", dir.toAbsolutePath());
    }

    /**
     * Secrets built directly from values, without touching configuration or disk.
     */
    public static ServerSecrets of(String hashSalt, String keySecret, String signingSecret, String ipSalt) {
        ServerSecrets secrets = new ServerSecrets();
        secrets.hashSalt = requireLength(HASH_SALT, hashSalt);
        secrets.keySecret = requireLength(KEY_SECRET, keySecret);
        secrets.signingSecret = requireLength(SIGNING_SECRET, signingSecret);
        secrets.ipSalt = requireLength(IP_SALT, ipSalt);
        return secrets;
    }

    public String hashSalt() {
        return hashSalt;
    }

    public String keySecret() {
        return keySecret;
    }

    public String signingSecret() {
        return signingSecret;
    }

    public String ipSalt() {
        return ipSalt;
    }

    /**
     * Replace the signing secret. Every download link issued before the rotation stops
     * verifying.
     */
    public synchronized void rotateSigningSecret() {
        String rotated = generate();
        if (config != null) {
            persist(Path.of(config.secrets().dir()), SIGNING_SECRET, rotated);
        }
        this.signingSecret = rotated;
        LOG.warn("Signing secret rotated, outstanding download links are now invalid");
    }

    private String provision(String name, Optional<String> configured, Path dir) {
        if (configured.isPresent() && !configured.get().isBlank()) {
            LOG.debugf("Using configured secret [%s]", name);
            return requireLength(name, configured.get().trim());
        }

        Path file = dir.resolve(name + ".secret");
        if (Files.exists(file)) {
            try {
                String stored = Files.readString(file, StandardCharsets.UTF_8).trim();
                LOG.debugf("Loaded secret [%s] from %s", name, file);
                return requireLength(name, stored);
            } catch (IOException e) {
                throw new SecretProvisioningException("Failed to read secret " + name + " from " + file, e);
            }
        }

        String generated = generate();
        persist(dir, name, generated);
        LOG.infof("Generated new secret [%s], persisted to %s", name, file);
        return generated;
    }

    private String generate() {
        byte[] bytes = new byte[SECRET_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private void persist(Path dir, String name, String value) {
        Path file = dir.resolve(name + ".secret");
        boolean posix = supportsPosix(dir);
        try {
            if (!Files.isDirectory(dir)) {
                if (posix) {
                    Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(DIR_PERMISSIONS));
                } else {
                    Files.createDirectories(dir);
                }
            }
            Path tmp = posix
                ? Files.createTempFile(dir, name, ".tmp", PosixFilePermissions.asFileAttribute(FILE_PERMISSIONS))
                : Files.createTempFile(dir, name, ".tmp");
            Files.writeString(tmp, value, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SecretProvisioningException("Failed to persist secret " + name + " to " + file, e);
        }
    }

    private static boolean supportsPosix(Path dir) {
        return dir.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    private static String requireLength(String name, String value) {
        if (value == null || value.length() < MIN_SECRET_LENGTH) {
            throw new SecretProvisioningException(
                "Secret " + name + " must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        return value;
    }
}
