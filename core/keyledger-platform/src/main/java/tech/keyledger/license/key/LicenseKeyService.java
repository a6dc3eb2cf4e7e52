package tech.keyledger.license.key;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.license.LicenseRepository;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.security.HmacSigner;
import tech.keyledger.platform.security.secrets.ServerSecrets;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Generates, hashes and verifies license keys.
 *
 * <p>Key material: 32 bytes from {@link SecureRandom} mixed with the current time and the
 * product and owner ids through SHA-256. The first 16 digest bytes become the four
 * 8-character hex groups.
 *
 * <p>Only {@link KeyHashes} ever leave this service towards storage or logs.
 */
@ApplicationScoped
public class LicenseKeyService {

    private static final Logger LOG = Logger.getLogger(LicenseKeyService.class);
    private static final int RANDOM_BYTES = 32;
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    @Inject
    LicenseRepository licenseRepository;

    @Inject
    ServerSecrets secrets;

    @Inject
    LicensingConfig config;

    @Inject
    Clock clock;

    private final SecureRandom random = new SecureRandom();

    /**
     * Generate a key whose primary hash is not yet stored.
     *
     * @throws KeyGenerationException if every attempt collided
     */
    public LicenseKey generateKey(String productId, String ownerId) {
        int maxAttempts = config.keys().maxGenerationAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            LicenseKey candidate = randomKey(productId, ownerId);
            String primaryHash = primaryHash(candidate);
            if (!licenseRepository.existsByKeyHash(primaryHash)) {
                return candidate;
            }
            candidate.close();
            LOG.debugf("Generated key collided on attempt %d (hash prefix %s)", attempt, primaryHash.substring(0, 8));
        }
        LOG.errorf("Failed to generate a unique license key after %d attempts", maxAttempts);
        throw new KeyGenerationException("Unable to generate a unique license key after " + maxAttempts + " attempts");
    }

    public KeyHashes hashKey(LicenseKey key) {
        String primary = primaryHash(key);
        return new KeyHashes(primary, verificationHash(primary));
    }

    /**
     * Constant-time check of a key against a stored primary hash.
     */
    public boolean verify(LicenseKey key, String storedPrimaryHash) {
        return HmacSigner.constantTimeEquals(primaryHash(key), storedPrimaryHash);
    }

    /**
     * Constant-time check of the verification hash derived from a stored primary hash.
     */
    public boolean verifyHashes(String primaryHash, String storedVerificationHash) {
        return HmacSigner.constantTimeEquals(verificationHash(primaryHash), storedVerificationHash);
    }

    public boolean isValidFormat(String input) {
        return LicenseKey.isValidFormat(input);
    }

    /**
     * Display form of a stored license, built from its hash since the plaintext is gone.
     */
    public static String maskHash(String keyHash) {
        if (keyHash == null || keyHash.length() < 4) {
            return "****-****-****-****";
        }
        return "****-****-****-" + keyHash.substring(keyHash.length() - 4).toUpperCase(Locale.ROOT);
    }

    private String primaryHash(LicenseKey key) {
        byte[] bytes = key.toBytes();
        try {
            return HmacSigner.hmacSha256Hex(bytes, secrets.hashSalt());
        } finally {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    private String verificationHash(String primaryHash) {
        return HmacSigner.hmacSha256Hex(primaryHash, secrets.keySecret());
    }

    private LicenseKey randomKey(String productId, String ownerId) {
        byte[] seed = new byte[RANDOM_BYTES];
        random.nextBytes(seed);
        byte[] context = (String.valueOf(productId) + "|" + ownerId).getBytes(StandardCharsets.UTF_8);

        ByteBuffer material = ByteBuffer.allocate(seed.length + Long.BYTES * 2 + context.length);
        material.put(seed).putLong(System.nanoTime()).putLong(clock.millis()).put(context);
        byte[] digest = HmacSigner.sha256(material.array());
        Arrays.fill(seed, (byte) 0);
        Arrays.fill(material.array(), (byte) 0);

        String hex = HEX.formatHex(digest, 0, 16);
        Arrays.fill(digest, (byte) 0);
        return LicenseKey.fromGroups(hex.substring(0, 8), hex.substring(8, 16), hex.substring(16, 24), hex.substring(24, 32));
    }
}
