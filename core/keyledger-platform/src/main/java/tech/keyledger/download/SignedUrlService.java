package tech.keyledger.download;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.security.HmacSigner;
import tech.keyledger.platform.security.secrets.ServerSecrets;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Issues and verifies download capability tokens.
 *
 * <p>Signature: HMAC-SHA256 over {@code licenseId|releaseId|expiresEpochSeconds} with the
 * server signing secret, hex encoded. Nothing is stored: a token is valid for any number
 * of uses until it expires or the signing secret is rotated.
 */
@ApplicationScoped
public class SignedUrlService {

    private static final Logger LOG = Logger.getLogger(SignedUrlService.class);
    private static final String SEPARATOR = "|";

    @Inject
    ServerSecrets secrets;

    @Inject
    LicensingConfig config;

    @Inject
    Clock clock;

    public IssuedDownloadUrl issue(String licenseId, String releaseId) {
        return issue(licenseId, releaseId, config.download().ttl());
    }

    public IssuedDownloadUrl issue(String licenseId, String releaseId, Duration ttl) {
        requireId("licenseId", licenseId);
        requireId("releaseId", releaseId);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        long expires = clock.instant().plus(ttl).getEpochSecond();
        String signature = sign(licenseId, releaseId, expires);

        LicensingConfig.DownloadConfig download = config.download();
        String url = stripTrailingSlash(download.baseUrl()) + download.path()
            + "?license_id=" + encode(licenseId)
            + "&release_id=" + encode(releaseId)
            + "&expires=" + expires
            + "&sig=" + signature;

        LOG.debugf("Issued download link for license %s release %s, expires %d", licenseId, releaseId, expires);
        return new IssuedDownloadUrl(url, Instant.ofEpochSecond(expires), signature);
    }

    /**
     * @return true if the signature matches and {@code expiresEpochSeconds} has not passed
     */
    public boolean verify(String licenseId, String releaseId, long expiresEpochSeconds, String signature) {
        if (licenseId == null || releaseId == null || signature == null) {
            return false;
        }
        if (expiresEpochSeconds < clock.instant().getEpochSecond()) {
            LOG.debugf("Rejected expired download link for license %s", licenseId);
            return false;
        }
        if (licenseId.contains(SEPARATOR) || releaseId.contains(SEPARATOR)) {
            return false;
        }
        boolean valid = HmacSigner.constantTimeEquals(sign(licenseId, releaseId, expiresEpochSeconds), signature);
        if (!valid) {
            LOG.warnf("Invalid download signature for license %s release %s", licenseId, releaseId);
        }
        return valid;
    }

    private String sign(String licenseId, String releaseId, long expires) {
        String canonical = licenseId + SEPARATOR + releaseId + SEPARATOR + expires;
        return HmacSigner.hmacSha256Hex(canonical, secrets.signingSecret());
    }

    private static void requireId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.contains(SEPARATOR)) {
            throw new IllegalArgumentException(name + " must not contain '" + SEPARATOR + "'");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
