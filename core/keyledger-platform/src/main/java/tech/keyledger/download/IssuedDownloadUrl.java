package tech.keyledger.download;

import java.time.Instant;

/**
 * A signed, time-boxed download link.
 */
public record IssuedDownloadUrl(String url, Instant expiresAt, String signature) {
}
