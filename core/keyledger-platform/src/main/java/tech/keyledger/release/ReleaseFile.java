package tech.keyledger.release;

import java.nio.file.Path;

/**
 * A release archive cleared for streaming.
 */
public record ReleaseFile(Release release, Path path, String fileName, long size) {
}
