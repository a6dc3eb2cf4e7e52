package tech.keyledger.release;

import tech.keyledger.download.IssuedDownloadUrl;

/**
 * Answer to an update check.
 *
 * @param latestVersion newest version published for the slug
 * @param release the release on offer, null when up to date
 * @param download signed link for the release archive, null when up to date
 */
public record UpdateCheck(boolean updateAvailable, String latestVersion, Release release, IssuedDownloadUrl download) {

    public static UpdateCheck upToDate(String latestVersion) {
        return new UpdateCheck(false, latestVersion, null, null);
    }

    public static UpdateCheck available(Release release, IssuedDownloadUrl download) {
        return new UpdateCheck(true, release.version, release, download);
    }
}
