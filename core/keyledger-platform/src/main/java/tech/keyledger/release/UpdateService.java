package tech.keyledger.release;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.activation.HeartbeatReceipt;
import tech.keyledger.download.IssuedDownloadUrl;
import tech.keyledger.engine.LicensingEngine;
import tech.keyledger.license.EffectiveStatus;
import tech.keyledger.license.License;
import tech.keyledger.license.LicenseService;
import tech.keyledger.license.LicenseStateMachine;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.config.LicensingConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Update checks and download gating for licensed packages.
 *
 * <p>An update check is a heartbeat first: the domain must be activated and the license
 * usable. Only then is the newest release for the license's product and the requested
 * slug compared against the client's version.
 *
 * <p>A download needs a valid signed link, a license that is still usable at the time of
 * download, a release of the license's product, and an archive inside the releases
 * directory.
 */
@ApplicationScoped
public class UpdateService {

    private static final Logger LOG = Logger.getLogger(UpdateService.class);
    private static final String ARCHIVE_EXTENSION = ".zip";

    @Inject
    LicensingEngine engine;

    @Inject
    LicenseService licenseService;

    @Inject
    ReleaseRepository releaseRepository;

    @Inject
    LicensingConfig config;

    @Inject
    Clock clock;

    public Result<UpdateCheck> checkForUpdate(String keyPlaintext, String domain, String slug,
                                              String currentVersion, String clientIp) {
        if (slug == null || slug.isBlank()) {
            return Result.failure(LicensingError.invalidRequest("slug is required"));
        }

        Result<HeartbeatReceipt> heartbeat = engine.validateHeartbeat(keyPlaintext, domain, clientIp);
        if (!(heartbeat instanceof Result.Success<HeartbeatReceipt> ok)) {
            return heartbeat.propagateFailure();
        }
        HeartbeatReceipt receipt = ok.value();

        if (!releaseRepository.existsActiveForProduct(receipt.productId())) {
            return Result.failure(LicensingError.noRelease());
        }

        Optional<Release> latest = releaseRepository.findActiveByProductAndSlug(receipt.productId(), slug.trim())
            .stream()
            .max(Comparator.comparing(r -> r.version, VersionComparator.INSTANCE));
        if (latest.isEmpty()) {
            LOG.infof("Slug %s does not belong to product %s (license %s)", slug, receipt.productId(), receipt.licenseId());
            return Result.failure(LicensingError.slugMismatch());
        }

        Release release = latest.get();
        if (!VersionComparator.isNewer(release.version, currentVersion)) {
            return Result.success(UpdateCheck.upToDate(release.version));
        }

        if (resolveArchive(release).isEmpty()) {
            LOG.warnf("Release %s archive missing or outside releases directory", release.id);
            return Result.failure(LicensingError.releaseFileUnavailable());
        }

        IssuedDownloadUrl download = engine.issueDownloadToken(receipt.licenseId(), release.id);
        LOG.infof("Offered %s %s to license %s (client on %s)", slug, release.version, receipt.licenseId(), currentVersion);
        return Result.success(UpdateCheck.available(release, download));
    }

    public Result<ReleaseFile> openDownload(String licenseId, String releaseId, long expiresEpochSeconds, String signature) {
        if (!engine.verifyDownloadToken(licenseId, releaseId, expiresEpochSeconds, signature)) {
            return Result.failure(LicensingError.invalidSignature());
        }

        Optional<License> license = licenseService.findById(licenseId);
        if (license.isEmpty()) {
            return Result.failure(LicensingError.notFound());
        }
        EffectiveStatus status = LicenseStateMachine.evaluate(license.get(), clock.instant());
        if (!status.isUsable()) {
            LOG.infof("Download refused for license %s, status %s", licenseId, status.code());
            return Result.failure(status == EffectiveStatus.EXPIRED
                ? LicensingError.expired() : LicensingError.inactive());
        }

        Optional<Release> release = releaseRepository.findById(releaseId)
            .filter(r -> r.active)
            .filter(r -> r.productId.equals(license.get().productId));
        if (release.isEmpty()) {
            return Result.failure(LicensingError.noRelease());
        }

        Optional<Path> archive = resolveArchive(release.get());
        if (archive.isEmpty()) {
            return Result.failure(LicensingError.releaseFileUnavailable());
        }

        try {
            Path path = archive.get();
            LOG.infof("Streaming release %s to license %s", releaseId, licenseId);
            return Result.success(new ReleaseFile(release.get(), path, path.getFileName().toString(), Files.size(path)));
        } catch (IOException e) {
            LOG.warnf(e, "Failed to stat release archive %s", releaseId);
            return Result.failure(LicensingError.releaseFileUnavailable());
        }
    }

    /**
     * The archive of a release if it is a regular {@code .zip} file inside the releases
     * directory.
     */
    Optional<Path> resolveArchive(Release release) {
        if (release.filePath == null || release.filePath.isBlank()) {
            return Optional.empty();
        }
        Path root = Path.of(config.download().releasesDir()).toAbsolutePath().normalize();
        Path candidate = root.resolve(release.filePath).normalize();
        if (!candidate.startsWith(root)) {
            LOG.warnf("Release %s path escapes releases directory", release.id);
            return Optional.empty();
        }
        if (!candidate.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION)) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(candidate) || !Files.isReadable(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
