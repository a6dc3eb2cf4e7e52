package tech.keyledger.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.keyledger.activation.Activation;
import tech.keyledger.license.key.KeyServiceWiring;
import tech.keyledger.license.key.LicenseKey;
import tech.keyledger.license.key.LicenseKeyService;
import tech.keyledger.platform.common.Result;
import tech.keyledger.testing.InMemoryActivationRepository;
import tech.keyledger.testing.InMemoryLicenseRepository;
import tech.keyledger.testing.MutableClock;
import tech.keyledger.testing.TestLicensingConfig;
import tech.keyledger.testing.TestSecrets;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LicenseService with in-memory repositories and real key hashing.
 */
class LicenseServiceTest {

    private static final Instant EXPIRES = Instant.parse("2025-05-01T00:00:00Z");

    private InMemoryLicenseRepository licenses;
    private InMemoryActivationRepository activations;
    private MutableClock clock;
    private LicenseService service;

    @BeforeEach
    void setUp() {
        licenses = new InMemoryLicenseRepository();
        activations = new InMemoryActivationRepository();
        clock = MutableClock.at("2024-05-01T00:00:00Z");

        LicenseKeyService keyService = KeyServiceWiring.create(
            licenses, TestSecrets.fixed(), new TestLicensingConfig(), clock);

        service = new LicenseService();
        service.licenseRepository = licenses;
        service.activationRepository = activations;
        service.keyService = keyService;
        service.clock = clock;
    }

    private IssuedLicense issue(CreateLicenseCommand command) {
        Result<IssuedLicense> result = service.createLicense(command);
        assertThat(result.isSuccess()).isTrue();
        return ((Result.Success<IssuedLicense>) result).value();
    }

    private static CreateLicenseCommand.CreateLicenseCommandBuilder command() {
        return CreateLicenseCommand.builder()
            .ownerId("owner-1")
            .productId("prod-1")
            .maxActivations(3)
            .expiresAt(EXPIRES)
            .graceUntil(EXPIRES.plus(Duration.ofDays(7)));
    }

    private static String code(Result<?> result) {
        assertThat(result.isFailure()).isTrue();
        return ((Result.Failure<?>) result).error().code();
    }

    // ========================================
    // Issuance
    // ========================================

    @Test
    @DisplayName("should issue an active license storing only hashes of its key")
    void createLicense_shouldPersistHashesOnly() {
        // Act
        IssuedLicense issued = issue(command().orderRef("order-42").build());

        // Assert
        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        String plaintext = issued.key().reveal();
        assertThat(issued.licenseId()).startsWith("lic_");
        assertThat(stored.status).isEqualTo(LicenseStatus.ACTIVE);
        assertThat(stored.orderRef).isEqualTo("order-42");
        assertThat(stored.maxActivations).isEqualTo(3);
        assertThat(stored.createdAt).isEqualTo(clock.instant());
        assertThat(stored.keyHash).hasSize(64).doesNotContain(plaintext);
        assertThat(stored.keyVerificationHash).hasSize(64).isNotEqualTo(stored.keyHash);
    }

    @Test
    @DisplayName("issued key should resolve back to its license")
    void findByKey_shouldResolveIssuedKey() {
        IssuedLicense issued = issue(command().build());

        try (LicenseKey key = LicenseKey.parse(issued.key().reveal().toLowerCase())) {
            assertThat(service.findByKey(key)).map(l -> l.id).contains(issued.licenseId());
        }
    }

    @Test
    @DisplayName("should not resolve an unknown key")
    void findByKey_shouldReturnEmpty_whenUnknown() {
        issue(command().build());

        assertThat(service.findByKey(LicenseKey.parse("00000000-00000000-00000000-00000000"))).isEmpty();
    }

    @Test
    @DisplayName("should not resolve a key whose verification hash was tampered with")
    void findByKey_shouldReturnEmpty_whenVerificationHashMismatch() {
        IssuedLicense issued = issue(command().build());
        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        stored.keyVerificationHash = "0".repeat(64);
        licenses.update(stored);

        assertThat(service.findByKey(LicenseKey.parse(issued.key().reveal()))).isEmpty();
    }

    @Test
    @DisplayName("should reject invalid issuance parameters")
    void createLicense_shouldValidateCommand() {
        assertThat(code(service.createLicense(command().ownerId(" ").build()))).isEqualTo("invalid_request");
        assertThat(code(service.createLicense(command().productId(null).build()))).isEqualTo("invalid_request");
        assertThat(code(service.createLicense(command().maxActivations(-1).build()))).isEqualTo("invalid_request");
        assertThat(code(service.createLicense(command().expiresAt(null).build()))).isEqualTo("invalid_request");
        assertThat(code(service.createLicense(command().graceUntil(EXPIRES.minusSeconds(1)).build())))
            .isEqualTo("invalid_request");
        assertThat(licenses.size()).isZero();
    }

    @Test
    @DisplayName("should allow perpetual unlimited licenses")
    void createLicense_shouldAcceptPerpetualUnlimited() {
        IssuedLicense issued = issue(command().maxActivations(null).expiresAt(null).graceUntil(null).build());

        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        assertThat(stored.hasActivationLimit()).isFalse();
        assertThat(LicenseStateMachine.evaluate(stored, Instant.parse("2099-01-01T00:00:00Z")))
            .isEqualTo(EffectiveStatus.ACTIVE);
    }

    @Test
    @DisplayName("zero activations from order intake should be stored as unlimited")
    void createLicense_shouldStoreUnlimited_whenMaxActivationsZero() {
        // Act
        IssuedLicense issued = issue(command().maxActivations(0).build());

        // Assert
        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        assertThat(stored.maxActivations).isNull();
        assertThat(stored.hasActivationLimit()).isFalse();
    }

    // ========================================
    // Administration
    // ========================================

    @Test
    @DisplayName("reinstating should reset the failed attempt counter")
    void changeStatus_shouldResetFailedAttempts_whenReinstated() {
        // Arrange
        IssuedLicense issued = issue(command().build());
        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        stored.failedAttempts = 4;
        licenses.update(stored);

        // Act
        service.changeStatus(issued.licenseId(), LicenseStatus.SUSPENDED);
        clock.advance(Duration.ofHours(1));
        Result<License> result = service.changeStatus(issued.licenseId(), LicenseStatus.ACTIVE);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        License after = licenses.findById(issued.licenseId()).orElseThrow();
        assertThat(after.status).isEqualTo(LicenseStatus.ACTIVE);
        assertThat(after.failedAttempts).isZero();
        assertThat(after.updatedAt).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("status change of an unknown license should fail")
    void changeStatus_shouldReturnNotFound_whenUnknown() {
        assertThat(code(service.changeStatus("lic_missing", LicenseStatus.REVOKED))).isEqualTo("not_found");
        assertThat(code(service.changeStatus("lic_missing", null))).isEqualTo("invalid_request");
    }

    @Test
    @DisplayName("renewal should move expiry and grace")
    void renew_shouldMoveExpiry() {
        IssuedLicense issued = issue(command().build());
        Instant newExpiry = EXPIRES.plus(Duration.ofDays(365));

        Result<License> result = service.renew(issued.licenseId(), newExpiry, newExpiry.plus(Duration.ofDays(14)));

        assertThat(result.isSuccess()).isTrue();
        License stored = licenses.findById(issued.licenseId()).orElseThrow();
        assertThat(stored.expiresAt).isEqualTo(newExpiry);
        assertThat(stored.graceUntil).isEqualTo(newExpiry.plus(Duration.ofDays(14)));
        assertThat(code(service.renew(issued.licenseId(), newExpiry, newExpiry.minusSeconds(1))))
            .isEqualTo("invalid_request");
    }

    @Test
    @DisplayName("deleting a license should remove its activations")
    void delete_shouldCascadeToActivations() {
        // Arrange
        IssuedLicense issued = issue(command().build());
        Activation activation = new Activation();
        activation.id = "act_1";
        activation.licenseId = issued.licenseId();
        activation.domain = "a.com";
        activation.active = true;
        activations.persist(activation);

        // Act
        Result<String> result = service.delete(issued.licenseId());

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(licenses.findById(issued.licenseId())).isEmpty();
        assertThat(activations.findByLicense(issued.licenseId())).isEmpty();
        assertThat(code(service.delete(issued.licenseId()))).isEqualTo("not_found");
    }
}
