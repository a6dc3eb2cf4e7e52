package tech.keyledger.platform.security.secrets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.keyledger.testing.TestLicensingConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ServerSecretsTest {

    private static final String CONFIGURED = "configured-hash-salt-0123456789abcdef";

    @TempDir
    Path dir;

    private TestLicensingConfig config;

    @BeforeEach
    void setUp() {
        config = new TestLicensingConfig();
        config.secrets.dir = dir.toString();
    }

    private ServerSecrets provision() {
        ServerSecrets secrets = new ServerSecrets();
        secrets.config = config;
        secrets.init();
        return secrets;
    }

    @Test
    @DisplayName("should generate and persist every secret on first start")
    void init_shouldGenerateAndPersist_whenNothingProvisioned() throws Exception {
        // Act
        ServerSecrets secrets = provision();

        // Assert
        assertThat(secrets.hashSalt()).hasSize(64).matches("[0-9a-f]+");
        assertThat(secrets.signingSecret()).isNotEqualTo(secrets.hashSalt());
        assertThat(Files.readString(dir.resolve("hash-salt.secret"), StandardCharsets.UTF_8))
            .isEqualTo(secrets.hashSalt());
        assertThat(dir.resolve("key-secret.secret")).exists();
        assertThat(dir.resolve("signing-secret.secret")).exists();
        assertThat(dir.resolve("ip-salt.secret")).exists();
    }

    @Test
    @DisplayName("generated secrets should be readable by the owner only")
    void init_shouldRestrictPermissions_whenPosixSupported() throws Exception {
        assumeTrue(dir.getFileSystem().supportedFileAttributeViews().contains("posix"));
        Path nested = dir.resolve("nested");
        config.secrets.dir = nested.toString();

        ServerSecrets secrets = provision();
        secrets.rotateSigningSecret();

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(nested))).isEqualTo("rwx------");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(nested.resolve("hash-salt.secret"))))
            .isEqualTo("rw-------");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(nested.resolve("signing-secret.secret"))))
            .isEqualTo("rw-------");
    }

    @Test
    @DisplayName("should reload the same secrets on the next start")
    void init_shouldReloadPersistedSecrets() {
        ServerSecrets first = provision();
        ServerSecrets second = provision();

        assertThat(second.hashSalt()).isEqualTo(first.hashSalt());
        assertThat(second.keySecret()).isEqualTo(first.keySecret());
        assertThat(second.signingSecret()).isEqualTo(first.signingSecret());
        assertThat(second.ipSalt()).isEqualTo(first.ipSalt());
    }

    @Test
    @DisplayName("configured values should win over files")
    void init_shouldPreferConfiguredSecret() {
        provision();
        config.secrets.hashSalt = Optional.of("  " + CONFIGURED + " ");

        ServerSecrets secrets = provision();

        assertThat(secrets.hashSalt()).isEqualTo(CONFIGURED);
    }

    @Test
    @DisplayName("should refuse secrets shorter than 32 characters")
    void init_shouldFail_whenConfiguredSecretTooShort() {
        config.secrets.signingSecret = Optional.of("too-short");

        assertThatThrownBy(this::provision)
            .isInstanceOf(SecretProvisioningException.class)
            .hasMessageContaining("signing-secret");
    }

    @Test
    @DisplayName("should refuse a truncated secret file")
    void init_shouldFail_whenStoredSecretTooShort() throws Exception {
        Files.writeString(dir.resolve("ip-salt.secret"), "abc", StandardCharsets.UTF_8);

        assertThatThrownBy(this::provision)
            .isInstanceOf(SecretProvisioningException.class)
            .hasMessageContaining("ip-salt");
    }

    @Test
    @DisplayName("rotation should replace and persist the signing secret only")
    void rotateSigningSecret_shouldReplaceAndPersist() throws Exception {
        // Arrange
        ServerSecrets secrets = provision();
        String before = secrets.signingSecret();
        String hashSalt = secrets.hashSalt();

        // Act
        secrets.rotateSigningSecret();

        // Assert
        assertThat(secrets.signingSecret()).isNotEqualTo(before);
        assertThat(secrets.hashSalt()).isEqualTo(hashSalt);
        assertThat(Files.readString(dir.resolve("signing-secret.secret"), StandardCharsets.UTF_8))
            .isEqualTo(secrets.signingSecret());
    }
}
