package tech.keyledger.license.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class LicenseKeyTest {

    private static final String KEY = "0123ABCD-4567EF01-89ABCDEF-DEADBEEF";

    @Test
    @DisplayName("should accept lowercase and surrounding whitespace")
    void parse_shouldNormalizeInput() {
        try (LicenseKey key = LicenseKey.parse("  0123abcd-4567ef01-89abcdef-deadbeef \n")) {
            assertThat(key.reveal()).isEqualTo(KEY);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "0123ABCD4567EF0189ABCDEFDEADBEEF",
        "0123ABCD-4567EF01-89ABCDEF",
        "0123ABCD-4567EF01-89ABCDEF-DEADBEEG",
        "0123ABCD-4567EF01-89ABCDEF-DEADBEEF0",
        "0123ABCD_4567EF01_89ABCDEF_DEADBEEF",
        "0123ABC-D4567EF01-89ABCDEF-DEADBEEF"
    })
    @DisplayName("should reject anything that is not four groups of eight hex digits")
    void isValidFormat_shouldRejectMalformed(String input) {
        assertThat(LicenseKey.isValidFormat(input)).isFalse();
        assertThat(LicenseKey.tryParse(input)).isEmpty();
    }

    @Test
    @DisplayName("should reject null without throwing")
    void isValidFormat_shouldRejectNull() {
        assertThat(LicenseKey.isValidFormat(null)).isFalse();
        assertThatThrownBy(() -> LicenseKey.parse(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString should never reveal the plaintext")
    void toString_shouldBeMasked() {
        LicenseKey key = LicenseKey.fromGroups("0123ABCD", "4567EF01", "89ABCDEF", "DEADBEEF");

        assertThat(key.toString()).isEqualTo("****-****-****-BEEF");
        assertThat(key.masked()).isEqualTo(key.toString());
        assertThat(String.valueOf(key)).doesNotContain("0123ABCD");
    }

    @Test
    @DisplayName("closing should wipe the key")
    void close_shouldWipePlaintext() {
        LicenseKey key = LicenseKey.parse(KEY);

        key.close();

        assertThat(key.isWiped()).isTrue();
        assertThat(key.masked()).isEqualTo("****-****-****-****");
        assertThatThrownBy(key::reveal).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(key::toBytes).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("toBytes should return the ASCII form")
    void toBytes_shouldReturnAscii() {
        try (LicenseKey key = LicenseKey.parse(KEY)) {
            assertThat(new String(key.toBytes(), java.nio.charset.StandardCharsets.US_ASCII)).isEqualTo(KEY);
            assertThat(key.toBytes()).hasSize(LicenseKey.LENGTH);
        }
    }
}
