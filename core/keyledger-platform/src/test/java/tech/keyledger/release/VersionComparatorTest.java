package tech.keyledger.release;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VersionComparatorTest {

    @ParameterizedTest(name = "{0} is newer than {1}")
    @CsvSource({
        "1.10.0, 1.9.2",
        "2.0, 1.99.99",
        "1.0.1, 1.0",
        "1.0.0, 1.0.0-beta",
        "1.0.0-rc.2, 1.0.0-beta",
        "v1.2.0, 1.1.9",
        "10.0.0, 9.0.0"
    })
    @DisplayName("should order versions numerically")
    void isNewer_shouldCompareSegmentsNumerically(String candidate, String current) {
        assertThat(VersionComparator.isNewer(candidate, current)).isTrue();
        assertThat(VersionComparator.isNewer(current, candidate)).isFalse();
    }

    @Test
    @DisplayName("equal versions should not count as newer")
    void isNewer_shouldBeFalse_whenEqual() {
        assertThat(VersionComparator.isNewer("1.2.0", "1.2")).isFalse();
        assertThat(VersionComparator.isNewer("v1.2.0", "1.2.0")).isFalse();
        assertThat(VersionComparator.INSTANCE.compare("1.2", "1.2.0")).isZero();
    }

    @Test
    @DisplayName("a client without a version should always be offered the release")
    void isNewer_shouldBeTrue_whenCurrentUnknown() {
        assertThat(VersionComparator.isNewer("0.1.0", null)).isTrue();
        assertThat(VersionComparator.isNewer("0.1.0", " ")).isTrue();
    }

    @Test
    @DisplayName("sorting should pick the highest version")
    void compare_shouldSortReleases() {
        List<String> versions = new ArrayList<>(List.of("1.9.0", "1.10.0", "1.10.0-beta", "1.2.3"));

        versions.sort(VersionComparator.INSTANCE);

        assertThat(versions).containsExactly("1.2.3", "1.9.0", "1.10.0-beta", "1.10.0");
    }
}
