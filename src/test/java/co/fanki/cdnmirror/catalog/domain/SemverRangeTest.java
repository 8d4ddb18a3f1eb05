package co.fanki.cdnmirror.catalog.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SemverRange.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SemverRangeTest {

    // -- isWildcard ---

    @Test
    void whenCheckingWildcard_givenStarXAndBlank_shouldBeWildcard() {
        assertTrue(SemverRange.isWildcard("*"));
        assertTrue(SemverRange.isWildcard("x"));
        assertTrue(SemverRange.isWildcard(" "));
        assertTrue(SemverRange.isWildcard(null));
        assertFalse(SemverRange.isWildcard("^18.0.0"));
    }

    // -- parse ---

    @Test
    void whenParsing_givenLooseVersion_shouldBeEmpty() {
        assertTrue(SemverRange.parse("18.2").isEmpty());
        assertTrue(SemverRange.parse("latest").isEmpty());
    }

    @Test
    void whenParsing_givenPrerelease_shouldNotBeStable() {
        assertFalse(SemverRange.isStable(
                SemverRange.parse("19.0.0-rc.1").orElseThrow()));
        assertTrue(SemverRange.isStable(
                SemverRange.parse("19.0.0").orElseThrow()));
    }

    // -- satisfies ---

    @Test
    void whenCheckingCaretRange_givenVersions_shouldMatchSameMajor() {
        assertTrue(SemverRange.satisfies("1.1.0", "^1.0.0"));
        assertFalse(SemverRange.satisfies("2.0.0", "^1.0.0"));
    }

    @Test
    void whenCheckingOrRange_givenVersions_shouldMatchEitherSide() {
        assertTrue(SemverRange.satisfies("18.3.1", "^18.0.0 || ^19.0.0"));
        assertTrue(SemverRange.satisfies("19.2.0", "^18.0.0 || ^19.0.0"));
        assertFalse(SemverRange.satisfies("17.0.2", "^18.0.0 || ^19.0.0"));
    }

    @Test
    void whenCheckingRange_givenWildcard_shouldAcceptTags() {
        assertTrue(SemverRange.satisfies("latest", "*"));
    }

    @Test
    void whenCheckingRange_givenUnparseableVersion_shouldNotMatch() {
        assertFalse(SemverRange.satisfies("latest", "^1.0.0"));
    }

    // -- filter ---

    @Test
    void whenFiltering_givenMixedVersions_shouldKeepOrder() {
        assertEquals(List.of("1.1.0", "1.0.0"), SemverRange.filter(
                List.of("2.0.0", "1.1.0", "1.0.0"), "^1.0.0"));
    }

    // -- compare ---

    @Test
    void whenSorting_givenMixedVersions_shouldOrderTagsFirst() {
        final List<String> versions = new ArrayList<>(
                List.of("10.0.0", "latest", "9.1.0", "9.0.10"));

        versions.sort(SemverRange::compare);

        assertEquals(List.of("latest", "9.0.10", "9.1.0", "10.0.0"),
                versions);
    }

}
