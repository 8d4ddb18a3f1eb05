package co.fanki.cdnmirror.rewrite.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.PackageCoordinates;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for AbsoluteImportMatcher.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AbsoluteImportMatcherTest {

    private static final String JSX_19 =
            "https://esm.sh/react@19.2.0/jsx-runtime";
    private static final String JSX_18 =
            "https://esm.sh/react@18.3.1/jsx-runtime";
    private static final String REACT_19 = "https://esm.sh/react@19.2.0";

    private final CdnUrls cdnUrls = new CdnUrls("https://esm.sh");

    private final AbsoluteImportMatcher matcher = new AbsoluteImportMatcher(
            cdnUrls);

    // -- score ---

    @Test
    void whenScoring_givenSubpaths_shouldRewardExactOverContained() {
        final PackageCoordinates imported = new PackageCoordinates("react",
                "^19.0.0", "jsx-runtime");

        assertEquals(101, matcher.score(imported, JSX_19));
        assertEquals(51, matcher.score(imported,
                "https://esm.sh/react@19.2.0/es2022/jsx-runtime.mjs"));
        assertEquals(1, matcher.score(imported, REACT_19));
        assertEquals(0, matcher.score(imported,
                "https://esm.sh/react-dom@19.2.0/client"));
    }

    // -- bestMatch ---

    @Test
    void whenMatching_givenEntryAndSubpath_shouldPickExactSubpath() {
        assertEquals(Optional.of(JSX_19), matcher.bestMatch(
                "/react@^19.1.1/jsx-runtime?target=es2022",
                List.of(REACT_19, JSX_19), PeerContext.empty()));
    }

    @Test
    void whenMatching_givenSameScore_shouldPreferSatisfyingVersion() {
        assertEquals(Optional.of(JSX_18), matcher.bestMatch(
                "/react@^18.0.0/jsx-runtime", List.of(JSX_19, JSX_18),
                PeerContext.empty()));
    }

    @Test
    void whenMatching_givenSameVersion_shouldPreferImporterContext() {
        final String with18 = "https://esm.sh/lib@1.0.0?react=18.3.1";
        final String with19 = "https://esm.sh/lib@1.0.0?react=19.2.0";

        assertEquals(Optional.of(with18), matcher.bestMatch("/lib@^1.0.0",
                List.of(with19, with18),
                PeerContext.of(Map.of("react", "18.3.1"))));
    }

    @Test
    void whenMatching_givenLatestImport_shouldPreferHigherVersion() {
        assertEquals(Optional.of("https://esm.sh/lib@1.1.0"),
                matcher.bestMatch("/lib@latest", List.of(
                        "https://esm.sh/lib@1.0.0",
                        "https://esm.sh/lib@1.1.0"), PeerContext.empty()));
    }

    @Test
    void whenMatching_givenNoCandidate_shouldReturnEmpty() {
        assertTrue(matcher.bestMatch("/vue@^3.0.0", List.of(REACT_19,
                "https://other.cdn/vue@3.0.0"), PeerContext.empty())
                .isEmpty());
        assertTrue(matcher.bestMatch("/react/jsx-runtime", List.of(JSX_19),
                PeerContext.empty()).isEmpty());
    }

}
