package co.fanki.cdnmirror.index.domain;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.PackageSpec;
import co.fanki.cdnmirror.catalog.domain.SameVersionGroups;
import co.fanki.cdnmirror.catalog.domain.SubpathConfig;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for LookupIndex.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LookupIndexTest {

    private static final PeerContext REACT_19 = PeerContext.of(Map.of(
            "react", "19.2.0", "react-dom", "19.2.0"));

    // -- packages ---

    @Test
    void whenFindingPackage_givenDistinguishingPeers_shouldMatchUnit() {
        final LookupIndex index = sample();
        final PeerScope scope = new PeerScope(mapping());

        final Optional<AnalyzedDependency> found = index.findPackage(
                "framer-motion", "12.23.23", REACT_19, scope);

        assertTrue(found.isPresent());
        assertEquals(REACT_19, found.get().getPeerContext());
        assertTrue(index.findPackage("framer-motion", "12.23.23",
                PeerContext.empty(), scope).isEmpty());
        assertTrue(index.findPackage("react", "19.2.0", PeerContext.empty(),
                scope).isPresent());
    }

    // -- urlToFile ---

    @Test
    void whenAssigningFiles_givenExistingUrl_shouldKeepFirstAssignment() {
        final LookupIndex index = LookupIndex.empty();

        assertTrue(index.putFileIfAbsent("https://esm.sh/b", "b.js"));
        assertFalse(index.putFileIfAbsent("https://esm.sh/b", "other.js"));
        index.putFileIfAbsent("https://esm.sh/a", "b.js");

        assertEquals(Optional.of("b.js"), index.fileFor("https://esm.sh/b"));
        assertEquals(Optional.of("https://esm.sh/a"), index.urlForFile("b.js"));

        index.removeUrl("https://esm.sh/a");
        assertEquals(Optional.of("https://esm.sh/b"), index.urlForFile("b.js"));
        assertTrue(index.urlForFile("missing.js").isEmpty());
    }

    // -- relativeImports ---

    @Test
    void whenMergingRelativeImports_givenSameKeyTwice_shouldUnionTrees() {
        final LookupIndex index = LookupIndex.empty();
        final DepKey key = DepKey.of("lib", "1.0.0", PeerContext.empty());
        final PathNode.Branch first = new PathNode.Branch();
        first.set(List.of("a.mjs"), "https://esm.sh/lib@1.0.0/a.mjs");
        final PathNode.Branch second = new PathNode.Branch();
        second.set(List.of("b.mjs"), "https://esm.sh/lib@1.0.0/b.mjs");

        index.mergeRelativeImports(key, first);
        index.mergeRelativeImports(key, second);

        assertEquals(1, index.relativeImportKeyCount());
        assertEquals(2, index.relativeImports(key).orElseThrow().leafCount());
    }

    // -- codec ---

    @Test
    void whenSerializing_givenSampleIndex_shouldRestoreEverySection() {
        final LookupIndex index = sample();

        final LookupIndex restored = LookupIndex.fromJson(index.toJson());

        assertEquals(index.packages(), restored.packages());
        final AnalyzedDependency motion = restored.packages().get(1);
        assertEquals(REACT_19, motion.getPeerContext());
        assertEquals(1, motion.getDepth());
        assertTrue(motion.isDownloaded());
        assertFalse(motion.isTransformed());
        assertEquals(Map.of("react", "^18.0.0 || ^19.0.0"),
                motion.getPeerDependencies());
        assertEquals(index.urlToFile(), restored.urlToFile());
        assertEquals(Optional.of("https://esm.sh/lib@1.0.0/client.mjs"),
                restored.relativeImports(new DepKey("lib@1.0.0"))
                        .orElseThrow().get(List.of("client")));
        assertEquals(Optional.of("https://esm.sh/lib@1.0.0/client/x.mjs"),
                restored.relativeImports(new DepKey("lib@1.0.0"))
                        .orElseThrow().get(List.of("client", "x.mjs")));
        assertEquals(List.of("19.2.0", "18.3.1"),
                restored.availableVersions().get("react"));
        assertEquals(List.of(new SubpathConfig("client", ">=18.0.0")),
                restored.standaloneSubpaths().get("react-dom"));
    }

    @Test
    void whenBuildingTree_givenBaseUnit_shouldOmitEmptySections() {
        final LookupIndex index = LookupIndex.empty();
        index.replacePackages(List.of(new AnalyzedDependency("react",
                "19.2.0", "https://esm.sh/react@19.2.0", PeerContext.empty(),
                Map.of())));

        final ObjectNode tree = index.toJsonTree();

        assertFalse(tree.has("standaloneSubpaths"));
        assertTrue(tree.has("urlToFile"));
        final ObjectNode unit = (ObjectNode) tree.get("packages").get(0);
        assertFalse(unit.has("peerContext"));
        assertFalse(unit.has("peerDependencies"));
        assertEquals("https://esm.sh/react@19.2.0", unit.get("url").asText());
        assertFalse(unit.get("downloaded").asBoolean());
    }

    @Test
    void whenParsing_givenMalformedJson_shouldFailWithIndexError() {
        final MirrorException e = assertThrows(MirrorException.class,
                () -> LookupIndex.fromJson("{not json"));
        assertEquals(ErrorCode.INDEX_IO, e.getErrorCode());

        final MirrorException array = assertThrows(MirrorException.class,
                () -> LookupIndex.fromJson("[]"));
        assertEquals(ErrorCode.INDEX_IO, array.getErrorCode());
    }

    @Test
    void whenParsing_givenEmptyObject_shouldReturnEmptyIndex() {
        final LookupIndex index = LookupIndex.fromJson("{}");

        assertTrue(index.packages().isEmpty());
        assertTrue(index.urlToFile().isEmpty());
        assertEquals(0, index.relativeImportKeyCount());
    }

    static LookupIndex sample() {
        final LookupIndex index = LookupIndex.empty();
        index.replacePackages(List.of(
                new AnalyzedDependency("react", "19.2.0",
                        "https://esm.sh/react@19.2.0", PeerContext.empty(),
                        Map.of(), 0, true, true),
                new AnalyzedDependency("framer-motion", "12.23.23",
                        "https://esm.sh/framer-motion@12.23.23", REACT_19,
                        Map.of("react", "^18.0.0 || ^19.0.0"), 1, true,
                        false)));
        index.putFileIfAbsent("https://esm.sh/react@19.2.0",
                "react@19.2.0_0123abcd.js");
        index.putFileIfAbsent("https://esm.sh/framer-motion@12.23.23"
                + "?react=19.2.0&react-dom=19.2.0",
                "framer-motion@12.23.23_react-19.2.0_react-dom-19.2.0"
                        + "_89abcdef.js");
        final PathNode.Branch tree = new PathNode.Branch();
        tree.set(List.of("client"), "https://esm.sh/lib@1.0.0/client.mjs");
        tree.set(List.of("client", "x.mjs"),
                "https://esm.sh/lib@1.0.0/client/x.mjs");
        index.mergeRelativeImports(new DepKey("lib@1.0.0"), tree);
        index.putAvailableVersions("react", List.of("19.2.0", "18.3.1"));
        index.setStandaloneSubpaths(Map.of("react-dom",
                List.of(new SubpathConfig("client", ">=18.0.0"))));
        return index;
    }

    static CdnMapping mapping() {
        return new CdnMapping(List.of(
                new PackageSpec("react", "https://esm.sh/react@{version}"),
                new PackageSpec("react-dom",
                        "https://esm.sh/react-dom@{version}"),
                new PackageSpec("framer-motion",
                        "https://esm.sh/framer-motion@{version}")),
                new SameVersionGroups(List.of(List.of("react", "react-dom"))),
                Map.of());
    }

}
