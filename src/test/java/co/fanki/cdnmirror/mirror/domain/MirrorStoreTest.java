package co.fanki.cdnmirror.mirror.domain;

import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.PackageSpec;
import co.fanki.cdnmirror.catalog.domain.SameVersionGroups;
import co.fanki.cdnmirror.fetch.domain.DependencyInfo;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.MirrorFilename;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for MirrorStore.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MirrorStoreTest {

    private static final PeerContext REACT_19 = PeerContext.of(Map.of(
            "react", "19.2.0", "react-dom", "19.2.0"));

    @TempDir
    Path tempDir;

    private MirrorStore store;

    private LookupIndex index;

    private final PeerScope scope = new PeerScope(mapping());

    @BeforeEach
    void setUp() {
        store = new MirrorStore(tempDir.resolve("dependencies"));
        index = LookupIndex.empty();
    }

    // -- save ---

    @Test
    void whenSaving_givenBaseModule_shouldWriteFileAndMapUrl() {
        final String url = "https://esm.sh/react@19.2.0";

        final Optional<String> saved = store.save(module("react", url,
                PeerContext.empty()), index, scope);

        final String expected = "react@19.2.0_" + MirrorFilename.hashOf(url)
                + ".js";
        assertEquals(Optional.of(expected), saved);
        assertEquals(Optional.of(expected), index.fileFor(url));
        assertEquals("export default 1;", store.read(expected));
    }

    @Test
    void whenSaving_givenSameKeyTwice_shouldKeepFirstFile() {
        final String url = "https://esm.sh/react@19.2.0";
        store.save(module("react", url, PeerContext.empty()), index, scope);

        assertTrue(store.save(module("react", url, PeerContext.empty()),
                index, scope).isEmpty());
        assertEquals(1, store.listModuleFiles().size());
    }

    @Test
    void whenSaving_givenGroupMemberCopy_shouldShareBaseFile() {
        final String url = "https://esm.sh/react-dom@19.2.0";
        store.save(module("react-dom", url, PeerContext.empty()), index,
                scope);

        final Optional<String> copy = store.save(module("react-dom",
                url + "?react=19.2.0&react-dom=19.2.0", REACT_19), index,
                scope);

        assertTrue(copy.isEmpty());
        assertEquals(1, index.urlToFile().size());
    }

    @Test
    void whenSaving_givenDependentCopy_shouldQualifyKeyAndFilename() {
        final String base = "https://esm.sh/framer-motion@12.23.23";
        final String url = base + "?react=19.2.0&react-dom=19.2.0";

        final String filename = store.save(module("framer-motion", url,
                REACT_19), index, scope).orElseThrow();

        assertTrue(filename.startsWith("framer-motion@12.23.23_react-19.2.0"
                + "_react-dom-19.2.0_"));
        assertEquals(Optional.of(filename), index.fileFor(url));
        assertTrue(index.fileFor(base).isEmpty());
        assertEquals(url, MirrorStore.indexKey(url + "&extra=1",
                REACT_19));
    }

    // -- files ---

    @Test
    void whenListing_givenMixedFiles_shouldReturnSortedModules()
            throws Exception {
        assertTrue(store.listModuleFiles().isEmpty());
        store.write("b@1.0.0_0123abcd.js", "b");
        store.write("a@1.0.0_0123abcd.js", "a");
        Files.writeString(store.getOutputDir().resolve("notes.txt"), "x");

        assertEquals(List.of("a@1.0.0_0123abcd.js", "b@1.0.0_0123abcd.js"),
                store.listModuleFiles());
        assertTrue(store.exists("a@1.0.0_0123abcd.js"));
        assertTrue(store.delete("a@1.0.0_0123abcd.js"));
        assertFalse(store.delete("a@1.0.0_0123abcd.js"));
    }

    @Test
    void whenResolving_givenPathTraversal_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> store.write("../escape.js", "x"));
        assertThrows(IllegalArgumentException.class,
                () -> store.read(".."));
    }

    private static DependencyInfo module(final String name, final String url,
            final PeerContext context) {
        final String version = name.equals("framer-motion")
                ? "12.23.23" : "19.2.0";
        return new DependencyInfo(name, version, url, "export default 1;",
                List.of(), true, context);
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
