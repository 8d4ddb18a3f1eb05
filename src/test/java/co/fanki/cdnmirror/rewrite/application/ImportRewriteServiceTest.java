package co.fanki.cdnmirror.rewrite.application;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.analysis.domain.PeerScope;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.catalog.domain.PackageSpec;
import co.fanki.cdnmirror.catalog.domain.SameVersionGroups;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.DependencyInfo;
import co.fanki.cdnmirror.fetch.domain.ImportScanner;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.rewrite.domain.AbsoluteImportMatcher;
import co.fanki.cdnmirror.rewrite.domain.ImportRewriter;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ImportRewriteService.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportRewriteServiceTest {

    private static final ImportScanner SCANNER = new ImportScanner();

    private static final String REACT = "https://esm.sh/react@19.2.0";
    private static final String REACT_DIST =
            "https://esm.sh/react@19.2.0/es2022/react.mjs";

    @TempDir
    Path tempDir;

    private LookupIndexRepository indexRepository;

    private MirrorStore store;

    private ImportRewriteService service;

    private String rootFile;

    private String distFile;

    @BeforeEach
    void setUp() {
        final CdnMapping mapping = new CdnMapping(List.of(
                new PackageSpec("react", "https://esm.sh/react@{version}")),
                SameVersionGroups.none(), Map.of());
        indexRepository = new LookupIndexRepository(
                tempDir.resolve("cdn-lookup.json"));
        store = new MirrorStore(tempDir.resolve("dependencies"));
        final CdnMappingRepository mappingRepository =
                mock(CdnMappingRepository.class);
        when(mappingRepository.load()).thenReturn(mapping);
        final CdnUrls cdnUrls = new CdnUrls("https://esm.sh");
        service = new ImportRewriteService(indexRepository, mappingRepository,
                store, new ImportRewriter(SCANNER, cdnUrls,
                        new AbsoluteImportMatcher(cdnUrls), "/dependencies/"));

        final PeerScope scope = new PeerScope(mapping);
        final LookupIndex index = LookupIndex.empty();
        index.replacePackages(List.of(new AnalyzedDependency("react",
                "19.2.0", REACT, PeerContext.empty(), Map.of(), 0, true,
                false)));
        rootFile = store.save(new DependencyInfo("react", "19.2.0", REACT,
                "export * from \"/react@19.2.0/es2022/react.mjs\";",
                List.of(), true, PeerContext.empty()), index, scope)
                .orElseThrow();
        distFile = store.save(new DependencyInfo("react", "19.2.0",
                REACT_DIST, "export default {};", List.of(), true,
                PeerContext.empty()), index, scope).orElseThrow();
        indexRepository.save(index);
    }

    @Test
    void whenRewriting_givenMirroredImports_shouldSaveTransformedFlags() {
        final ImportRewriter.Summary summary = service.rewriteImports();

        assertEquals(1, summary.replacements());
        assertEquals(1, summary.transformed());
        assertEquals("export * from \"/dependencies/" + distFile + "\";",
                store.read(rootFile));
        assertTrue(indexRepository.load().packages().get(0).isTransformed());
    }

    @Test
    void whenRewriting_givenSecondRun_shouldSkipEveryFile() {
        service.rewriteImports();

        final ImportRewriter.Summary again = service.rewriteImports();

        assertEquals(0, again.replacements());
        assertEquals(2, again.skipped());
        assertFalse(store.read(rootFile).contains("esm.sh"));
    }

    @AfterAll
    static void closeScanner() {
        SCANNER.close();
    }

}
