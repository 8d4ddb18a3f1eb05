package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ContentFetcher.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ContentFetcherTest {

    private static final ImportScanner SCANNER = new ImportScanner();

    private static final String APP = "https://esm.sh/app@1.0.0";
    private static final String DEP = "https://esm.sh/dep@2.0.0/es2022/dep.mjs";
    private static final String UTIL =
            "https://esm.sh/dep@2.0.0/es2022/util.mjs";
    private static final String LIB = "https://esm.sh/lib@3.0.0";

    private ContentSource source;

    private InMemoryUnitStore store;

    private ContentFetcher fetcher;

    @BeforeEach
    void setUp() {
        source = mock(ContentSource.class);
        store = new InMemoryUnitStore();
        fetcher = new ContentFetcher(source, SCANNER,
                new CdnUrls("https://esm.sh"), store, 4);

        when(source.get(APP)).thenReturn("import \"/dep@2.0.0/es2022/dep.mjs\";"
                + "\nexport * from \"/lib@3.0.0\";");
        when(source.get(DEP)).thenReturn("import \"./util.mjs\";"
                + "\nimport \"https://other.cdn/x.js\";");
        when(source.get(UTIL)).thenReturn("export const u = 1;");
        when(source.get(LIB)).thenReturn("export const x = 1;");
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
    }

    @Test
    void whenFetching_givenModuleTree_shouldDownloadEveryCdnImport() {
        final FetchResult result = fetcher.fetch(APP);

        assertEquals(APP, result.root().url());
        assertEquals("app", result.root().name());
        assertFalse(result.root().leaf());
        assertEquals(List.of(DEP, LIB), result.root().imports());
        assertEquals(4, result.fetched().size());
        assertTrue(result.failedUrls().isEmpty());
        assertTrue(store.get(UTIL).isPresent());
        assertTrue(store.get(UTIL).get().leaf());
        verify(source, never()).get("https://other.cdn/x.js");
    }

    @Test
    void whenFetching_givenNestedFailure_shouldDropOnlyThatBranch() {
        when(source.get(LIB)).thenThrow(new FetchException(
                FetchException.Kind.NOT_FOUND, LIB, "Not found", null));

        final FetchResult result = fetcher.fetch(APP);

        assertEquals(List.of(LIB), result.failedUrls());
        assertEquals(3, result.fetched().size());
        assertTrue(store.get(LIB).isEmpty());
    }

    @Test
    void whenFetching_givenRootFailure_shouldPropagate() {
        when(source.get(anyString())).thenThrow(new FetchException(
                FetchException.Kind.TRANSIENT, APP, "Server error 503",
                null));

        final FetchException e = assertThrows(FetchException.class,
                () -> fetcher.fetch(APP));

        assertEquals(FetchException.Kind.TRANSIENT, e.getKind());
        assertEquals(0, store.size());
    }

    @Test
    void whenFetching_givenUnparseableModule_shouldFailStructurally() {
        when(source.get(UTIL)).thenReturn("import x from");

        final MirrorException e = assertThrows(MirrorException.class,
                () -> fetcher.fetch(APP));

        assertEquals(ErrorCode.STRUCTURAL_INCONSISTENCY, e.getErrorCode());
        assertTrue(store.get(UTIL).isEmpty());
    }

    @Test
    void whenFetching_givenKnownUrls_shouldNotDownloadTwice() {
        final FetchResult first = fetcher.fetch(APP);
        final FetchResult again = fetcher.fetch(APP);
        final FetchResult nested = fetcher.fetch(DEP);

        assertSame(first.root(), again.root());
        assertTrue(again.fetched().isEmpty());
        assertTrue(nested.fetched().isEmpty());
        verify(source, times(1)).get(APP);
        verify(source, times(1)).get(DEP);
        verify(source, times(1)).get(UTIL);
    }

    @Test
    void whenConvertingContent_givenUnversionedUrl_shouldIdentifyLatest() {
        final DependencyInfo unit = fetcher.toUnit(
                "https://esm.sh/react/jsx-runtime", "import 'react';");

        assertEquals("react", unit.name());
        assertEquals(CdnUrls.UNVERSIONED, unit.version());
        assertTrue(unit.imports().isEmpty());
        assertTrue(unit.leaf());
        assertTrue(unit.peerContext().isEmpty());
    }

    @AfterAll
    static void closeScanner() {
        SCANNER.close();
    }

}
