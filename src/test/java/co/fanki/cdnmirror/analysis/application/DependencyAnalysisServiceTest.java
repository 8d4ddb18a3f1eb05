package co.fanki.cdnmirror.analysis.application;

import co.fanki.cdnmirror.analysis.domain.AnalyzedDependency;
import co.fanki.cdnmirror.analysis.domain.PeerContext;
import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.catalog.domain.PackageMetadata;
import co.fanki.cdnmirror.catalog.domain.PackageSpec;
import co.fanki.cdnmirror.catalog.domain.RegistryClient;
import co.fanki.cdnmirror.catalog.domain.SameVersionGroups;
import co.fanki.cdnmirror.catalog.domain.SubpathConfig;
import co.fanki.cdnmirror.catalog.domain.VersionSelector;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DependencyAnalysisService.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class DependencyAnalysisServiceTest {

    private static final String LIB_A_19 =
            "lib-a@1.0.0?react=19.2.0&react-dom=19.2.0";

    @TempDir
    Path tempDir;

    private LookupIndexRepository indexRepository;

    private RegistryClient registryClient;

    private DependencyAnalysisService service;

    @BeforeEach
    void setUp() {
        indexRepository = new LookupIndexRepository(
                tempDir.resolve("cdn-lookup.json"));
        final CdnMappingRepository mappingRepository =
                mock(CdnMappingRepository.class);
        when(mappingRepository.load()).thenReturn(mapping());
        registryClient = mock(RegistryClient.class);
        final VersionSelector versionSelector = mock(VersionSelector.class);
        when(versionSelector.select(any(PackageSpec.class),
                any(PackageMetadata.class))).thenAnswer(invocation ->
                        ((PackageMetadata) invocation.getArgument(1))
                                .versions());
        service = new DependencyAnalysisService(indexRepository,
                mappingRepository, registryClient, versionSelector);
    }

    @Test
    void whenAnalyzing_givenCatalog_shouldExpandEveryRelease() {
        stubRegistry(true);

        final DependencyAnalysisService.Summary summary = service.analyze();

        assertEquals(new DependencyAnalysisService.Summary(5, 0, 9, 9),
                summary);

        final LookupIndex index = indexRepository.load();
        final List<String> keys = keys(index);
        assertTrue(keys.contains("react@19.2.0"));
        assertTrue(keys.contains("react-dom/client@18.3.1"));
        assertTrue(keys.contains(LIB_A_19));
        assertTrue(keys.contains("lib-a@1.0.0?react=18.3.1&react-dom=18.3.1"));
        assertTrue(keys.contains("lib-b@2.0.0?lib-a=1.0.0"));
        assertEquals(List.of("19.2.0", "18.3.1"),
                index.availableVersions().get("react-dom/client"));
        assertEquals(List.of("client"), index.standaloneSubpaths()
                .get("react-dom").stream().map(SubpathConfig::name).toList());
    }

    @Test
    void whenAnalyzing_givenStandaloneSubpath_shouldFollowParentGate() {
        stubRegistry(true);
        when(registryClient.fetchMetadata("react-dom")).thenReturn(
                new PackageMetadata("react-dom", List.of("19.2.0", "17.0.2"),
                        Map.of(), "19.2.0"));

        service.analyze();

        final LookupIndex index = indexRepository.load();
        assertEquals(List.of("19.2.0"),
                index.availableVersions().get("react-dom/client"));
        assertTrue(keys(index).contains("react-dom@17.0.2"));
        assertFalse(keys(index).contains("react-dom/client@17.0.2"));
    }

    @Test
    void whenAnalyzing_givenRegistryFailure_shouldSkipAndReusePreviousVersions() {
        final LookupIndex previous = LookupIndex.empty();
        final AnalyzedDependency oldUnit = new AnalyzedDependency("lib-a",
                "1.0.0", "https://esm.sh/lib-a@1.0.0?react=19.2.0"
                        + "&react-dom=19.2.0",
                PeerContext.fromQuery("react=19.2.0&react-dom=19.2.0"),
                Map.of("react", ">=18.0.0", "react-dom", ">=18.0.0"),
                1, true, false);
        previous.replacePackages(List.of(oldUnit));
        previous.putAvailableVersions("lib-a", List.of("1.0.0"));
        indexRepository.save(previous);
        stubRegistry(false);

        final DependencyAnalysisService.Summary summary = service.analyze();

        assertEquals(new DependencyAnalysisService.Summary(4, 1, 7, 8),
                summary);

        final LookupIndex index = indexRepository.load();
        assertTrue(keys(index).contains("lib-b@2.0.0?lib-a=1.0.0"));
        assertTrue(index.packages().stream()
                .filter(unit -> unit.canonicalKey().equals(LIB_A_19))
                .allMatch(AnalyzedDependency::isDownloaded));
        assertEquals(List.of("1.0.0"), index.availableVersions().get("lib-a"));
    }

    @Test
    void whenAnalyzing_givenPreviousProgress_shouldKeepFlags() {
        stubRegistry(true);
        service.analyze();
        final LookupIndex index = indexRepository.load();
        index.packages().forEach(AnalyzedDependency::markDownloaded);
        indexRepository.save(index);

        final DependencyAnalysisService.Summary summary = service.analyze();

        assertEquals(9, summary.totalUnits());
        assertTrue(indexRepository.load().packages().stream()
                .allMatch(AnalyzedDependency::isDownloaded));
    }

    private void stubRegistry(final boolean libAAvailable) {
        when(registryClient.fetchMetadata("react")).thenReturn(
                new PackageMetadata("react", List.of("19.2.0", "18.3.1"),
                        Map.of(), "19.2.0"));
        when(registryClient.fetchMetadata("react-dom")).thenReturn(
                new PackageMetadata("react-dom", List.of("19.2.0", "18.3.1"),
                        Map.of("19.2.0", Map.of("react", "^19.2.0"),
                                "18.3.1", Map.of("react", "^18.3.1")),
                        "19.2.0"));
        if (libAAvailable) {
            when(registryClient.fetchMetadata("lib-a")).thenReturn(
                    new PackageMetadata("lib-a", List.of("1.0.0"),
                            Map.of("1.0.0", Map.of("react", ">=18.0.0",
                                    "react-dom", ">=18.0.0")),
                            "1.0.0"));
        } else {
            when(registryClient.fetchMetadata("lib-a")).thenThrow(
                    new MirrorException("Registry unavailable for lib-a",
                            ErrorCode.REGISTRY_UNAVAILABLE));
        }
        when(registryClient.fetchMetadata("lib-b")).thenReturn(
                new PackageMetadata("lib-b", List.of("2.0.0"),
                        Map.of("2.0.0", Map.of("lib-a", "^1.0.0")),
                        "2.0.0"));
    }

    private static List<String> keys(final LookupIndex index) {
        return index.packages().stream()
                .map(AnalyzedDependency::canonicalKey).toList();
    }

    private static CdnMapping mapping() {
        return new CdnMapping(List.of(
                new PackageSpec("react", "https://esm.sh/react@{version}"),
                new PackageSpec("react-dom",
                        "https://esm.sh/react-dom@{version}"),
                new PackageSpec("react-dom/client",
                        "https://esm.sh/react-dom@{version}/client"),
                new PackageSpec("lib-a", "https://esm.sh/lib-a@{version}"),
                new PackageSpec("lib-b", "https://esm.sh/lib-b@{version}")),
                new SameVersionGroups(List.of(List.of("react", "react-dom"))),
                Map.of("react-dom", List.of(
                        new SubpathConfig("client", ">=18.0.0"))));
    }

}
