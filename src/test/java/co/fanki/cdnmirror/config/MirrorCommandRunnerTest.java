package co.fanki.cdnmirror.config;

import co.fanki.cdnmirror.analysis.application.DependencyAnalysisService;
import co.fanki.cdnmirror.config.MirrorCommandRunner.Stage;
import co.fanki.cdnmirror.mirror.application.ExportService;
import co.fanki.cdnmirror.mirror.application.MirrorDownloadService;
import co.fanki.cdnmirror.rewrite.application.ImportRewriteService;
import co.fanki.cdnmirror.rewrite.application.RelativeImportService;
import co.fanki.cdnmirror.shared.MirrorConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for MirrorCommandRunner.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class MirrorCommandRunnerTest {

    private DependencyAnalysisService analysisService;
    private MirrorDownloadService downloadService;
    private RelativeImportService relativeImportService;
    private ImportRewriteService importRewriteService;
    private ExportService exportService;

    private MirrorCommandRunner runner;

    @BeforeEach
    void setUp() {
        analysisService = mock(DependencyAnalysisService.class);
        downloadService = mock(MirrorDownloadService.class);
        relativeImportService = mock(RelativeImportService.class);
        importRewriteService = mock(ImportRewriteService.class);
        exportService = mock(ExportService.class);
        runner = new MirrorCommandRunner(analysisService, downloadService,
                relativeImportService, importRewriteService, exportService);
    }

    // -- parse ---

    @Test
    void whenParsing_givenNoArguments_shouldRunEveryStage() {
        assertEquals(List.of(Stage.values()), MirrorCommandRunner.parse());
    }

    @Test
    void whenParsing_givenOnlyOptions_shouldRunEveryStage() {
        assertEquals(List.of(Stage.values()), MirrorCommandRunner.parse(
                "--mirror.index-file=/tmp/cdn-lookup.json"));
    }

    @Test
    void whenParsing_givenStageNames_shouldKeepTheirOrder() {
        assertEquals(List.of(Stage.REWRITE, Stage.MAP_IMPORTS),
                MirrorCommandRunner.parse("Rewrite", "--debug",
                        "map-imports"));
    }

    @Test
    void whenParsing_givenAll_shouldExpandToEveryStage() {
        assertEquals(List.of(Stage.values()),
                MirrorCommandRunner.parse("all"));
    }

    @Test
    void whenParsing_givenUnknownStage_shouldFail() {
        final MirrorConfigurationException e = assertThrows(
                MirrorConfigurationException.class,
                () -> MirrorCommandRunner.parse("deploy"));

        assertTrue(e.getMessage().contains("deploy"));
    }

    // -- run ---

    @Test
    void whenRunning_givenNoArguments_shouldRunStagesInPipelineOrder() {
        runner.run();

        final InOrder order = inOrder(analysisService, downloadService,
                relativeImportService, importRewriteService, exportService);
        order.verify(analysisService).analyze();
        order.verify(downloadService).download();
        order.verify(relativeImportService).mapRelativeImports();
        order.verify(importRewriteService).rewriteImports();
        order.verify(exportService).export();
    }

    @Test
    void whenRunning_givenSingleStage_shouldRunOnlyThatStage() {
        runner.run("download");

        verify(downloadService).download();
        verify(analysisService, never()).analyze();
        verify(exportService, never()).export();
    }

}
