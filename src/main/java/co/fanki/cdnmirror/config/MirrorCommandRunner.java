package co.fanki.cdnmirror.config;

import co.fanki.cdnmirror.analysis.application.DependencyAnalysisService;
import co.fanki.cdnmirror.mirror.application.ExportService;
import co.fanki.cdnmirror.mirror.application.MirrorDownloadService;
import co.fanki.cdnmirror.rewrite.application.ImportRewriteService;
import co.fanki.cdnmirror.rewrite.application.RelativeImportService;
import co.fanki.cdnmirror.shared.MirrorConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Runs the pipeline stages named on the command line.
 *
 * <p>Stages: {@code analyze}, {@code download}, {@code map-imports},
 * {@code rewrite}, {@code export}, or {@code all} for every stage in
 * that order. No argument means {@code all}. Options starting with
 * {@code --} are Spring properties and are ignored here.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class MirrorCommandRunner implements CommandLineRunner {

    private static final Logger LOG = LoggerFactory.getLogger(
            MirrorCommandRunner.class);

    /** A step of the pipeline. */
    public enum Stage {

        /** Version selection, permutations and dependency graph. */
        ANALYZE("analyze"),

        /** Module download and peer-context replication. */
        DOWNLOAD("download"),

        /** Relative-import trees. */
        MAP_IMPORTS("map-imports"),

        /** Import rewriting. */
        REWRITE("rewrite"),

        /** Available versions export. */
        EXPORT("export");

        private final String command;

        Stage(final String theCommand) {
            this.command = theCommand;
        }

        /** @return the name used on the command line */
        public String command() {
            return command;
        }
    }

    private final DependencyAnalysisService analysisService;
    private final MirrorDownloadService downloadService;
    private final RelativeImportService relativeImportService;
    private final ImportRewriteService importRewriteService;
    private final ExportService exportService;

    /**
     * Creates a new MirrorCommandRunner.
     *
     * @param theAnalysisService the analysis stage
     * @param theDownloadService the download stage
     * @param theRelativeImportService the relative-import mapping stage
     * @param theImportRewriteService the rewrite stage
     * @param theExportService the export stage
     */
    public MirrorCommandRunner(
            final DependencyAnalysisService theAnalysisService,
            final MirrorDownloadService theDownloadService,
            final RelativeImportService theRelativeImportService,
            final ImportRewriteService theImportRewriteService,
            final ExportService theExportService) {
        this.analysisService = theAnalysisService;
        this.downloadService = theDownloadService;
        this.relativeImportService = theRelativeImportService;
        this.importRewriteService = theImportRewriteService;
        this.exportService = theExportService;
    }

    @Override
    public void run(final String... args) {
        final List<Stage> stages = parse(args);
        LOG.info("Running stages {}", stages);
        for (final Stage stage : stages) {
            final long start = System.currentTimeMillis();
            execute(stage);
            LOG.info("Stage {} finished in {} ms", stage.command(),
                    System.currentTimeMillis() - start);
        }
    }

    /**
     * Parses the stage arguments.
     *
     * @param args the program arguments
     * @return the stages to run, in order
     * @throws MirrorConfigurationException for an unknown stage
     */
    static List<Stage> parse(final String... args) {
        final List<Stage> stages = new ArrayList<>();
        for (final String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            final String name = arg.trim().toLowerCase(Locale.ROOT);
            if ("all".equals(name)) {
                stages.addAll(Arrays.asList(Stage.values()));
                continue;
            }
            stages.add(Arrays.stream(Stage.values())
                    .filter(stage -> stage.command().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new MirrorConfigurationException(
                            "Unknown stage '" + arg + "', expected one of "
                                    + "analyze, download, map-imports,"
                                    + " rewrite, export, all")));
        }
        if (stages.isEmpty()) {
            stages.addAll(Arrays.asList(Stage.values()));
        }
        return stages;
    }

    private void execute(final Stage stage) {
        switch (stage) {
            case ANALYZE -> analysisService.analyze();
            case DOWNLOAD -> downloadService.download();
            case MAP_IMPORTS -> relativeImportService.mapRelativeImports();
            case REWRITE -> importRewriteService.rewriteImports();
            case EXPORT -> exportService.export();
            default -> throw new IllegalStateException("Unknown stage "
                    + stage);
        }
    }

}
