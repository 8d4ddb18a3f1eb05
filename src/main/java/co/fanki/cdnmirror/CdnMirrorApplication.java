package co.fanki.cdnmirror;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CDN Mirror Application.
 *
 * <p>Builds a local mirror of CDN-served ES modules: selects the package
 * versions to support, expands their peer-dependency permutations,
 * downloads every module graph and rewrites the imports to point at the
 * local files.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class CdnMirrorApplication {

    /**
     * Main entry point for the application.
     *
     * @param args the stages to run, {@code all} if none
     */
    public static void main(final String[] args) {
        SpringApplication.run(CdnMirrorApplication.class, args);
    }

}
