package co.fanki.cdnmirror.rewrite.application;

import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.index.domain.IndexLock;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.rewrite.domain.ImportRewriter;
import org.springframework.stereotype.Service;

/**
 * Runs the import rewriting stage over the mirror directory.
 *
 * <p>The index is saved only when every file was rewritten; a failed
 * import leaves the transformed flags of the previous run in place.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ImportRewriteService {

    private final LookupIndexRepository indexRepository;
    private final CdnMappingRepository mappingRepository;
    private final MirrorStore mirrorStore;
    private final ImportRewriter rewriter;

    /**
     * Creates a new ImportRewriteService.
     *
     * @param theIndexRepository the lookup index repository
     * @param theMappingRepository the CDN mapping repository
     * @param theMirrorStore the mirror directory
     * @param theRewriter the import rewriter
     */
    public ImportRewriteService(
            final LookupIndexRepository theIndexRepository,
            final CdnMappingRepository theMappingRepository,
            final MirrorStore theMirrorStore,
            final ImportRewriter theRewriter) {
        this.indexRepository = theIndexRepository;
        this.mappingRepository = theMappingRepository;
        this.mirrorStore = theMirrorStore;
        this.rewriter = theRewriter;
    }

    /**
     * Rewrites the imports of the mirror and saves the index.
     *
     * @return what the run did
     */
    public ImportRewriter.Summary rewriteImports() {
        try (IndexLock lock = indexRepository.acquireLock()) {
            final CdnMapping mapping = mappingRepository.load();
            final LookupIndex index = indexRepository.load();
            final ImportRewriter.Summary summary = rewriter.rewrite(index,
                    mirrorStore, mapping);
            indexRepository.save(index);
            return summary;
        }
    }

}
