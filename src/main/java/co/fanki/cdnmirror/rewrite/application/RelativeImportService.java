package co.fanki.cdnmirror.rewrite.application;

import co.fanki.cdnmirror.catalog.domain.CdnMapping;
import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.index.domain.IndexLock;
import co.fanki.cdnmirror.index.domain.LookupIndex;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.rewrite.domain.RelativeImportMapper;
import org.springframework.stereotype.Service;

/**
 * Runs the relative-import mapping stage over the mirror directory.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class RelativeImportService {

    private final LookupIndexRepository indexRepository;
    private final CdnMappingRepository mappingRepository;
    private final MirrorStore mirrorStore;
    private final RelativeImportMapper mapper;

    /**
     * Creates a new RelativeImportService.
     *
     * @param theIndexRepository the lookup index repository
     * @param theMappingRepository the CDN mapping repository
     * @param theMirrorStore the mirror directory
     * @param theMapper the relative-import mapper
     */
    public RelativeImportService(
            final LookupIndexRepository theIndexRepository,
            final CdnMappingRepository theMappingRepository,
            final MirrorStore theMirrorStore,
            final RelativeImportMapper theMapper) {
        this.indexRepository = theIndexRepository;
        this.mappingRepository = theMappingRepository;
        this.mirrorStore = theMirrorStore;
        this.mapper = theMapper;
    }

    /**
     * Maps the relative imports of every mirrored file and saves the
     * index.
     *
     * @return the number of relative imports recorded
     */
    public int mapRelativeImports() {
        try (IndexLock lock = indexRepository.acquireLock()) {
            final CdnMapping mapping = mappingRepository.load();
            final LookupIndex index = indexRepository.load();
            final int mapped = mapper.map(index, mirrorStore, mapping);
            indexRepository.save(index);
            return mapped;
        }
    }

}
