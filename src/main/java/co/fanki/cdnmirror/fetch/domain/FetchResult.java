package co.fanki.cdnmirror.fetch.domain;

import java.util.List;

/**
 * The outcome of fetching one module tree.
 *
 * @param root the requested module
 * @param fetched every module downloaded by this call, root included when
 *        it was not cached; modules already known to the run are not
 *        repeated
 * @param failedUrls nested URLs that could not be fetched
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FetchResult(
        DependencyInfo root,
        List<DependencyInfo> fetched,
        List<String> failedUrls) {

    /**
     * Copies the lists.
     *
     * @param root the root module
     * @param fetched the fetched modules
     * @param failedUrls the failed nested URLs
     */
    public FetchResult {
        fetched = List.copyOf(fetched);
        failedUrls = List.copyOf(failedUrls);
    }

}
