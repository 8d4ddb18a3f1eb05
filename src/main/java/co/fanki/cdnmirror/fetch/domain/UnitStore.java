package co.fanki.cdnmirror.fetch.domain;

import java.util.List;
import java.util.Optional;

/**
 * The modules known to a run, keyed by their exact URL.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface UnitStore {

    /**
     * Looks up a module.
     *
     * @param url the exact URL, including any query
     * @return the module, empty if unknown
     */
    Optional<DependencyInfo> get(String url);

    /**
     * Stores a module unless its URL is already known.
     *
     * @param unit the module
     * @return true if stored, false if the URL was already present
     */
    boolean putIfAbsent(DependencyInfo unit);

    /**
     * Lists the URLs that share a base URL, in lexicographic order.
     *
     * @param baseUrl the URL without query
     * @return the base URL itself (if known) and every qualified variant
     */
    List<String> listByBaseUrl(String baseUrl);

}
