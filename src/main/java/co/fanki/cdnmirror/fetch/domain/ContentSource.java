package co.fanki.cdnmirror.fetch.domain;

/**
 * Reads module sources from the CDN.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ContentSource {

    /**
     * Downloads the content at a URL.
     *
     * @param url the absolute URL
     * @return the response body as text
     * @throws FetchException when the request fails after retries
     */
    String get(String url);

    /**
     * Probes whether a URL is servable without downloading its body.
     *
     * @param url the absolute URL
     * @return false if the CDN answers 404
     * @throws FetchException for any other failure after retries
     */
    boolean exists(String url);

}
