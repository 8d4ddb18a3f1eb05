package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

/**
 * {@link ContentSource} over Spring's {@link RestClient}.
 *
 * <p>Every request goes through the {@link RetryPolicy}. URLs are passed
 * as {@link URI}s built from the raw text, so peer-context queries reach
 * the CDN exactly as written; only characters a URI cannot carry, such
 * as the caret of a version range, are percent-encoded.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class HttpContentSource implements ContentSource {

    private static final Logger LOG = LoggerFactory.getLogger(
            HttpContentSource.class);

    private final RestClient restClient;

    private final RetryPolicy retryPolicy;

    /**
     * Creates a new content source.
     *
     * @param theRestClient the HTTP client
     * @param theRetryPolicy the retry policy
     */
    public HttpContentSource(final RestClient theRestClient,
            final RetryPolicy theRetryPolicy) {
        this.restClient = Preconditions.requireNonNull(theRestClient,
                "Rest client is required");
        this.retryPolicy = Preconditions.requireNonNull(theRetryPolicy,
                "Retry policy is required");
    }

    @Override
    public String get(final String url) {
        return retryPolicy.execute(url, () -> {
            try {
                final String body = restClient.get()
                        .uri(toUri(url))
                        .retrieve()
                        .body(String.class);
                LOG.debug("Fetched {} ({} chars)", url,
                        body == null ? 0 : body.length());
                return body == null ? "" : body;
            } catch (final RestClientException e) {
                throw HttpFailures.classify(url, e);
            }
        });
    }

    @Override
    public boolean exists(final String url) {
        try {
            return retryPolicy.execute("HEAD " + url, () -> {
                try {
                    restClient.head()
                            .uri(toUri(url))
                            .retrieve()
                            .toBodilessEntity();
                    return true;
                } catch (final RestClientException e) {
                    throw HttpFailures.classify(url, e);
                }
            });
        } catch (final FetchException e) {
            if (e.getKind() == FetchException.Kind.NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    private static URI toUri(final String url) {
        try {
            return URI.create(url.replace("^", "%5E").replace("|", "%7C")
                    .replace(" ", "%20"));
        } catch (final IllegalArgumentException e) {
            throw new FetchException(FetchException.Kind.REJECTED, url,
                    "Malformed URL", e);
        }
    }

}
