package co.fanki.cdnmirror.fetch.domain;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps Spring HTTP client failures onto {@link FetchException} kinds.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class HttpFailures {

    private HttpFailures() {
    }

    /**
     * Classifies a failed request.
     *
     * <p>I/O failures (timeouts, resets, refused connections, unknown
     * hosts) and 5xx responses are transient, 404 is not-found and every
     * other response status is rejected.</p>
     *
     * @param url the requested URL
     * @param failure the client failure
     * @return the classified exception
     */
    public static FetchException classify(final String url,
            final RestClientException failure) {
        if (failure instanceof ResourceAccessException) {
            return new FetchException(FetchException.Kind.TRANSIENT, url,
                    "I/O failure: " + failure.getMessage(), failure);
        }
        if (failure instanceof RestClientResponseException response) {
            return classify(url, response.getStatusCode(), failure);
        }
        return new FetchException(FetchException.Kind.REJECTED, url,
                "Request failed: " + failure.getMessage(), failure);
    }

    /**
     * Classifies a response status.
     *
     * @param url the requested URL
     * @param status the response status
     * @param cause the originating failure, may be null
     * @return the classified exception
     */
    public static FetchException classify(final String url,
            final HttpStatusCode status, final Throwable cause) {
        if (status.is5xxServerError()) {
            return new FetchException(FetchException.Kind.TRANSIENT, url,
                    "Server error " + status.value(), cause);
        }
        if (status.value() == 404) {
            return new FetchException(FetchException.Kind.NOT_FOUND, url,
                    "Not found", cause);
        }
        return new FetchException(FetchException.Kind.REJECTED, url,
                "Rejected with status " + status.value(), cause);
    }

}
