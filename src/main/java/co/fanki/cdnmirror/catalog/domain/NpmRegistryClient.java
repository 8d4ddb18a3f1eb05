package co.fanki.cdnmirror.catalog.domain;

import co.fanki.cdnmirror.fetch.domain.FetchException;
import co.fanki.cdnmirror.fetch.domain.HttpFailures;
import co.fanki.cdnmirror.fetch.domain.RetryPolicy;
import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RegistryClient} for the npm registry.
 *
 * <p>Reads the package document ({@code GET /<name>}) once per package;
 * it already lists every published version with its peer dependencies
 * and the dist-tags. Scoped names are requested with their slash
 * percent-encoded, as the registry expects.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class NpmRegistryClient implements RegistryClient {

    private static final Logger LOG = LoggerFactory.getLogger(
            NpmRegistryClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestClient restClient;

    private final String baseUrl;

    private final RetryPolicy retryPolicy;

    /**
     * Creates a new registry client.
     *
     * @param theRestClient the HTTP client
     * @param theBaseUrl the registry base URL, without trailing slash
     * @param theRetryPolicy the retry policy for transient failures
     */
    public NpmRegistryClient(final RestClient theRestClient,
            final String theBaseUrl, final RetryPolicy theRetryPolicy) {
        this.restClient = Preconditions.requireNonNull(theRestClient,
                "Rest client is required");
        Preconditions.requireNonBlank(theBaseUrl, "Registry URL is required");
        this.baseUrl = theBaseUrl.endsWith("/")
                ? theBaseUrl.substring(0, theBaseUrl.length() - 1)
                : theBaseUrl;
        this.retryPolicy = Preconditions.requireNonNull(theRetryPolicy,
                "Retry policy is required");
    }

    @Override
    public PackageMetadata fetchMetadata(final String packageName) {
        Preconditions.requireNonBlank(packageName, "Package name is required");
        final String url = baseUrl + "/" + packageName.replace("/", "%2F");

        final String body;
        try {
            body = retryPolicy.execute(url, () -> {
                try {
                    return restClient.get()
                            .uri(URI.create(url))
                            .retrieve()
                            .body(String.class);
                } catch (final RestClientException e) {
                    throw HttpFailures.classify(url, e);
                }
            });
        } catch (final FetchException e) {
            throw new MirrorException("Registry has no usable metadata for "
                    + packageName + ": " + e.getMessage(),
                    ErrorCode.REGISTRY_UNAVAILABLE, e);
        }

        if (body == null || body.isBlank()) {
            throw new MirrorException("Registry returned an empty document"
                    + " for " + packageName, ErrorCode.REGISTRY_UNAVAILABLE);
        }

        try {
            return parse(packageName, MAPPER.readTree(body));
        } catch (final JsonProcessingException e) {
            throw new MirrorException("Registry returned malformed JSON for "
                    + packageName, ErrorCode.REGISTRY_UNAVAILABLE, e);
        }
    }

    /**
     * Extracts versions, peer dependencies and the latest tag from a
     * registry package document.
     *
     * @param packageName the package name
     * @param document the parsed document
     * @return the metadata
     */
    static PackageMetadata parse(final String packageName,
            final JsonNode document) {
        final List<String> versions = new ArrayList<>();
        final Map<String, Map<String, String>> peers = new HashMap<>();

        final JsonNode versionsNode = document.get("versions");
        if (versionsNode != null && versionsNode.isObject()) {
            final var fields = versionsNode.fields();
            while (fields.hasNext()) {
                final var entry = fields.next();
                versions.add(entry.getKey());
                final JsonNode peerNode = entry.getValue()
                        .get("peerDependencies");
                if (peerNode != null && peerNode.isObject()) {
                    final Map<String, String> constraints =
                            new LinkedHashMap<>();
                    final var peerFields = peerNode.fields();
                    while (peerFields.hasNext()) {
                        final var peer = peerFields.next();
                        constraints.put(peer.getKey(), peer.getValue().asText());
                    }
                    peers.put(entry.getKey(), constraints);
                }
            }
        }

        String latest = null;
        final JsonNode tags = document.get("dist-tags");
        if (tags != null && tags.hasNonNull("latest")) {
            latest = tags.get("latest").asText();
        }

        LOG.debug("Registry lists {} versions of {} (latest {})",
                versions.size(), packageName, latest);
        return new PackageMetadata(packageName, versions, peers, latest);
    }

}
