package co.fanki.cdnmirror.config;

import co.fanki.cdnmirror.catalog.domain.CdnMappingRepository;
import co.fanki.cdnmirror.catalog.domain.NpmRegistryClient;
import co.fanki.cdnmirror.catalog.domain.RegistryClient;
import co.fanki.cdnmirror.catalog.domain.VersionSelector;
import co.fanki.cdnmirror.fetch.domain.CdnUrls;
import co.fanki.cdnmirror.fetch.domain.ContentSource;
import co.fanki.cdnmirror.fetch.domain.HttpContentSource;
import co.fanki.cdnmirror.fetch.domain.ImportScanner;
import co.fanki.cdnmirror.fetch.domain.RetryPolicy;
import co.fanki.cdnmirror.index.domain.LookupIndexRepository;
import co.fanki.cdnmirror.mirror.domain.MirrorStore;
import co.fanki.cdnmirror.rewrite.domain.AbsoluteImportMatcher;
import co.fanki.cdnmirror.rewrite.domain.ImportRewriter;
import co.fanki.cdnmirror.rewrite.domain.RelativeImportMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the mirror's domain objects.
 *
 * <p>Domain classes stay free of Spring; this configuration reads the
 * {@code mirror.*} properties and builds them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class MirrorConfiguration {

    /**
     * Creates the HTTP client shared by the registry and the CDN.
     *
     * @param connectTimeoutMs the connect timeout in milliseconds
     * @param readTimeoutMs the read timeout in milliseconds
     * @return the client
     */
    @Bean
    public RestClient mirrorRestClient(
            @Value("${mirror.http.connect-timeout-ms:10000}")
            final int connectTimeoutMs,
            @Value("${mirror.http.read-timeout-ms:30000}")
            final int readTimeoutMs) {
        final SimpleClientHttpRequestFactory factory =
                new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return RestClient.builder().requestFactory(factory).build();
    }

    /**
     * Creates the retry policy for remote calls.
     *
     * @param maxAttempts the attempts per request, first one included
     * @param initialBackoffMs the wait before the first retry
     * @return the policy
     */
    @Bean
    public RetryPolicy retryPolicy(
            @Value("${mirror.fetch.max-attempts:3}") final int maxAttempts,
            @Value("${mirror.fetch.initial-backoff-ms:1000}")
            final long initialBackoffMs) {
        return new RetryPolicy(maxAttempts,
                Duration.ofMillis(initialBackoffMs));
    }

    /**
     * Creates the CDN URL helper.
     *
     * @param baseUrl the CDN origin
     * @return the helper
     */
    @Bean
    public CdnUrls cdnUrls(
            @Value("${mirror.cdn.base-url:https://esm.sh}")
            final String baseUrl) {
        return new CdnUrls(baseUrl);
    }

    /**
     * Creates the CDN content source.
     *
     * @param restClient the HTTP client
     * @param retryPolicy the retry policy
     * @return the content source
     */
    @Bean
    public ContentSource contentSource(final RestClient restClient,
            final RetryPolicy retryPolicy) {
        return new HttpContentSource(restClient, retryPolicy);
    }

    /**
     * Creates the registry client.
     *
     * @param restClient the HTTP client
     * @param baseUrl the registry base URL
     * @param retryPolicy the retry policy
     * @return the registry client
     */
    @Bean
    public RegistryClient registryClient(final RestClient restClient,
            @Value("${mirror.registry.base-url:https://registry.npmjs.org}")
            final String baseUrl,
            final RetryPolicy retryPolicy) {
        return new NpmRegistryClient(restClient, baseUrl, retryPolicy);
    }

    /**
     * Creates the version selector.
     *
     * @param contentSource the CDN, probed for every candidate
     * @param majorLines the major lines to keep
     * @param minorLines the minor lines to keep per major line
     * @return the selector
     */
    @Bean
    public VersionSelector versionSelector(final ContentSource contentSource,
            @Value("${mirror.versions.major-lines:3}") final int majorLines,
            @Value("${mirror.versions.minor-lines:3}") final int minorLines) {
        return new VersionSelector(contentSource, majorLines, minorLines);
    }

    /**
     * Creates the CDN mapping repository.
     *
     * @param mappingFile the mapping file
     * @return the repository
     */
    @Bean
    public CdnMappingRepository cdnMappingRepository(
            @Value("${mirror.mapping-file:./cdn-mappings.json}")
            final String mappingFile) {
        return new CdnMappingRepository(Path.of(mappingFile));
    }

    /**
     * Creates the lookup index repository.
     *
     * @param indexFile the index file
     * @return the repository
     */
    @Bean
    public LookupIndexRepository lookupIndexRepository(
            @Value("${mirror.index-file:./dependencies/index.lookup.json}")
            final String indexFile) {
        return new LookupIndexRepository(Path.of(indexFile));
    }

    /**
     * Creates the mirror directory.
     *
     * @param outputDir the directory
     * @return the store
     */
    @Bean
    public MirrorStore mirrorStore(
            @Value("${mirror.output-dir:./dependencies}")
            final String outputDir) {
        return new MirrorStore(Path.of(outputDir));
    }

    /**
     * Creates the import scanner.
     *
     * @return the scanner
     */
    @Bean
    public ImportScanner importScanner() {
        return new ImportScanner();
    }

    /**
     * Creates the relative-import mapper.
     *
     * @param scanner the import scanner
     * @param cdnUrls the CDN URL helper
     * @return the mapper
     */
    @Bean
    public RelativeImportMapper relativeImportMapper(
            final ImportScanner scanner, final CdnUrls cdnUrls) {
        return new RelativeImportMapper(scanner, cdnUrls);
    }

    /**
     * Creates the import rewriter.
     *
     * @param scanner the import scanner
     * @param cdnUrls the CDN URL helper
     * @param importPrefix the path mirrored files are served from
     * @return the rewriter
     */
    @Bean
    public ImportRewriter importRewriter(final ImportScanner scanner,
            final CdnUrls cdnUrls,
            @Value("${mirror.rewrite.import-prefix:/dependencies/}")
            final String importPrefix) {
        return new ImportRewriter(scanner, cdnUrls,
                new AbsoluteImportMatcher(cdnUrls), importPrefix);
    }

}
