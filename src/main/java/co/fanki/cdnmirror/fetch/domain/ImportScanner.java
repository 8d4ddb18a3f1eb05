package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import co.fanki.cdnmirror.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Extracts module specifiers from JavaScript source text.
 *
 * <p>Parses the source with Babel ({@code @babel/standalone}, loaded
 * from its webjar) inside a sandboxed GraalJS context and walks the
 * syntax tree, so import-like text inside string, template or regular
 * expression literals, comments or JSX text is never matched.
 * Recognized forms:</p>
 * <ul>
 *   <li>{@code import x from "m"}, {@code import {a, b as c} from "m"},
 *       {@code import * as ns from "m"}, {@code import type T from "m"}</li>
 *   <li>{@code import "m"}</li>
 *   <li>{@code import("m")} with a string literal argument</li>
 *   <li>{@code export * from "m"}, {@code export * as ns from "m"},
 *       {@code export {a} from "m"}</li>
 * </ul>
 *
 * <p>The source is parsed with the JSX and TypeScript parser plugins
 * first, then with JSX only, then as plain JavaScript. A source that
 * none of them accepts is a structural failure: its imports could not
 * be rewritten. Specifiers using the {@code data:}, {@code blob:} or
 * {@code chrome-extension:} schemes are ignored.</p>
 *
 * <p>A GraalJS context is single-threaded, so {@link #scan(String)} is
 * serialized. The Babel bundle is parsed once per JVM through a shared
 * engine; every scanner gets its own context. Call {@link #close()} when
 * done.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImportScanner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportScanner.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String BABEL_PROPERTIES =
            "META-INF/maven/org.webjars.npm/babel__standalone/pom.properties";

    private static final String BABEL_RESOURCE =
            "META-INF/resources/webjars/babel__standalone/%s/babel.min.js";

    private static final String EXTRACTOR_RESOURCE = "js/import-extractor.js";

    /** Polyfill for Node.js globals that Babel expects at runtime. */
    private static final String PROCESS_POLYFILL = """
            if (typeof globalThis.process === 'undefined') {
                globalThis.process = { env: {} };
            }
            if (typeof globalThis.console === 'undefined') {
                globalThis.console = {
                    log: function() {},
                    warn: function() {},
                    error: function() {}
                };
            }
            """;

    /** Parser plugin sets, tried in order until one accepts the source. */
    private static final List<String> PLUGIN_SETS = List.of(
            "[\"jsx\", \"typescript\", \"decorators-legacy\","
                    + " \"exportDefaultFrom\"]",
            "[\"jsx\", \"decorators-legacy\", \"exportDefaultFrom\"]",
            "[]");

    private static final List<String> IGNORED_SCHEMES = List.of(
            "data:", "blob:", "chrome-extension:");

    private static final Engine ENGINE = Engine.newBuilder()
            .option("engine.WarnInterpreterOnly", "false")
            .build();

    private static Source babelSource;

    private static Source extractorSource;

    private final Context context;

    private final Value extractFunction;

    /**
     * Creates a new scanner, loading Babel and the extractor script into
     * a fresh GraalJS context.
     *
     * @throws UncheckedIOException if a script cannot be read from the
     *         classpath
     */
    public ImportScanner() {
        this.context = Context.newBuilder("js")
                .engine(ENGINE)
                .allowExperimentalOptions(true)
                .option("js.ecmascript-version", "2022")
                .build();
        try {
            context.eval("js", PROCESS_POLYFILL);
            context.eval(babelSource());
            context.eval(extractorSource());
            this.extractFunction = context.getBindings("js")
                    .getMember("extractImports");
            if (extractFunction == null || !extractFunction.canExecute()) {
                throw new IllegalStateException(
                        "extractImports function not found in "
                                + EXTRACTOR_RESOURCE);
            }
        } catch (final RuntimeException e) {
            context.close();
            throw e;
        }
    }

    /**
     * Scans a module.
     *
     * @param source the source text
     * @return the imports in source order
     * @throws MirrorException with
     *         {@link ErrorCode#STRUCTURAL_INCONSISTENCY} if the source
     *         cannot be parsed
     */
    public synchronized ScannedModule scan(final String source) {
        if (source == null || source.isEmpty()) {
            return new ScannedModule(List.of());
        }
        PolyglotException lastFailure = null;
        for (final String plugins : PLUGIN_SETS) {
            try {
                final Value result = extractFunction.execute(source, plugins);
                return new ScannedModule(toSpecifiers(result.asString()));
            } catch (final PolyglotException e) {
                if (!e.isGuestException()) {
                    throw e;
                }
                LOG.debug("Babel rejected the source with plugins {}: {}",
                        plugins, e.getMessage());
                lastFailure = e;
            }
        }
        throw new MirrorException("Cannot parse module source: "
                + lastFailure.getMessage(),
                ErrorCode.STRUCTURAL_INCONSISTENCY, lastFailure);
    }

    /** {@inheritDoc} */
    @Override
    public void close() {
        context.close();
    }

    private static List<ImportSpecifier> toSpecifiers(final String json) {
        final JsonNode nodes;
        try {
            nodes = MAPPER.readTree(json);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Invalid extractor output: " + json, e);
        }
        final List<ImportSpecifier> found = new ArrayList<>();
        for (final JsonNode node : nodes) {
            final String value = node.get("value").asText();
            if (isIgnored(value)) {
                continue;
            }
            found.add(new ImportSpecifier(value,
                    ImportSpecifier.Kind.valueOf(node.get("kind").asText()),
                    node.get("start").asInt() + 1,
                    node.get("end").asInt() - 1));
        }
        return found;
    }

    private static boolean isIgnored(final String value) {
        if (value.isBlank()) {
            return true;
        }
        for (final String scheme : IGNORED_SCHEMES) {
            if (value.startsWith(scheme)) {
                return true;
            }
        }
        return false;
    }

    private static synchronized Source babelSource() {
        if (babelSource == null) {
            final String version = readProperties(BABEL_PROPERTIES)
                    .getProperty("version");
            Preconditions.requireNonBlank(version,
                    "No version in " + BABEL_PROPERTIES);
            final String resource = String.format(BABEL_RESOURCE, version);
            final String script = readResource(resource);
            LOG.info("Babel {} loaded ({} bytes)", version, script.length());
            babelSource = Source.newBuilder("js", script, "babel.min.js")
                    .cached(true)
                    .buildLiteral();
        }
        return babelSource;
    }

    private static synchronized Source extractorSource() {
        if (extractorSource == null) {
            extractorSource = Source.newBuilder("js",
                    readResource(EXTRACTOR_RESOURCE), "import-extractor.js")
                    .cached(true)
                    .buildLiteral();
        }
        return extractorSource;
    }

    private static Properties readProperties(final String resource) {
        final Properties properties = new Properties();
        try (InputStream is = open(resource)) {
            properties.load(is);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
        return properties;
    }

    private static String readResource(final String resource) {
        try (InputStream is = open(resource)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read " + resource, e);
        }
    }

    private static InputStream open(final String resource)
            throws IOException {
        final InputStream is = ImportScanner.class.getClassLoader()
                .getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Resource not found on classpath: "
                    + resource);
        }
        return is;
    }

}
