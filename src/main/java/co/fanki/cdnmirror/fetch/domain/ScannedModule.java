package co.fanki.cdnmirror.fetch.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The imports found in one module, in source order.
 *
 * @param imports every import occurrence, including repeated specifiers
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ScannedModule(List<ImportSpecifier> imports) {

    /**
     * Copies the occurrences.
     *
     * @param imports the occurrences
     */
    public ScannedModule {
        imports = List.copyOf(imports);
    }

    /** @return the distinct specifier values, in first-seen order */
    public List<String> specifiers() {
        final Set<String> distinct = new LinkedHashSet<>();
        for (final ImportSpecifier specifier : imports) {
            distinct.add(specifier.value());
        }
        return new ArrayList<>(distinct);
    }

    /** @return the sources of re-export declarations */
    public List<String> reExportSources() {
        final List<String> sources = new ArrayList<>();
        for (final ImportSpecifier specifier : imports) {
            if (specifier.kind() == ImportSpecifier.Kind.RE_EXPORT) {
                sources.add(specifier.value());
            }
        }
        return sources;
    }

    /** @return true if the module imports nothing */
    public boolean isEmpty() {
        return imports.isEmpty();
    }

}
