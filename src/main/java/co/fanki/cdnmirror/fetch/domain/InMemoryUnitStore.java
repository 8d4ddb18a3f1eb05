package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * Thread-safe {@link UnitStore} held in memory.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class InMemoryUnitStore implements UnitStore {

    private final Map<String, DependencyInfo> units = new ConcurrentHashMap<>();

    private final Map<String, NavigableSet<String>> byBaseUrl =
            new ConcurrentHashMap<>();

    @Override
    public Optional<DependencyInfo> get(final String url) {
        return Optional.ofNullable(units.get(url));
    }

    @Override
    public boolean putIfAbsent(final DependencyInfo unit) {
        Preconditions.requireNonNull(unit, "Unit is required");
        if (units.putIfAbsent(unit.url(), unit) != null) {
            return false;
        }
        byBaseUrl.computeIfAbsent(CdnUrls.stripQuery(unit.url()),
                key -> new ConcurrentSkipListSet<>()).add(unit.url());
        return true;
    }

    @Override
    public List<String> listByBaseUrl(final String baseUrl) {
        final NavigableSet<String> urls = byBaseUrl.get(
                CdnUrls.stripQuery(baseUrl));
        return urls == null ? List.of() : new ArrayList<>(urls);
    }

    /** @return the number of stored modules */
    public int size() {
        return units.size();
    }

}
