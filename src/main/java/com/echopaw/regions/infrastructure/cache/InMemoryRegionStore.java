package com.echopaw.regions.infrastructure.cache;

import com.echopaw.regions.application.port.out.RegionStore;
import com.echopaw.regions.domain.model.CachedRegion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Region store backed by a {@link ConcurrentHashMap}.
 *
 * Scans are weakly consistent: a scan running alongside inserts or removals
 * may or may not see them, but never corrupts the map.
 */
@Component
public class InMemoryRegionStore implements RegionStore {

    private final Map<String, CachedRegion> regions = new ConcurrentHashMap<>();

    @Override
    public void put(CachedRegion region) {
        regions.put(region.getId(), region);
    }

    @Override
    public Optional<CachedRegion> get(String id) {
        return Optional.ofNullable(regions.get(id));
    }

    @Override
    public boolean containsId(String id) {
        return regions.containsKey(id);
    }

    @Override
    public boolean remove(CachedRegion expected) {
        return regions.remove(expected.getId(), expected);
    }

    @Override
    public List<CachedRegion> removeIf(Predicate<CachedRegion> predicate) {
        List<CachedRegion> removed = new ArrayList<>();
        Iterator<Map.Entry<String, CachedRegion>> it = regions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CachedRegion> entry = it.next();
            CachedRegion region = entry.getValue();
            // Conditional remove so a region replaced mid-scan is left alone
            if (predicate.test(region) && regions.remove(entry.getKey(), region)) {
                removed.add(region);
            }
        }
        return removed;
    }

    @Override
    public Collection<CachedRegion> snapshot() {
        return List.copyOf(regions.values());
    }

    @Override
    public int size() {
        return regions.size();
    }

    @Override
    public void clear() {
        regions.clear();
    }
}
