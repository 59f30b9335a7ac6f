package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.CatalogueUnavailableException;
import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueEntry;
import com.csd.reqaudit.model.CatalogueStats;
import com.csd.reqaudit.model.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Holds the parsed vulnerability catalogue. The catalogue is loaded explicitly, either
 * from the configured {@link CatalogueSource} or from data the caller already has, and
 * replaced as a whole on refresh.
 */
@Slf4j
@Service
public class CatalogueService {

    private final CatalogueSource catalogueSource;
    private final RangeParser rangeParser;
    private final boolean loadOnStartup;

    private volatile Snapshot snapshot;

    public CatalogueService(CatalogueSource catalogueSource,
                            RangeParser rangeParser,
                            @Value("${reqaudit.catalogue.load-on-startup:false}") boolean loadOnStartup) {
        this.catalogueSource = catalogueSource;
        this.rangeParser = rangeParser;
        this.loadOnStartup = loadOnStartup;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!loadOnStartup || isLoaded()) {
            return;
        }
        try {
            refresh();
        } catch (FetchException e) {
            log.error("Initial catalogue load from {} failed: {}", catalogueSource.describe(), e.getMessage());
        }
    }

    /**
     * Downloads and parses the catalogue again. On failure the previous catalogue, if
     * any, stays in place.
     */
    public CatalogueStats refresh() throws FetchException {
        Map<String, List<CatalogueEntry>> raw;
        try {
            raw = catalogueSource.fetchCatalogue();
        } catch (FetchException e) {
            log.warn("Catalogue refresh failed, keeping {}: {}",
                    isLoaded() ? "previous catalogue" : "no catalogue", e.getMessage());
            throw e;
        }
        return load(raw, catalogueSource.describe());
    }

    /**
     * Replaces the catalogue with already-decoded data.
     */
    public CatalogueStats load(Map<String, List<CatalogueEntry>> raw, String source) {
        List<VulnerabilityRecord> records = rangeParser.parseCatalogue(raw);
        int entryCount = raw.values().stream().filter(Objects::nonNull).mapToInt(List::size).sum();

        Map<String, List<VulnerabilityRecord>> byName = records.stream()
                .collect(Collectors.groupingBy(VulnerabilityRecord::getName, LinkedHashMap::new, Collectors.toList()));

        CatalogueStats stats = CatalogueStats.builder()
                .loaded(true)
                .packageCount(raw.size())
                .recordCount(records.size())
                .droppedEntries(entryCount - records.size())
                .loadedAt(Instant.now())
                .source(source)
                .build();
        this.snapshot = new Snapshot(byName, stats);
        log.info("Loaded vulnerability catalogue from {}: {} packages, {} advisories, {} dropped",
                source, stats.getPackageCount(), stats.getRecordCount(), stats.getDroppedEntries());
        return stats;
    }

    public boolean isLoaded() {
        return snapshot != null;
    }

    /**
     * Records for the given lowercase package names, in catalogue order.
     *
     * @throws CatalogueUnavailableException if no catalogue has been loaded yet
     */
    public List<VulnerabilityRecord> recordsFor(Collection<String> names) {
        Snapshot current = requireSnapshot();
        Set<String> wanted = new HashSet<>(names);
        List<VulnerabilityRecord> result = new ArrayList<>();
        current.byName.forEach((name, records) -> {
            if (wanted.contains(name)) {
                result.addAll(records);
            }
        });
        return result;
    }

    public CatalogueStats stats() {
        Snapshot current = snapshot;
        if (current == null) {
            return CatalogueStats.builder().loaded(false).source(catalogueSource.describe()).build();
        }
        return current.stats;
    }

    private Snapshot requireSnapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new CatalogueUnavailableException("Vulnerability catalogue has not been loaded yet");
        }
        return current;
    }

    private static final class Snapshot {
        final Map<String, List<VulnerabilityRecord>> byName;
        final CatalogueStats stats;

        Snapshot(Map<String, List<VulnerabilityRecord>> byName, CatalogueStats stats) {
            this.byName = Collections.unmodifiableMap(byName);
            this.stats = stats;
        }
    }
}
