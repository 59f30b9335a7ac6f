package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory catalogue; {@link #failNext} makes the next fetch fail.
 */
class StubCatalogueSource implements CatalogueSource {

    final Map<String, List<CatalogueEntry>> catalogue = new LinkedHashMap<>();
    boolean failNext;
    int fetchCount;

    StubCatalogueSource with(String name, String advisory, String... specs) {
        catalogue.computeIfAbsent(name, k -> new java.util.ArrayList<>())
                .add(CatalogueEntry.builder().advisory(advisory).id("id-" + advisory).specs(List.of(specs)).build());
        return this;
    }

    @Override
    public Map<String, List<CatalogueEntry>> fetchCatalogue() throws FetchException {
        fetchCount++;
        if (failNext) {
            failNext = false;
            throw new FetchException("catalogue host unreachable", 503);
        }
        return new LinkedHashMap<>(catalogue);
    }

    @Override
    public String describe() {
        return "stub";
    }
}
