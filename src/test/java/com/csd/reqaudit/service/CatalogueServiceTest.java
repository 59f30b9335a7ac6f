package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.CatalogueUnavailableException;
import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueStats;
import com.csd.reqaudit.model.VulnerabilityRecord;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

public class CatalogueServiceTest {

    @Test
    void notLoadedUntilRefreshed() {
        CatalogueService service = new CatalogueService(new StubCatalogueSource(), new RangeParser(), false);
        assertFalse(service.isLoaded());
        assertFalse(service.stats().isLoaded());
        assertThrows(CatalogueUnavailableException.class, () -> service.recordsFor(Set.of("django")));
    }

    @Test
    void refreshParsesAndCountsDroppedEntries() throws Exception {
        StubCatalogueSource source = new StubCatalogueSource()
                .with("django", "D1", "<1.11.9")
                .with("django", "D2", "not-a-spec")
                .with("flask", "F1", ">=0.5,<0.12.3");
        CatalogueService service = new CatalogueService(source, new RangeParser(), false);

        CatalogueStats stats = service.refresh();

        assertTrue(stats.isLoaded());
        assertEquals(2, stats.getPackageCount());
        assertEquals(2, stats.getRecordCount());
        assertEquals(1, stats.getDroppedEntries());
        assertEquals("stub", stats.getSource());

        List<VulnerabilityRecord> django = service.recordsFor(Set.of("django"));
        assertEquals(1, django.size());
        assertEquals("D1", django.get(0).getAdvisory());
        assertTrue(service.recordsFor(Set.of("requests")).isEmpty());
    }

    @Test
    void failedRefreshKeepsPreviousCatalogue() throws Exception {
        StubCatalogueSource source = new StubCatalogueSource().with("django", "D1", "<1.11.9");
        CatalogueService service = new CatalogueService(source, new RangeParser(), false);
        service.refresh();

        source.failNext = true;
        FetchException e = assertThrows(FetchException.class, service::refresh);
        assertEquals(503, e.getStatusCode());
        assertTrue(service.isLoaded());
        assertEquals(1, service.recordsFor(Set.of("django")).size());
    }

    @Test
    void startupLoadIsOptional() {
        StubCatalogueSource source = new StubCatalogueSource().with("django", "D1", "<1.11.9");

        CatalogueService lazy = new CatalogueService(source, new RangeParser(), false);
        lazy.loadOnStartup();
        assertFalse(lazy.isLoaded());
        assertEquals(0, source.fetchCount);

        CatalogueService eager = new CatalogueService(source, new RangeParser(), true);
        eager.loadOnStartup();
        assertTrue(eager.isLoaded());

        source.failNext = true;
        CatalogueService failing = new CatalogueService(source, new RangeParser(), true);
        failing.loadOnStartup();
        assertFalse(failing.isLoaded());
    }

    @Test
    void loadAcceptsAlreadyDecodedData() {
        StubCatalogueSource data = new StubCatalogueSource().with("Jinja2", "J1", "<2.10.1");
        CatalogueService service = new CatalogueService(new StubCatalogueSource(), new RangeParser(), false);

        service.load(data.catalogue, "inline");

        assertEquals(1, service.recordsFor(Set.of("jinja2")).size());
        assertEquals("inline", service.stats().getSource());
    }
}
