package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueEntry;

import java.util.List;
import java.util.Map;

/**
 * Supplies the vulnerability catalogue, keyed by package name.
 */
public interface CatalogueSource {

    Map<String, List<CatalogueEntry>> fetchCatalogue() throws FetchException;

    /** Where the catalogue comes from, for logs and stats. */
    String describe();
}
