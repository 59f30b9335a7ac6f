package com.csd.reqaudit.controller;

import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueStats;
import com.csd.reqaudit.service.CatalogueService;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/catalogue")
public class CatalogueController {

    private final CatalogueService catalogueService;

    public CatalogueController(CatalogueService catalogueService) { this.catalogueService = catalogueService; }

    @PostMapping("/refresh")
    public CatalogueStats refresh() throws FetchException {
        return catalogueService.refresh();
    }

    @GetMapping("/stats")
    public CatalogueStats stats() {
        return catalogueService.stats();
    }
}
