package com.csd.reqaudit.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class CatalogueStats {
    private boolean loaded;
    private int packageCount;
    private int recordCount;
    private int droppedEntries;
    private Instant loadedAt;
    private String source;
}
