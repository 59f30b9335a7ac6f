package com.csd.reqaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One raw advisory as it appears in the vulnerability catalogue JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogueEntry {
    private String advisory;
    private List<String> specs; // each spec is "<op><version>[,<op><version>]"
    private String id;
    private String cve;
    private String v; // human-readable affected versions
}
