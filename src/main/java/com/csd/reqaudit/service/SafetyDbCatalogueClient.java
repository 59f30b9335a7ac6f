package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.CatalogueEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the Safety DB {@code insecure_full.json} catalogue.
 * Every call downloads the document again; caching is up to {@link CatalogueService}.
 */
@Slf4j
@Service
public class SafetyDbCatalogueClient implements CatalogueSource {

    static final String META_KEY = "$meta";

    private static final TypeReference<List<CatalogueEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String catalogueUrl;
    private final Duration timeout;

    public SafetyDbCatalogueClient(WebClient.Builder webClientBuilder,
                                   ObjectMapper objectMapper,
                                   @Value("${reqaudit.catalogue.url:https://raw.githubusercontent.com/pyupio/safety-db/master/data/insecure_full.json}") String catalogueUrl,
                                   @Value("${reqaudit.catalogue.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = webClientBuilder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();
        this.objectMapper = objectMapper;
        this.catalogueUrl = catalogueUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public Map<String, List<CatalogueEntry>> fetchCatalogue() throws FetchException {
        log.info("Downloading vulnerability catalogue from {}", catalogueUrl);
        String body;
        try {
            body = webClient.get()
                    .uri(catalogueUrl)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new FetchException("Catalogue download failed with HTTP " + e.getStatusCode().value(), e.getStatusCode().value());
        } catch (RuntimeException e) {
            throw new FetchException("Catalogue download failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new FetchException("Catalogue download returned an empty body");
        }
        return decode(body);
    }

    @Override
    public String describe() {
        return catalogueUrl;
    }

    /**
     * Decodes the catalogue document. The {@code $meta} key is skipped; a package whose
     * value is not a list of advisories is skipped with a warning.
     */
    Map<String, List<CatalogueEntry>> decode(String json) throws FetchException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new FetchException("Catalogue is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FetchException("Catalogue root must be a JSON object");
        }

        Map<String, List<CatalogueEntry>> catalogue = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (META_KEY.equals(field.getKey())) {
                continue;
            }
            try {
                catalogue.put(field.getKey(), objectMapper.convertValue(field.getValue(), ENTRY_LIST));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping catalogue package {}: {}", field.getKey(), e.getMessage());
            }
        }
        return catalogue;
    }
}
