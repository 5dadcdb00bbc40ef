package com.cgi.fielddiscovery.catalog.client;

import com.cgi.fielddiscovery.catalog.config.CatalogClientProperties;
import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableAsset;
import com.cgi.fielddiscovery.common.exception.CatalogException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Client for the catalog/asset service.
 * Uses RestTemplate with separate read timeouts for the asset listing and the per-table detail calls.
 * Payloads are read as JSON trees and mapped onto validated models with default substitution,
 * since the catalog does not guarantee a stable shape.
 */
@Component
public class CatalogServiceClient {
    private static final Logger log = LoggerFactory.getLogger(CatalogServiceClient.class);

    private static final String ASSETS_PATH = "/api/catalog/assets";

    private final CatalogClientProperties properties;
    private final ObjectMapper objectMapper;
    private final RestTemplate listTemplate;
    private final RestTemplate detailTemplate;

    @Autowired
    public CatalogServiceClient(CatalogClientProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper,
                createRestTemplate(properties.getConnectTimeoutMs(), properties.getListTimeoutMs()),
                createRestTemplate(properties.getConnectTimeoutMs(), properties.getDetailTimeoutMs()));
        log.info("Catalog client initialized with URL: {} (list timeout {} ms, detail timeout {} ms)",
                properties.getBaseUrl(), properties.getListTimeoutMs(), properties.getDetailTimeoutMs());
    }

    CatalogServiceClient(CatalogClientProperties properties, ObjectMapper objectMapper,
                         RestTemplate listTemplate, RestTemplate detailTemplate) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.listTemplate = listTemplate;
        this.detailTemplate = detailTemplate;
    }

    /**
     * Lists the table assets of a data source.
     *
     * @param dataSourceId Data source identifier
     * @param schemas Optional schema scope; forwarded as the catalog's database filter only when it has one entry
     * @param tables Optional table scope; forwarded as the catalog's table filter only when it has one entry
     * @return Table assets, possibly empty
     * @throws CatalogException If the catalog cannot be reached or answers with an unusable payload
     */
    public List<TableAsset> fetchTableAssets(String dataSourceId, List<String> schemas, List<String> tables) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + ASSETS_PATH)
                .queryParam("dataSourceId", dataSourceId)
                .queryParam("type", "table")
                .queryParam("limit", properties.getAssetLimit());

        // The catalog filters on a single value; wider scopes are applied by the caller.
        if (schemas != null && schemas.size() == 1) {
            builder.queryParam("database", schemas.get(0));
        }
        if (tables != null && tables.size() == 1) {
            builder.queryParam("table", tables.get(0));
        }

        URI uri = builder.build().encode().toUri();
        log.info("Fetching table assets from catalog: {}", uri);

        JsonNode root = get(listTemplate, uri, "table assets for data source " + dataSourceId);
        JsonNode assets = firstArray(root.path("data").path("assets"), root.path("assets"), root.path("data"), root);

        List<TableAsset> result = new ArrayList<>();
        for (JsonNode node : assets) {
            result.add(toTableAsset(node));
        }

        log.info("Fetched {} table assets for data source {}", result.size(), dataSourceId);
        return result;
    }

    /**
     * Fetches the columns of one table asset.
     *
     * @param table Table asset
     * @return Columns of the table, empty if the detail carries none
     * @throws CatalogException If the detail call fails
     */
    public List<CatalogColumn> fetchTableColumns(TableAsset table) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl() + ASSETS_PATH + "/{id}")
                .buildAndExpand(table.getId())
                .encode()
                .toUri();

        JsonNode root = get(detailTemplate, uri, "columns of table " + table.getQualifiedName());
        JsonNode asset = root.has("data") && root.get("data").isObject() ? root.get("data") : root;

        return toColumns(asset.path("columns"));
    }

    private JsonNode get(RestTemplate template, URI uri, String what) {
        try {
            ResponseEntity<String> response = template.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(buildHeaders()), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new CatalogException("Catalog returned status " + response.getStatusCode() + " for " + what);
            }
            return objectMapper.readTree(response.getBody());
        } catch (RestClientException e) {
            throw new CatalogException("Failed to fetch " + what + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Malformed catalog response for " + what, e);
        }
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        String token = properties.getBearerToken();
        if (token != null && !token.isBlank()) {
            String trimmed = token.trim();
            headers.set(HttpHeaders.AUTHORIZATION, trimmed.startsWith("Bearer ") ? trimmed : "Bearer " + trimmed);
        }
        return headers;
    }

    private TableAsset toTableAsset(JsonNode node) {
        return TableAsset.builder()
                .id(text(node, null, "id"))
                .schema(text(node, "public", "schema", "schema_name", "schemaName"))
                .tableName(text(node, "unknown", "table", "name", "table_name", "tableName"))
                .embeddedColumns(toColumns(node.path("columns")))
                .build();
    }

    private List<CatalogColumn> toColumns(JsonNode columns) {
        List<CatalogColumn> result = new ArrayList<>();
        if (!columns.isArray()) {
            return result;
        }

        for (JsonNode col : columns) {
            String name = text(col, null, "column_name", "name", "columnName");
            if (name == null) {
                log.debug("Skipping catalog column without a name: {}", col);
                continue;
            }
            result.add(CatalogColumn.builder()
                    .id(text(col, null, "id"))
                    .name(name)
                    .dataType(text(col, "unknown", "data_type", "dataType", "type"))
                    .nullable(isNullable(col))
                    .description(text(col, null, "description"))
                    .sampleValues(sampleValues(col))
                    .build());
        }
        return result;
    }

    private boolean isNullable(JsonNode col) {
        JsonNode flag = col.has("is_nullable") ? col.get("is_nullable") : col.path("nullable");
        if (flag.isMissingNode() || flag.isNull()) {
            return true;
        }
        if (flag.isBoolean()) {
            return flag.asBoolean();
        }
        String value = flag.asText();
        return !("no".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value));
    }

    private List<String> sampleValues(JsonNode col) {
        JsonNode samples = col.has("sample_values") ? col.get("sample_values") : col.path("sampleValues");
        List<String> values = new ArrayList<>();
        if (samples.isArray()) {
            for (JsonNode sample : samples) {
                values.add(sample.isNull() ? null : sample.asText());
            }
        }
        return values;
    }

    private static String text(JsonNode node, String defaultValue, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull() && !value.isContainerNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return defaultValue;
    }

    private static JsonNode firstArray(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate != null && candidate.isArray()) {
                return candidate;
            }
        }
        throw new CatalogException("Catalog response does not contain an asset list");
    }

    private static RestTemplate createRestTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }
}
