package com.cgi.fielddiscovery.classifier.cache;

import com.cgi.fielddiscovery.catalog.model.CatalogColumn;
import com.cgi.fielddiscovery.catalog.model.TableGroup;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content fingerprints of table groups.
 * Two groups with the same schema, table name, column metadata and samples share a fingerprint,
 * whatever data source they come from.
 */
@Component
public class FingerprintGenerator {

    private final ObjectMapper objectMapper;

    public FingerprintGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param group Table group
     * @return Hex-encoded SHA-256 of the canonical JSON form of the group
     */
    public String fingerprint(TableGroup group) {
        ObjectNode canonical = objectMapper.createObjectNode();
        canonical.put("schema", group.getSchema());
        canonical.put("table", group.getTableName());

        ArrayNode columns = canonical.putArray("columns");
        for (CatalogColumn column : group.getColumns()) {
            ObjectNode node = columns.addObject();
            node.put("name", column.getName());
            node.put("dataType", column.getDataType());
            node.put("nullable", column.isNullable());
            node.put("description", column.getDescription());
            ArrayNode samples = node.putArray("samples");
            if (column.getSampleValues() != null) {
                column.getSampleValues().forEach(samples::add);
            }
        }

        try {
            return sha256(objectMapper.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize table group " + group.getQualifiedName(), e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
