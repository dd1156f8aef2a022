package com.sievesql.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sievesql.types.BooleanDomain;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DateTimeDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.Domain;
import com.sievesql.types.EnumDomain;
import com.sievesql.types.FloatDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.OpaqueDomain;
import com.sievesql.types.TextDomain;
import com.sievesql.types.TimeDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a {@link Catalog} from a JSON description.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "schemas": [
 *     {
 *       "name": "",
 *       "priority": 0,
 *       "tables": [
 *         {
 *           "name": "department",
 *           "columns": [
 *             {"name": "code", "type": "text", "nullable": false},
 *             {"name": "school_code", "type": "text"}
 *           ],
 *           "primaryKey": ["code"],
 *           "uniqueKeys": [["name"]],
 *           "foreignKeys": [
 *             {"columns": ["school_code"], "target": "school", "targetColumns": ["code"]}
 *           ]
 *         }
 *       ]
 *     }
 *   ]
 * }
 * </pre>
 *
 * <p>A column type is either a name ({@code boolean, integer, decimal, float,
 * text, string, date, time, datetime}) or an object with a {@code type} field
 * and type parameters: {@code size}, {@code precision}, {@code scale},
 * {@code length}, or {@code labels} for {@code enum}. Any other type name
 * produces an opaque domain.
 */
public final class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private CatalogLoader() {
        // Utility class
    }

    /**
     * Parses a JSON catalog description.
     *
     * @param json the JSON text
     * @return the catalog
     * @throws IllegalArgumentException if the description is malformed
     */
    public static Catalog parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Catalog description cannot be null or empty");
        }
        try {
            return load(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse catalog description: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a JSON catalog description from a stream.
     *
     * @param input the stream; not closed by this method
     * @return the catalog
     * @throws IOException if the stream cannot be read
     * @throws IllegalArgumentException if the description is malformed
     */
    public static Catalog read(InputStream input) throws IOException {
        try {
            return load(objectMapper.readTree(input));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse catalog description: " + e.getOriginalMessage(), e);
        }
    }

    private static Catalog load(JsonNode root) {
        JsonNode schemasNode = root.get("schemas");
        if (schemasNode == null || !schemasNode.isArray()) {
            throw new IllegalArgumentException("Catalog description must contain a 'schemas' array");
        }
        CatalogBuilder builder = new CatalogBuilder();
        int tableCount = 0;
        for (JsonNode schemaNode : schemasNode) {
            builder.schema(schemaNode.path("name").asText(""), schemaNode.path("priority").asInt(0));
            for (JsonNode tableNode : schemaNode.path("tables")) {
                loadTable(builder, tableNode);
                tableCount++;
            }
        }
        Catalog catalog = builder.build();
        logger.debug("Loaded catalog with {} schemas and {} tables", catalog.schemas().size(), tableCount);
        return catalog;
    }

    private static void loadTable(CatalogBuilder builder, JsonNode tableNode) {
        String name = required(tableNode, "name").asText();
        CatalogBuilder.TableBuilder table = builder.table(name);
        for (JsonNode columnNode : tableNode.path("columns")) {
            String columnName = required(columnNode, "name").asText();
            Domain domain = parseDomain(required(columnNode, "type"));
            boolean nullable = columnNode.path("nullable").asBoolean(true);
            boolean hasDefault = columnNode.path("hasDefault").asBoolean(false);
            table.column(columnName, domain, nullable, hasDefault);
        }
        if (tableNode.has("primaryKey")) {
            table.primaryKey(names(tableNode.get("primaryKey")).toArray(new String[0]));
        }
        for (JsonNode keyNode : tableNode.path("uniqueKeys")) {
            table.uniqueKey(names(keyNode).toArray(new String[0]));
        }
        for (JsonNode keyNode : tableNode.path("foreignKeys")) {
            table.foreignKey(names(required(keyNode, "columns")),
                             required(keyNode, "target").asText(),
                             names(required(keyNode, "targetColumns")));
        }
    }

    /**
     * Parses a column type: a type name or an object with type parameters.
     */
    static Domain parseDomain(JsonNode typeNode) {
        if (typeNode.isTextual()) {
            return primitive(typeNode.asText().toLowerCase(), typeNode);
        }
        if (typeNode.isObject()) {
            return primitive(required(typeNode, "type").asText().toLowerCase(), typeNode);
        }
        throw new IllegalArgumentException("Unsupported type node: " + typeNode);
    }

    private static Domain primitive(String typeName, JsonNode node) {
        switch (typeName) {
            case "boolean":
                return new BooleanDomain();
            case "integer":
                return new IntegerDomain(optionalInt(node, "size"));
            case "decimal":
                return new DecimalDomain(optionalInt(node, "precision"), optionalInt(node, "scale"));
            case "float":
                return new FloatDomain(optionalInt(node, "size"));
            case "text":
            case "string":
                return new TextDomain(optionalInt(node, "length"), node.path("varying").asBoolean(true));
            case "enum":
                return new EnumDomain(names(node.path("labels")));
            case "date":
                return new DateDomain();
            case "time":
                return new TimeDomain();
            case "datetime":
                return new DateTimeDomain();
            default:
                return new OpaqueDomain(typeName);
        }
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isInt() ? value.asInt() : null;
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing required field '" + field + "' in " + node);
        }
        return value;
    }

    private static List<String> names(JsonNode node) {
        List<String> names = new ArrayList<>();
        if (node.isTextual()) {
            names.add(node.asText());
            return names;
        }
        for (JsonNode item : node) {
            names.add(item.asText());
        }
        return names;
    }
}
