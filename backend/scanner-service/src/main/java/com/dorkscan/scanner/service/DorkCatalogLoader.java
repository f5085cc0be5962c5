package com.dorkscan.scanner.service;

import com.dorkscan.scanner.model.DorkCatalog;
import com.dorkscan.scanner.model.DorkCategory;
import com.dorkscan.scanner.model.RiskLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON dork catalog. Accepted shapes per category:
 * <ul>
 *     <li>{@code {"description": .., "risk": .., "sensitive": .., "dorks": [..]}} ({@code patterns} is accepted too)</li>
 *     <li>a bare list of dork strings, treated as risk {@code unknown}</li>
 *     <li>a one-element list wrapping the object form</li>
 * </ul>
 */
@Component
public class DorkCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(DorkCatalogLoader.class);

    private final ObjectMapper objectMapper;

    public DorkCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DorkCatalog load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("dorks file '" + path + "' not found. please create it and add dorks.");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("dorks file '" + path + "' could not be read: " + e.getMessage(), e);
        }
        DorkCatalog catalog = parse(root);
        if (catalog.isEmpty()) {
            throw new ConfigurationException("no dorks found in '" + path + "'");
        }
        log.info("Loaded {} categories from {}", catalog.categories().size(), path);
        return catalog;
    }

    DorkCatalog parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("dorks file must contain a JSON object of categories");
        }
        List<DorkCategory> categories = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            DorkCategory category = toCategory(field.getKey(), field.getValue());
            if (category != null) categories.add(category);
        }
        return DorkCatalog.of(categories);
    }

    private DorkCategory toCategory(String name, JsonNode node) {
        if (node.isArray()) {
            if (node.size() == 1 && node.get(0).isObject()) {
                return fromObject(name, node.get(0));
            }
            return DorkCategory.unclassified(name, strings(node));
        }
        if (node.isObject()) {
            return fromObject(name, node);
        }
        log.warn("Ignoring category '{}': expected an object or a list, got {}", name, node.getNodeType());
        return null;
    }

    private DorkCategory fromObject(String name, JsonNode node) {
        JsonNode patterns = node.has("dorks") ? node.get("dorks") : node.path("patterns");
        return new DorkCategory(name,
                node.path("description").asText(""),
                RiskLevel.fromString(node.path("risk").asText(null)),
                node.path("sensitive").asBoolean(false),
                strings(patterns));
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual()) out.add(item.asText());
            }
        }
        return out;
    }
}
