package ch.so.arp.rag.text2sql.rules;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a business rules document. The document is a JSON or YAML object with
 * the sections {@code general_terms}, {@code metrics}, {@code calculations}
 * (key to text), {@code table_terms}, {@code enum_values} (table to key to
 * text) and {@code synonyms} (table to key to a list of names). Unknown
 * sections are ignored.
 */
public class BusinessRulesDocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusinessRulesDocumentReader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public BusinessRulesDocumentReader(ObjectMapper jsonMapper) {
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public List<BusinessRule> read(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalArgumentException("Business rules document " + resource + " does not exist");
        }
        ObjectMapper mapper = isYaml(resource.getFilename()) ? yamlMapper : jsonMapper;
        try (InputStream in = resource.getInputStream()) {
            List<BusinessRule> rules = read(mapper.readTree(in));
            LOGGER.info("Loaded {} business rules from {}", rules.size(), resource.getDescription());
            return rules;
        } catch (IOException ex) {
            throw new IllegalArgumentException("Business rules document " + resource.getDescription()
                    + " could not be parsed: " + ex.getMessage(), ex);
        }
    }

    public List<BusinessRule> read(JsonNode document) {
        List<BusinessRule> rules = new ArrayList<>();
        if (document == null || document.isNull() || document.isMissingNode()) {
            return rules;
        }
        if (!document.isObject()) {
            throw new IllegalArgumentException("Business rules document must be an object");
        }
        readGeneral(document.path("general_terms"), RuleKind.TERM, rules);
        readGeneral(document.path("metrics"), RuleKind.METRIC, rules);
        readGeneral(document.path("calculations"), RuleKind.CALCULATION, rules);
        readPerTable(document.path("table_terms"), RuleKind.TERM, rules);
        readPerTable(document.path("enum_values"), RuleKind.ENUM_VALUE, rules);
        readPerTable(document.path("synonyms"), RuleKind.SYNONYM, rules);
        return rules;
    }

    private void readGeneral(JsonNode section, RuleKind kind, List<BusinessRule> rules) {
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(section); it.hasNext();) {
            Map.Entry<String, JsonNode> entry = it.next();
            rules.add(BusinessRule.general(kind, entry.getKey(), text(entry.getValue())));
        }
    }

    private void readPerTable(JsonNode section, RuleKind kind, List<BusinessRule> rules) {
        for (Iterator<Map.Entry<String, JsonNode>> tables = fields(section); tables.hasNext();) {
            Map.Entry<String, JsonNode> table = tables.next();
            if (!table.getValue().isObject()) {
                throw new IllegalArgumentException("Section entry '" + table.getKey() + "' for "
                        + kind.label() + " rules must map keys to values");
            }
            for (Iterator<Map.Entry<String, JsonNode>> it = table.getValue().fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> entry = it.next();
                rules.add(BusinessRule.forTable(table.getKey(), kind, entry.getKey(), text(entry.getValue())));
            }
        }
    }

    private Iterator<Map.Entry<String, JsonNode>> fields(JsonNode section) {
        if (section.isMissingNode() || section.isNull()) {
            return Collections.emptyIterator();
        }
        if (!section.isObject()) {
            throw new IllegalArgumentException("Business rules section must be an object but was " + section.getNodeType());
        }
        return section.fields();
    }

    private String text(JsonNode value) {
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            value.forEach(item -> parts.add(item.asText()));
            return String.join(", ", parts);
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    private static boolean isYaml(String filename) {
        if (filename == null) {
            return false;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }
}
