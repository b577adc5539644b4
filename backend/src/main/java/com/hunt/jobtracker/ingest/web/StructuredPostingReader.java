package com.hunt.jobtracker.ingest.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads schema.org {@code JobPosting} blocks embedded as JSON-LD. Career sites that publish
 * them carry the requisition id in {@code identifier}, which plain-text extraction misses.
 */
@Component
public class StructuredPostingReader {
    private static final Logger log = LoggerFactory.getLogger(StructuredPostingReader.class);

    private final ObjectMapper objectMapper;

    public StructuredPostingReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<JsonNode> jobPostings(Document document) {
        List<JsonNode> postings = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                collectJobPostings(objectMapper.readTree(payload), postings);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
            }
        }
        return postings;
    }

    public Optional<String> identifier(Document document) {
        for (JsonNode posting : jobPostings(document)) {
            String value = identifierValue(posting.get("identifier"));
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    private void collectJobPostings(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostings(child, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (isJobPostingType(node.get("@type"))) {
            out.add(node);
        }
        node.fields().forEachRemaining(entry -> {
            if (entry.getValue().isContainerNode()) {
                collectJobPostings(entry.getValue(), out);
            }
        });
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private String identifierValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual() || node.isNumber()) {
            return node.asText();
        }
        if (node.isObject()) {
            JsonNode value = node.get("value");
            if (value != null && (value.isTextual() || value.isNumber())) {
                return value.asText();
            }
        }
        return null;
    }
}
