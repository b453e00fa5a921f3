package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.survey.codeframe.entity.HierarchyNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Appends entries to a node's edit_history JSON array.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EditHistoryWriter {

    private final ObjectMapper objectMapper;

    public void append(HierarchyNode node, String action, String by, Map<String, Object> details) {
        ArrayNode history = read(node);
        ObjectNode entry = history.addObject();
        entry.put("action", action);
        entry.put("by", by);
        entry.put("at", LocalDateTime.now().toString());
        if (details != null) {
            details.forEach((key, value) -> entry.set(key, objectMapper.valueToTree(value)));
        }
        node.setEditHistory(history.toString());
    }

    private ArrayNode read(HierarchyNode node) {
        String raw = node.getEditHistory();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createArrayNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(raw);
            if (parsed != null && parsed.isArray()) {
                return (ArrayNode) parsed;
            }
        } catch (IOException e) {
            log.warn("Unreadable edit history on node {}, starting a new one: {}", node.getId(), e.getMessage());
        }
        return objectMapper.createArrayNode();
    }
}
