package com.recbench.evaluation.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers streamed fragments per recommended item until the terminal marker arrives.
 * Items keep their first-arrival order. Fragments after the marker are ignored.
 */
public class ItemStreamAccumulator {

    static final String TERMINAL_MARKER = "[DONE]";
    private static final String DATA_PREFIX = "data:";

    private final ObjectMapper objectMapper;
    private final Map<String, StringBuilder> blocks = new LinkedHashMap<>();
    private boolean complete;
    private int fragments;
    private int malformedFragments;

    public ItemStreamAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public synchronized void accept(String rawFragment) {
        if (complete || rawFragment == null) {
            return;
        }
        String payload = rawFragment.trim();
        if (payload.startsWith(DATA_PREFIX)) {
            payload = payload.substring(DATA_PREFIX.length()).trim();
        }
        if (payload.isEmpty()) {
            return;
        }
        if (TERMINAL_MARKER.equals(payload)) {
            complete = true;
            return;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (IOException ex) {
            malformedFragments++;
            return;
        }
        if (node == null || !node.isObject()) {
            malformedFragments++;
            return;
        }
        if ("end".equalsIgnoreCase(node.path("event").asText(""))) {
            complete = true;
            return;
        }
        String item = node.path("check_item_name").asText("");
        if (item.isBlank()) {
            item = node.path("item_name").asText("");
        }
        if (item.isBlank()) {
            malformedFragments++;
            return;
        }
        fragments++;
        blocks.computeIfAbsent(item.trim(), ignored -> new StringBuilder())
                .append(node.path("content").asText(""));
    }

    public synchronized boolean isComplete() {
        return complete;
    }

    public synchronized List<String> itemNames() {
        return Collections.unmodifiableList(new ArrayList<>(blocks.keySet()));
    }

    public synchronized Map<String, String> textBlocks() {
        Map<String, String> copy = new LinkedHashMap<>();
        blocks.forEach((item, text) -> copy.put(item, text.toString()));
        return copy;
    }

    public synchronized int getFragments() {
        return fragments;
    }

    public synchronized int getMalformedFragments() {
        return malformedFragments;
    }
}
