package com.spreadsheet.engine.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.engine.values.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The cells changed by one engine mutation, each with its new value.
 * Covers the edited cell plus every recalculated dependent; a renderer
 * only needs to repaint these. Entries keep recalculation order.
 */
public class UpdateSet {

    private final Map<CellId, Value> updates = new LinkedHashMap<>();

    public static UpdateSet of(CellId cell, Value value) {
        UpdateSet set = new UpdateSet();
        set.put(cell, value);
        return set;
    }

    public void put(CellId cell, Value value) {
        updates.put(cell, value);
    }

    public Value get(CellId cell) {
        return updates.get(cell);
    }

    public Value get(String cell) {
        return updates.get(CellId.parse(cell));
    }

    public boolean contains(String cell) {
        return updates.containsKey(CellId.parse(cell));
    }

    public int size() {
        return updates.size();
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    public Map<CellId, Value> asMap() {
        return Collections.unmodifiableMap(updates);
    }

    /**
     * Serialized form: { "B1": 20.0, "C1": "#DIV/0!", "D1": null }.
     */
    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        for (Map.Entry<CellId, Value> entry : updates.entrySet()) {
            json.put(entry.getKey().toString(), entry.getValue().toJson());
        }
        return json;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
