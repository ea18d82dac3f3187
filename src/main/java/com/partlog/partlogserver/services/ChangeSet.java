package com.partlog.partlogserver.services;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Прежние значения полей одной сущности после фильтрации и обрезки.
 */
public final class ChangeSet {

    private static final ChangeSet EMPTY = new ChangeSet(Map.of());

    private final Map<String, Object> values;

    ChangeSet(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Object get(String fieldName) {
        return values.get(fieldName);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(values.keySet());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ChangeSet" + values;
    }
}
