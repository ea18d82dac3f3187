package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.AbstractDBElement;
import com.partlog.partlogserver.entity.EntityKind;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Строит набор прежних значений для записи журнала: фильтрует запрещённые
 * поля, приводит значения к скалярам и ограничивает длину строк.
 */
@RequiredArgsConstructor
public class ChangeSetBuilder {

    public static final int MAX_STRING_LENGTH = 2000;
    public static final String TRUNCATION_MARKER = "...";

    private final FieldRedactionPolicy redactionPolicy;

    /**
     * Для удалённой сущности берётся весь исходный снимок, иначе только старые
     * значения изменённых полей.
     */
    public ChangeSet build(AbstractDBElement entity, UnitOfWork unitOfWork, boolean wasDeleted) {
        if (wasDeleted) {
            return fromSnapshot(entity.getKind(), unitOfWork.originalSnapshot(entity));
        }
        return fromFieldChanges(entity.getKind(), unitOfWork.fieldChangeSet(entity));
    }

    public ChangeSet fromSnapshot(EntityKind kind, Map<String, Object> snapshot) {
        return toChangeSet(kind, snapshot);
    }

    public ChangeSet fromFieldChanges(EntityKind kind, Map<String, FieldChange> changes) {
        Map<String, Object> oldValues = new LinkedHashMap<>();
        changes.forEach((field, change) -> oldValues.put(field, change.getOldValue()));
        return toChangeSet(kind, oldValues);
    }

    private ChangeSet toChangeSet(EntityKind kind, Map<String, Object> candidates) {
        Map<String, Object> result = new LinkedHashMap<>();
        redactionPolicy.filter(kind, candidates).forEach((field, value) -> {
            // null не считаем информативным прежним состоянием
            Object normalized = value != null ? normalize(value) : null;
            if (normalized != null) {
                result.put(field, truncate(normalized));
            }
        });
        return result.isEmpty() ? ChangeSet.empty() : new ChangeSet(result);
    }

    static Object normalize(Object value) {
        if (value instanceof AbstractDBElement) {
            return ((AbstractDBElement) value).getId();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value.toString();
    }

    static Object truncate(Object value) {
        if (!(value instanceof String)) {
            return value;
        }
        String s = (String) value;
        if (s.length() <= MAX_STRING_LENGTH) {
            return s;
        }
        int cut = MAX_STRING_LENGTH - TRUNCATION_MARKER.length();
        // не разрываем суррогатную пару
        if (Character.isHighSurrogate(s.charAt(cut - 1))) {
            cut--;
        }
        return s.substring(0, cut) + TRUNCATION_MARKER;
    }
}
