package com.partlog.partlogserver.entity;

import java.util.Map;

/**
 * Доступ к полям сущности по имени без рефлексии.
 */
public interface ReadableFields {

    /**
     * Текущие значения полей в порядке объявления. Связи со стороны владельца
     * отдаются как ссылки на сущности, обратные коллекции не включаются.
     */
    Map<String, Object> readFields();

    default boolean hasField(String name) {
        return readFields().containsKey(name);
    }

    default Object readField(String name) {
        return readFields().get(name);
    }
}
