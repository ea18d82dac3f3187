package com.partlog.partlogserver.entity.log;

import com.partlog.partlogserver.entity.AbstractDBElement;
import com.partlog.partlogserver.entity.EntityKind;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

/**
 * Элемент удалён из обратной коллекции родителя. Обычный дифф полей этого
 * не видит, потому что внешний ключ хранится у дочерней сущности.
 * Целью записи является родитель, чья коллекция изменилась.
 */
@Entity
@DiscriminatorValue(LogEntryType.COLLECTION_ELEMENT_DELETED_CODE)
@NoArgsConstructor
public class CollectionElementDeleted extends AbstractLogEntry {

    private static final String KEY_COLLECTION = "n";
    private static final String KEY_DELETED_KIND = "c";
    private static final String KEY_DELETED_ID = "o";

    public CollectionElementDeleted(AbstractDBElement changedElement, String collectionName,
                                    AbstractDBElement deletedElement) {
        setLevel(LogLevel.INFO);
        setTargetElement(changedElement);
        getExtra().put(KEY_COLLECTION, collectionName);
        getExtra().put(KEY_DELETED_KIND, deletedElement.getKind().name());
        getExtra().put(KEY_DELETED_ID, deletedElement.getId());
    }

    @Override
    public LogEntryType getType() {
        return LogEntryType.COLLECTION_ELEMENT_DELETED;
    }

    public String getCollectionName() {
        Object value = getExtra().get(KEY_COLLECTION);
        return value != null ? value.toString() : null;
    }

    public EntityKind getDeletedElementKind() {
        Object value = getExtra().get(KEY_DELETED_KIND);
        return value != null ? EntityKind.valueOf(value.toString()) : null;
    }

    public Long getDeletedElementId() {
        Object value = getExtra().get(KEY_DELETED_ID);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }
}
