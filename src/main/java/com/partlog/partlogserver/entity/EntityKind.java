package com.partlog.partlogserver.entity;

/**
 * Тег типа сущности. Родитель задаёт иерархию, по которой работают
 * таблицы политик (аналог проверки is_a, но без рефлексии).
 */
public enum EntityKind {
    DB_ELEMENT(null),
    NAMED_ELEMENT(DB_ELEMENT),
    PART(NAMED_ELEMENT),
    ATTACHMENT(NAMED_ELEMENT),
    USER(NAMED_ELEMENT),
    PART_LOT(DB_ELEMENT),
    ORDERDETAIL(DB_ELEMENT),
    PRICEDETAIL(DB_ELEMENT),
    LOG_ENTRY(DB_ELEMENT);

    private final EntityKind parent;

    EntityKind(EntityKind parent) {
        this.parent = parent;
    }

    public EntityKind getParent() {
        return parent;
    }

    /**
     * true, если этот тип совпадает с other или является его потомком.
     */
    public boolean isA(EntityKind other) {
        for (EntityKind k = this; k != null; k = k.parent) {
            if (k == other) return true;
        }
        return false;
    }
}
