package com.partlog.partlogserver.entity.log;

/**
 * Коды типов записей журнала, хранятся в колонке-дискриминаторе.
 * Остальные системные события (вход, выход, исключения) сюда не входят.
 */
public enum LogEntryType {
    ELEMENT_DELETED(5),
    ELEMENT_CREATED(6),
    ELEMENT_EDITED(7),
    COLLECTION_ELEMENT_DELETED(11);

    public static final String ELEMENT_DELETED_CODE = "5";
    public static final String ELEMENT_CREATED_CODE = "6";
    public static final String ELEMENT_EDITED_CODE = "7";
    public static final String COLLECTION_ELEMENT_DELETED_CODE = "11";

    private final int code;

    LogEntryType(int code) { this.code = code; }

    public int getCode() { return code; }
}
