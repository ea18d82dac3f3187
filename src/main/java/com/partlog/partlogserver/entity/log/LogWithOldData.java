package com.partlog.partlogserver.entity.log;

import java.util.Map;

/**
 * Запись, которая может хранить прежние значения полей (ключ "d").
 */
public interface LogWithOldData {

    boolean hasOldDataInformation();

    Map<String, Object> getOldData();

    void setOldData(Map<String, Object> oldData);
}
