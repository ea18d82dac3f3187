package com.partlog.partlogserver.exeption;

/**
 * Таблицы политик журнала не совпадают с маппингом сущностей.
 * Это ошибка конфигурации, повторять операцию бессмысленно.
 */
public class ChangeLogConfigurationException extends RuntimeException {

    public ChangeLogConfigurationException(String message) {
        super(message);
    }
}
