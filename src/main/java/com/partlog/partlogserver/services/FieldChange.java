package com.partlog.partlogserver.services;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Пара (старое, новое) значение одного поля.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class FieldChange {
    private final Object oldValue;
    private final Object newValue;
}
