package com.partlog.partlogserver.services;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Связь со стороны владельца: поле, тип цели и имя обратной коллекции
 * (null, если связь однонаправленная).
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class AssociationMapping {
    private final String fieldName;
    private final Class<?> targetClass;
    private final String inversedBy;
}
