package com.partlog.partlogserver.entity;

import com.partlog.partlogserver.services.UnitOfWorkEntityListener;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

/**
 * Базовый класс всех сущностей, изменения которых попадают в журнал.
 */
@MappedSuperclass
@EntityListeners(UnitOfWorkEntityListener.class)
@Getter
@Setter
public abstract class AbstractDBElement implements ReadableFields {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    public abstract EntityKind getKind();
}
