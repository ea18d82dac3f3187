package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.AbstractDBElement;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PreRemove;

/**
 * Сообщает активной в потоке {@link JpaUnitOfWork} о каждой вставке и
 * удалении, в том числе каскадных и сделанных через репозитории.
 * Вне единицы работы ничего не делает.
 */
public class UnitOfWorkEntityListener {

    @PostPersist
    public void afterInsert(Object entity) {
        JpaUnitOfWork unitOfWork = JpaUnitOfWork.active();
        if (unitOfWork != null && entity instanceof AbstractDBElement) {
            unitOfWork.registerInserted((AbstractDBElement) entity);
        }
    }

    @PreRemove
    public void beforeRemove(Object entity) {
        JpaUnitOfWork unitOfWork = JpaUnitOfWork.active();
        if (unitOfWork != null && entity instanceof AbstractDBElement) {
            unitOfWork.registerRemoved((AbstractDBElement) entity);
        }
    }
}
