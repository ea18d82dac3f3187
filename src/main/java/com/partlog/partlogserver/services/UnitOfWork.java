package com.partlog.partlogserver.services;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * То, что журналу нужно от механизма хранения на время одного сброса.
 * Фаза 1 ({@link #commitPrimary}) пишет основные сущности и выдаёт id,
 * фаза 2 ({@link #flush}) дописывает то, что было поставлено в очередь
 * во время фазы 1.
 */
public interface UnitOfWork {

    /** Сущности, запланированные к обновлению. Валидно только до commitPrimary. */
    List<Object> pendingUpdates();

    /** Сущности, запланированные к удалению. Валидно только до commitPrimary. */
    List<Object> pendingDeletes();

    /** Изменённые поля сущности: имя -> (старое, новое). */
    Map<String, FieldChange> fieldChangeSet(Object entity);

    /** Значения полей сущности на момент загрузки. */
    Map<String, Object> originalSnapshot(Object entity);

    /** Связи со стороны владельца для класса сущности, по имени поля. */
    Map<String, AssociationMapping> associationMappings(Class<?> entityClass);

    /** Пересчитать наборы изменений после того, как сканирование прочитало связи. */
    void recomputeChangeSets();

    /**
     * Фаза 1: записать основные изменения. onCreated вызывается ровно один раз
     * для каждой новой сущности сразу после присвоения ей id.
     */
    void commitPrimary(Consumer<Object> onCreated);

    boolean hasPendingWrites();

    /** Фаза 2: записать отложенное. */
    void flush();
}
