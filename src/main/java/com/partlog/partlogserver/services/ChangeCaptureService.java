package com.partlog.partlogserver.services;

import com.partlog.partlogserver.config.ChangeLogProperties;
import com.partlog.partlogserver.entity.AbstractDBElement;
import com.partlog.partlogserver.entity.EntityKind;
import com.partlog.partlogserver.entity.HasInstock;
import com.partlog.partlogserver.entity.log.AbstractLogEntry;
import com.partlog.partlogserver.entity.log.CollectionElementDeleted;
import com.partlog.partlogserver.entity.log.ElementCreatedLogEntry;
import com.partlog.partlogserver.entity.log.ElementDeletedLogEntry;
import com.partlog.partlogserver.entity.log.ElementEditedLogEntry;
import com.partlog.partlogserver.entity.log.LogWithOldData;
import com.partlog.partlogserver.exeption.ChangeLogConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Перехватывает сброс единицы работы и пишет журнал изменений.
 *
 * <p>Три точки входа на один сброс, строго по порядку:
 * <ol>
 *     <li>{@link #onPreCommit} - до записи: правки и удаления (у них уже есть id);</li>
 *     <li>{@link #onEntityCreated} - для каждой новой сущности сразу после получения id;</li>
 *     <li>{@link #onPostCommit} - дописывает отложенные записи о создании и очищает комментарий.</li>
 * </ol>
 * {@link #flush(UnitOfWork)} прогоняет весь цикл сам.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeCaptureService {

    private final EventLogger eventLogger;
    private final EventCommentHelper commentHelper;
    private final ChangeSetBuilder changeSetBuilder;
    private final FieldRedactionPolicy redactionPolicy;
    private final AssociationLogPolicy associationLogPolicy;
    private final ChangeLogProperties properties;

    /**
     * Полный цикл сброса. Комментарий очищается в любом случае, даже если
     * одна из фаз упала.
     */
    public void flush(UnitOfWork unitOfWork) {
        FlushContext context = begin(unitOfWork);
        try {
            onPreCommit(context);
            unitOfWork.commitPrimary(entity -> onEntityCreated(context, entity));
            onPostCommit(context);
        } finally {
            if (context.getPhase() != FlushPhase.DONE) {
                commentHelper.clearMessage();
                context.finish();
            }
        }
    }

    public FlushContext begin(UnitOfWork unitOfWork) {
        return new FlushContext(unitOfWork, commentHelper.getMessage());
    }

    public void onPreCommit(FlushContext context) {
        context.requirePhase(FlushPhase.SCANNING);
        UnitOfWork unitOfWork = context.getUnitOfWork();

        // Удаление важнее правки той же сущности
        Set<Object> deletions = Collections.newSetFromMap(new IdentityHashMap<>());
        deletions.addAll(unitOfWork.pendingDeletes());
        Set<Object> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Object entity : unitOfWork.pendingUpdates()) {
            if (isLoggable(entity) && !deletions.contains(entity) && visited.add(entity)) {
                logElementEdited((AbstractDBElement) entity, context);
            }
        }

        for (Object entity : unitOfWork.pendingDeletes()) {
            if (isLoggable(entity) && visited.add(entity)) {
                logElementDeleted((AbstractDBElement) entity, context);
            }
        }

        // Чтение связей могло подгрузить ленивые объекты
        unitOfWork.recomputeChangeSets();
        context.advance(FlushPhase.SCANNING, FlushPhase.AWAITING_IDENTIFIERS);
    }

    public void onEntityCreated(FlushContext context, Object entity) {
        context.requirePhase(FlushPhase.AWAITING_IDENTIFIERS);
        if (!isLoggable(entity)) {
            return;
        }
        AbstractDBElement element = (AbstractDBElement) entity;
        ElementCreatedLogEntry entry = new ElementCreatedLogEntry(element);
        if (element instanceof HasInstock && ((HasInstock) element).getAmount() != null) {
            entry.setCreationInstockValue(((HasInstock) element).getAmount().toPlainString());
        }
        attachComment(entry, context);
        eventLogger.log(entry);
    }

    public void onPostCommit(FlushContext context) {
        try {
            context.advance(FlushPhase.AWAITING_IDENTIFIERS, FlushPhase.DRAINING_DEFERRED);
            UnitOfWork unitOfWork = context.getUnitOfWork();
            // Записи о создании могли остаться только в контексте персистентности
            if (unitOfWork.hasPendingWrites()) {
                unitOfWork.flush();
            }
        } finally {
            commentHelper.clearMessage();
            context.finish();
        }
    }

    /**
     * Записывает прежние значения в запись о правке или удалении.
     *
     * @throws IllegalArgumentException для любого другого типа записи
     */
    public void saveChangeSet(AbstractDBElement entity, AbstractLogEntry logEntry, UnitOfWork unitOfWork,
                              boolean elementDeleted) {
        if (!(logEntry instanceof ElementEditedLogEntry) && !(logEntry instanceof ElementDeletedLogEntry)) {
            throw new IllegalArgumentException(
                    "logEntry должен быть ElementEditedLogEntry или ElementDeletedLogEntry, получен "
                            + logEntry.getClass().getSimpleName());
        }
        ChangeSet changeSet = changeSetBuilder.build(entity, unitOfWork, elementDeleted);
        ((LogWithOldData) logEntry).setOldData(changeSet.asMap());
    }

    /**
     * Журналируются только отслеживаемые сущности, но не сами записи журнала.
     */
    public boolean isLoggable(Object entity) {
        return entity instanceof AbstractDBElement && !(entity instanceof AbstractLogEntry);
    }

    private void logElementEdited(AbstractDBElement entity, FlushContext context) {
        UnitOfWork unitOfWork = context.getUnitOfWork();
        ElementEditedLogEntry entry = new ElementEditedLogEntry(entity);
        if (properties.isSaveChangedData()) {
            saveChangeSet(entity, entry, unitOfWork, false);
        } else if (properties.isSaveChangedFields()) {
            entry.setChangedFields(redactionPolicy.filterFieldNames(entity.getKind(),
                    unitOfWork.fieldChangeSet(entity).keySet()));
        }
        attachComment(entry, context);
        eventLogger.log(entry);
    }

    private void logElementDeleted(AbstractDBElement entity, FlushContext context) {
        UnitOfWork unitOfWork = context.getUnitOfWork();
        ElementDeletedLogEntry entry = new ElementDeletedLogEntry(entity);
        attachComment(entry, context);
        if (properties.isSaveRemovedData() || properties.isSaveChangedData()) {
            saveChangeSet(entity, entry, unitOfWork, true);
        }
        eventLogger.log(entry);

        if (properties.isSaveChangedData() && associationLogPolicy.isWhitelisted(entity.getKind())) {
            logCollectionElementsDeleted(entity, context);
        }
    }

    private void logCollectionElementsDeleted(AbstractDBElement entity, FlushContext context) {
        EntityKind kind = entity.getKind();
        Map<String, AssociationMapping> mappings = context.getUnitOfWork().associationMappings(entity.getClass());

        for (String field : associationLogPolicy.getTriggerAssociations(kind)) {
            AssociationMapping mapping = mappings.get(field);
            if (mapping == null || !entity.hasField(field)) {
                throw new ChangeLogConfigurationException(
                        "Связь '" + field + "' из whitelist отсутствует у " + kind);
            }
            if (mapping.getInversedBy() == null) {
                throw new ChangeLogConfigurationException(
                        "Связь '" + field + "' у " + kind + " не имеет обратной коллекции");
            }
            Object changed = entity.readField(field);
            if (changed == null) {
                log.debug("Связь {} у {}#{} пуста, CollectionElementDeleted не пишется", field, kind, entity.getId());
                continue;
            }
            if (!(changed instanceof AbstractDBElement)) {
                throw new ChangeLogConfigurationException(
                        "Связь '" + field + "' у " + kind + " указывает не на сущность журнала");
            }
            CollectionElementDeleted entry =
                    new CollectionElementDeleted((AbstractDBElement) changed, mapping.getInversedBy(), entity);
            attachComment(entry, context);
            eventLogger.log(entry);
        }
    }

    private void attachComment(AbstractLogEntry entry, FlushContext context) {
        if (context.hasComment()) {
            entry.setComment(context.getComment());
        }
    }
}
