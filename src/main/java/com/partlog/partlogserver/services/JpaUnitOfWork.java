package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.AbstractDBElement;
import jakarta.persistence.EntityManager;
import jakarta.persistence.OneToMany;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import jakarta.persistence.metamodel.Metamodel;
import jakarta.persistence.metamodel.PluralAttribute;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;
import org.hibernate.engine.spi.EntityEntry;
import org.hibernate.engine.spi.PersistenceContext;
import org.hibernate.engine.spi.SessionImplementor;
import org.hibernate.engine.spi.Status;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Единица работы поверх JPA EntityManager.
 *
 * <p>Правки берутся из контекста персистентности Hibernate: текущие поля
 * каждой управляемой сущности сравниваются с состоянием на момент загрузки.
 * Вставки и удаления, сделанные любым путём (repository.save, em.remove,
 * каскады), приходят через {@link UnitOfWorkEntityListener}, пока единица
 * работы активна в текущем потоке. {@link #track}, {@link #persist} и
 * {@link #remove} нужны для отсоединённых сущностей и отложенных операций.
 *
 * <p>Используется в пределах одной транзакции и одного потока.
 */
@Slf4j
public class JpaUnitOfWork implements UnitOfWork, AutoCloseable {

    private static final ThreadLocal<JpaUnitOfWork> ACTIVE = new ThreadLocal<>();

    private final EntityManager entityManager;
    private final JpaUnitOfWork previous;

    private final Map<Object, Map<String, Object>> originals = new IdentityHashMap<>();
    private final List<AbstractDBElement> insertions = new ArrayList<>();
    private final Set<Object> inserted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<Object> announced = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<AbstractDBElement> deletions = new ArrayList<>();
    private final Set<Object> deleted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<AbstractDBElement> deferredRemovals = new ArrayList<>();
    private final Map<Object, Map<String, FieldChange>> changeSets = new IdentityHashMap<>();
    private final Map<Class<?>, Map<String, AssociationMapping>> mappingCache = new HashMap<>();
    private boolean changeSetsComputed;
    private boolean committed;
    private boolean closed;

    public JpaUnitOfWork(EntityManager entityManager) {
        this.entityManager = entityManager;
        this.previous = ACTIVE.get();
        ACTIVE.set(this);
    }

    static JpaUnitOfWork active() {
        return ACTIVE.get();
    }

    /**
     * Запоминает текущие значения полей. Нужно для отсоединённых сущностей,
     * управляемые видны и без этого.
     */
    public <T extends AbstractDBElement> T track(T entity) {
        ensureOpen();
        originals.computeIfAbsent(entity, e -> new LinkedHashMap<>(entity.readFields()));
        changeSetsComputed = false;
        return entity;
    }

    /**
     * Новая сущность, запись откладывается до фазы 1.
     */
    public <T extends AbstractDBElement> T persist(T entity) {
        ensureOpen();
        addInsertion(entity);
        return entity;
    }

    /**
     * Удаление, откладывается до фазы 1.
     */
    public void remove(AbstractDBElement entity) {
        track(entity);
        if (deleted.add(entity)) {
            deletions.add(entity);
            deferredRemovals.add(entity);
        }
    }

    void registerInserted(AbstractDBElement entity) {
        if (committed) {
            return;
        }
        addInsertion(entity);
    }

    void registerRemoved(AbstractDBElement entity) {
        if (committed || !deleted.add(entity)) {
            return;
        }
        deletions.add(entity);
        originals.computeIfAbsent(entity, this::loadedFields);
        changeSetsComputed = false;
    }

    @Override
    public List<Object> pendingUpdates() {
        ensureChangeSets();
        List<Object> updates = new ArrayList<>();
        changeSets.forEach((entity, changes) -> {
            if (!changes.isEmpty() && !deleted.contains(entity) && !inserted.contains(entity)) {
                updates.add(entity);
            }
        });
        return updates;
    }

    @Override
    public List<Object> pendingDeletes() {
        return new ArrayList<>(deletions);
    }

    @Override
    public Map<String, FieldChange> fieldChangeSet(Object entity) {
        ensureChangeSets();
        return changeSets.getOrDefault(entity, Map.of());
    }

    @Override
    public Map<String, Object> originalSnapshot(Object entity) {
        Map<String, Object> snapshot = originals.get(entity);
        if (snapshot == null && entity instanceof AbstractDBElement) {
            snapshot = loadedFields(entity);
        }
        return snapshot != null ? Collections.unmodifiableMap(snapshot) : Map.of();
    }

    @Override
    public Map<String, AssociationMapping> associationMappings(Class<?> entityClass) {
        return mappingCache.computeIfAbsent(entityClass, this::readAssociationMappings);
    }

    @Override
    public void recomputeChangeSets() {
        changeSets.clear();
        Map<Object, Map<String, Object>> candidates = new IdentityHashMap<>();
        for (Map.Entry<Object, EntityEntry> e : persistenceContext().reentrantSafeEntityEntries()) {
            Object entity = e.getKey();
            if (entity instanceof AbstractDBElement && e.getValue().getStatus() == Status.MANAGED
                    && e.getValue().getLoadedState() != null) {
                candidates.put(entity, loadedFields(entity, e.getValue()));
            }
        }
        // Снимок из track() снят до изменения, он точнее
        candidates.putAll(originals);

        candidates.forEach((entity, before) -> {
            Map<String, FieldChange> changes = new LinkedHashMap<>();
            ((AbstractDBElement) entity).readFields().forEach((field, newValue) -> {
                if (!before.containsKey(field)) {
                    return;
                }
                Object oldValue = before.get(field);
                if (!sameValue(oldValue, newValue)) {
                    changes.put(field, new FieldChange(oldValue, newValue));
                }
            });
            changeSets.put(entity, changes);
        });
        changeSetsComputed = true;
    }

    @Override
    public void commitPrimary(Consumer<Object> onCreated) {
        ensureOpen();
        log.debug("Фаза 1: {} новых, {} удаляемых, {} отслеживаемых сущностей",
                insertions.size(), deletions.size(), originals.size());
        try {
            announceInsertions(onCreated);
            for (Object entity : originals.keySet()) {
                if (!deleted.contains(entity) && !entityManager.contains(entity)) {
                    entityManager.merge(entity);
                }
            }
            for (AbstractDBElement entity : deferredRemovals) {
                entityManager.remove(entityManager.contains(entity) ? entity : entityManager.merge(entity));
            }
            entityManager.flush();
            // Сущности, получившие id только при сбросе
            announceInsertions(onCreated);
        } finally {
            committed = true;
            originals.clear();
            insertions.clear();
            inserted.clear();
            announced.clear();
            deletions.clear();
            deleted.clear();
            deferredRemovals.clear();
            changeSets.clear();
            close();
        }
    }

    @Override
    public boolean hasPendingWrites() {
        return entityManager.unwrap(Session.class).isDirty();
    }

    @Override
    public void flush() {
        entityManager.flush();
    }

    /**
     * Снимает регистрацию в потоке. Повторный вызов ничего не делает.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ACTIVE.get() == this) {
            if (previous != null) {
                ACTIVE.set(previous);
            } else {
                ACTIVE.remove();
            }
        }
    }

    static boolean sameValue(Object oldValue, Object newValue) {
        // Как и Hibernate: 5 и 5.00 - одно значение
        if (oldValue instanceof BigDecimal && newValue instanceof BigDecimal) {
            return ((BigDecimal) oldValue).compareTo((BigDecimal) newValue) == 0;
        }
        return Objects.equals(oldValue, newValue);
    }

    private void addInsertion(AbstractDBElement entity) {
        if (inserted.add(entity)) {
            insertions.add(entity);
            changeSetsComputed = false;
        }
    }

    // Индексный цикл: колбэк может сохранить новые сущности и удлинить список
    private void announceInsertions(Consumer<Object> onCreated) {
        for (int i = 0; i < insertions.size(); i++) {
            AbstractDBElement entity = insertions.get(i);
            if (deleted.contains(entity)) {
                continue;
            }
            if (!entityManager.contains(entity)) {
                entityManager.persist(entity);
            }
            if (entity.getId() != null && announced.add(entity)) {
                onCreated.accept(entity);
            }
        }
    }

    private PersistenceContext persistenceContext() {
        return entityManager.unwrap(SessionImplementor.class).getPersistenceContextInternal();
    }

    private Map<String, Object> loadedFields(Object entity) {
        EntityEntry entry = persistenceContext().getEntry(entity);
        if (entry == null || entry.getLoadedState() == null) {
            return new LinkedHashMap<>(((AbstractDBElement) entity).readFields());
        }
        return loadedFields(entity, entry);
    }

    /**
     * Состояние на момент загрузки, только по полям из readFields().
     */
    private static Map<String, Object> loadedFields(Object entity, EntityEntry entry) {
        String[] names = entry.getPersister().getPropertyNames();
        Object[] state = entry.getLoadedState();
        Map<String, Object> byName = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            byName.put(names[i], state[i]);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (String field : ((AbstractDBElement) entity).readFields().keySet()) {
            if (byName.containsKey(field)) {
                result.put(field, byName.get(field));
            }
        }
        return result;
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Единица работы уже зафиксирована");
        }
    }

    private void ensureChangeSets() {
        if (!changeSetsComputed) {
            recomputeChangeSets();
        }
    }

    private Map<String, AssociationMapping> readAssociationMappings(Class<?> entityClass) {
        Metamodel metamodel = entityManager.getMetamodel();
        EntityType<?> type = findEntityType(metamodel, entityClass);
        if (type == null) {
            return Map.of();
        }
        Map<String, AssociationMapping> result = new LinkedHashMap<>();
        for (Attribute<?, ?> attribute : type.getAttributes()) {
            if (!attribute.isAssociation() || attribute.isCollection()) {
                continue;
            }
            Class<?> target = attribute.getJavaType();
            String inverse = findInverseSide(metamodel, target, attribute.getName(), type.getJavaType());
            result.put(attribute.getName(), new AssociationMapping(attribute.getName(), target, inverse));
        }
        return result;
    }

    // Прокси Hibernate - подкласс сущности, поэтому идём вверх по иерархии
    private static EntityType<?> findEntityType(Metamodel metamodel, Class<?> entityClass) {
        for (Class<?> c = entityClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (EntityType<?> type : metamodel.getEntities()) {
                if (type.getJavaType() == c) {
                    return type;
                }
            }
        }
        return null;
    }

    private static String findInverseSide(Metamodel metamodel, Class<?> target, String field, Class<?> ownerClass) {
        EntityType<?> targetType = findEntityType(metamodel, target);
        if (targetType == null) {
            return null;
        }
        for (PluralAttribute<?, ?, ?> plural : targetType.getPluralAttributes()) {
            if (!plural.getElementType().getJavaType().isAssignableFrom(ownerClass)) {
                continue;
            }
            Field javaField = findField(plural.getDeclaringType().getJavaType(), plural.getName());
            OneToMany oneToMany = javaField != null ? javaField.getAnnotation(OneToMany.class) : null;
            if (oneToMany != null && field.equals(oneToMany.mappedBy())) {
                return plural.getName();
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                if (f.getName().equals(name)) {
                    return f;
                }
            }
        }
        return null;
    }
}
