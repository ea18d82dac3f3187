package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.EntityKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Раскрытие таблиц "тип -> имена полей" по иерархии типов.
 * Считается один раз, дальше только поиск в EnumMap.
 */
final class EntityKindTables {

    private EntityKindTables() {
    }

    static Map<EntityKind, Set<String>> closure(Map<EntityKind, ? extends Collection<String>> table) {
        Map<EntityKind, Set<String>> result = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            Set<String> names = new LinkedHashSet<>();
            // Сначала поля предков, затем собственные
            for (EntityKind candidate : EntityKind.values()) {
                Collection<String> own = table.get(candidate);
                if (own != null && kind.isA(candidate)) {
                    names.addAll(own);
                }
            }
            result.put(kind, Collections.unmodifiableSet(names));
        }
        return Collections.unmodifiableMap(result);
    }
}
