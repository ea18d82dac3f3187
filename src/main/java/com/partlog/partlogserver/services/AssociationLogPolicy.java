package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.EntityKind;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * При удалении элементов этих типов пишется CollectionElementDeleted
 * для перечисленных связей (родитель теряет элемент обратной коллекции).
 */
public class AssociationLogPolicy {

    public static final Map<EntityKind, List<String>> DEFAULT_WHITELIST = Map.of(
            EntityKind.PART_LOT, List.of("part"),
            EntityKind.ORDERDETAIL, List.of("part"),
            EntityKind.PRICEDETAIL, List.of("orderdetail"),
            EntityKind.ATTACHMENT, List.of("element")
    );

    private final Map<EntityKind, Set<String>> whitelist;

    public AssociationLogPolicy(Map<EntityKind, ? extends Collection<String>> table) {
        this.whitelist = EntityKindTables.closure(table);
    }

    public static AssociationLogPolicy defaultPolicy() {
        return new AssociationLogPolicy(DEFAULT_WHITELIST);
    }

    public boolean isWhitelisted(EntityKind kind) {
        return !whitelist.get(kind).isEmpty();
    }

    public Set<String> getTriggerAssociations(EntityKind kind) {
        return whitelist.get(kind);
    }
}
