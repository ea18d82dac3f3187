package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.EntityKind;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Поля, которые нельзя сохранять в журнал (пароли, секреты 2FA и т.п.).
 * Запрет для типа действует и для всех его подтипов.
 */
public class FieldRedactionPolicy {

    public static final Map<EntityKind, List<String>> DEFAULT_BLACKLIST = Map.of(
            EntityKind.USER, List.of("password", "needPwChange", "googleAuthenticatorSecret", "backupCodes",
                    "trustedDeviceCookieVersion", "pwResetToken", "backupCodesGenerationDate")
    );

    private final Map<EntityKind, Set<String>> blacklist;

    public FieldRedactionPolicy(Map<EntityKind, ? extends Collection<String>> table) {
        this.blacklist = EntityKindTables.closure(table);
    }

    public static FieldRedactionPolicy defaultPolicy() {
        return new FieldRedactionPolicy(DEFAULT_BLACKLIST);
    }

    /**
     * true, если для типа есть хоть одно запрещённое поле и нужна фильтрация.
     */
    public boolean isRestricted(EntityKind kind) {
        return !blacklist.get(kind).isEmpty();
    }

    public boolean shouldFieldBeSaved(EntityKind kind, String fieldName) {
        return !blacklist.get(kind).contains(fieldName);
    }

    /**
     * Копия карты без запрещённых ключей, порядок остальных сохраняется.
     */
    public <V> Map<String, V> filter(EntityKind kind, Map<String, V> fields) {
        Map<String, V> result = new LinkedHashMap<>();
        if (!isRestricted(kind)) {
            result.putAll(fields);
            return result;
        }
        fields.forEach((name, value) -> {
            if (shouldFieldBeSaved(kind, name)) {
                result.put(name, value);
            }
        });
        return result;
    }

    public List<String> filterFieldNames(EntityKind kind, Collection<String> fieldNames) {
        return fieldNames.stream()
                .filter(name -> shouldFieldBeSaved(kind, name))
                .collect(Collectors.toList());
    }
}
