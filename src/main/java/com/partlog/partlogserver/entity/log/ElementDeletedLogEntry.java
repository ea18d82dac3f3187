package com.partlog.partlogserver.entity.log;

import com.partlog.partlogserver.entity.AbstractDBElement;
import com.partlog.partlogserver.entity.AbstractNamedDBElement;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@DiscriminatorValue(LogEntryType.ELEMENT_DELETED_CODE)
@NoArgsConstructor
public class ElementDeletedLogEntry extends AbstractLogEntry implements LogWithOldData {

    private static final String KEY_OLD_NAME = "n";
    private static final String KEY_OLD_DATA = "d";

    public ElementDeletedLogEntry(AbstractDBElement deletedElement) {
        setLevel(LogLevel.INFO);
        setTargetElement(deletedElement);
        // Имя сохраняем, чтобы запись оставалась читаемой после удаления
        if (deletedElement instanceof AbstractNamedDBElement) {
            String name = ((AbstractNamedDBElement) deletedElement).getName();
            if (name != null) {
                getExtra().put(KEY_OLD_NAME, name);
            }
        }
    }

    @Override
    public LogEntryType getType() {
        return LogEntryType.ELEMENT_DELETED;
    }

    public String getOldName() {
        Object value = getExtra().get(KEY_OLD_NAME);
        return value != null ? value.toString() : null;
    }

    @Override
    public boolean hasOldDataInformation() {
        return getExtra().get(KEY_OLD_DATA) instanceof Map;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getOldData() {
        Object data = getExtra().get(KEY_OLD_DATA);
        if (data instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) data);
        }
        return Map.of();
    }

    @Override
    public void setOldData(Map<String, Object> oldData) {
        getExtra().put(KEY_OLD_DATA, new LinkedHashMap<>(oldData));
    }
}
