package com.partlog.partlogserver.entity.log;

import com.partlog.partlogserver.entity.AbstractDBElement;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@DiscriminatorValue(LogEntryType.ELEMENT_EDITED_CODE)
@NoArgsConstructor
public class ElementEditedLogEntry extends AbstractLogEntry implements LogWithOldData {

    private static final String KEY_FIELDS = "f";
    private static final String KEY_OLD_DATA = "d";

    public ElementEditedLogEntry(AbstractDBElement changedElement) {
        setLevel(LogLevel.INFO);
        setTargetElement(changedElement);
    }

    @Override
    public LogEntryType getType() {
        return LogEntryType.ELEMENT_EDITED;
    }

    public boolean hasChangedFieldsInfo() {
        return getExtra().containsKey(KEY_FIELDS) || hasOldDataInformation();
    }

    /**
     * Имена изменённых полей. Если сохранены старые данные, берутся их ключи.
     */
    @SuppressWarnings("unchecked")
    public List<String> getChangedFields() {
        if (hasOldDataInformation()) {
            return new ArrayList<>(getOldData().keySet());
        }
        Object fields = getExtra().get(KEY_FIELDS);
        if (fields instanceof List) {
            return Collections.unmodifiableList((List<String>) fields);
        }
        return List.of();
    }

    public void setChangedFields(List<String> changedFields) {
        getExtra().put(KEY_FIELDS, new ArrayList<>(changedFields));
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
