package com.partlog.partlogserver.entity.log;

import com.partlog.partlogserver.entity.AbstractDBElement;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;
import lombok.NoArgsConstructor;

@Entity
@DiscriminatorValue(LogEntryType.ELEMENT_CREATED_CODE)
@NoArgsConstructor
public class ElementCreatedLogEntry extends AbstractLogEntry {

    private static final String KEY_INSTOCK = "i";

    public ElementCreatedLogEntry(AbstractDBElement newElement) {
        setLevel(LogLevel.INFO);
        setTargetElement(newElement);
    }

    @Override
    public LogEntryType getType() {
        return LogEntryType.ELEMENT_CREATED;
    }

    /**
     * Количество на складе в момент создания, если было сохранено.
     */
    public String getCreationInstockValue() {
        Object value = getExtra().get(KEY_INSTOCK);
        return value != null ? value.toString() : null;
    }

    public boolean hasCreationInstockValue() {
        return getCreationInstockValue() != null;
    }

    public void setCreationInstockValue(String value) {
        getExtra().put(KEY_INSTOCK, value);
    }
}
