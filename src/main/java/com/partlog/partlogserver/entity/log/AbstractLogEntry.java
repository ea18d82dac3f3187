package com.partlog.partlogserver.entity.log;

import com.partlog.partlogserver.converter.LogExtraConverter;
import com.partlog.partlogserver.entity.AbstractDBElement;
import com.partlog.partlogserver.entity.EntityKind;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Общая оболочка записи журнала. Доп. данные конкретного типа лежат в
 * компактной карте extra с однобуквенными ключами.
 */
@Entity
@Table(name = "log_entries")
@Inheritance(strategy = InheritanceType.SINGLE_TABLE)
@DiscriminatorColumn(name = "type", discriminatorType = DiscriminatorType.INTEGER)
@Getter
@Setter
public abstract class AbstractLogEntry extends AbstractDBElement implements LogWithComment {

    public static final int MAX_COMMENT_LENGTH = 255;

    protected static final String KEY_COMMENT = "m";

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", length = 32)
    private EntityKind targetType;

    @Column(name = "target_id")
    private Long targetId;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_level", length = 16)
    private LogLevel level = LogLevel.INFO;

    private String username;

    // Выставляется при сохранении, не оркестратором
    @Column(name = "logged_at")
    private LocalDateTime timestamp;

    @Convert(converter = LogExtraConverter.class)
    @Column(name = "extra", length = 65535)
    private Map<String, Object> extra = new LinkedHashMap<>();

    @PrePersist
    public void stampTimestamp() {
        if (this.timestamp == null) {
            this.timestamp = LocalDateTime.now();
        }
    }

    public abstract LogEntryType getType();

    public void setTargetElement(AbstractDBElement element) {
        this.targetType = element.getKind();
        this.targetId = element.getId();
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.LOG_ENTRY;
    }

    @Override
    public boolean hasComment() {
        return extra.get(KEY_COMMENT) != null;
    }

    @Override
    public String getComment() {
        Object value = extra.get(KEY_COMMENT);
        return value != null ? value.toString() : null;
    }

    @Override
    public LogWithComment setComment(String comment) {
        if (comment == null) {
            extra.remove(KEY_COMMENT);
        } else {
            extra.put(KEY_COMMENT, comment.length() > MAX_COMMENT_LENGTH
                    ? comment.substring(0, MAX_COMMENT_LENGTH)
                    : comment);
        }
        return this;
    }

    @Override
    public Map<String, Object> readFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("targetType", targetType);
        fields.put("targetId", targetId);
        fields.put("level", level);
        fields.put("username", username);
        fields.put("timestamp", timestamp);
        fields.put("extra", extra);
        return fields;
    }
}
