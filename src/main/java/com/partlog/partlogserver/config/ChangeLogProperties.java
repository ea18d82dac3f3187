package com.partlog.partlogserver.config;

import com.partlog.partlogserver.entity.log.LogEntryType;
import com.partlog.partlogserver.entity.log.LogLevel;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumSet;
import java.util.Set;

@ConfigurationProperties(prefix = "partlog.changelog")
@Validated
@Getter
@Setter
public class ChangeLogProperties {

    private boolean enabled = true;

    @NotNull
    private LogLevel minimumLevel = LogLevel.INFO;

    // Список имён изменённых полей при редактировании
    private boolean saveChangedFields = true;

    // Полный дифф (старые значения) при редактировании и удалении, важнее saveChangedFields
    private boolean saveChangedData = false;

    // Старые значения при удалении
    private boolean saveRemovedData = true;

    private Set<LogEntryType> blacklist = EnumSet.noneOf(LogEntryType.class);

    // Пустой whitelist = разрешены все типы
    private Set<LogEntryType> whitelist = EnumSet.noneOf(LogEntryType.class);
}
