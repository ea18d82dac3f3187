package com.partlog.partlogserver.config;

import com.partlog.partlogserver.services.AssociationLogPolicy;
import com.partlog.partlogserver.services.ChangeSetBuilder;
import com.partlog.partlogserver.services.FieldRedactionPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class ChangeLogConfig {

    private final ChangeLogProperties properties;

    // Таблицы политик статические, загружаются один раз при старте
    @Bean
    public FieldRedactionPolicy fieldRedactionPolicy() {
        return FieldRedactionPolicy.defaultPolicy();
    }

    @Bean
    public AssociationLogPolicy associationLogPolicy() {
        return AssociationLogPolicy.defaultPolicy();
    }

    @Bean
    public ChangeSetBuilder changeSetBuilder(FieldRedactionPolicy fieldRedactionPolicy) {
        return new ChangeSetBuilder(fieldRedactionPolicy);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logSettings() {
        log.info("Журнал изменений: enabled={}, minLevel={}, changedFields={}, changedData={}, removedData={}",
                properties.isEnabled(), properties.getMinimumLevel(), properties.isSaveChangedFields(),
                properties.isSaveChangedData(), properties.isSaveRemovedData());
    }
}
