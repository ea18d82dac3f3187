package com.partlog.partlogserver.services;

import com.partlog.partlogserver.config.ChangeLogProperties;
import com.partlog.partlogserver.entity.log.AbstractLogEntry;
import com.partlog.partlogserver.repository.LogEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

/**
 * Приёмник записей журнала: фильтрует по настройкам, проставляет автора
 * и сохраняет через репозиторий (в текущий контекст персистентности).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLogger {

    public static final String ANONYMOUS_USER = "anonymous";

    private final LogEntryRepository logEntryRepository;
    private final ChangeLogProperties properties;

    /**
     * @return true, если запись принята к сохранению
     */
    public boolean log(AbstractLogEntry entry) {
        if (!shouldBeAdded(entry)) {
            log.debug("Запись {} для {}#{} отброшена фильтром журнала",
                    entry.getType(), entry.getTargetType(), entry.getTargetId());
            return false;
        }
        if (entry.getUsername() == null) {
            entry.setUsername(currentUsername());
        }
        logEntryRepository.save(entry);
        return true;
    }

    /**
     * То же, что {@link #log}, но сразу пишет в базу.
     */
    public boolean logAndFlush(AbstractLogEntry entry) {
        boolean added = log(entry);
        if (added) {
            logEntryRepository.flush();
        }
        return added;
    }

    public boolean shouldBeAdded(AbstractLogEntry entry) {
        if (!properties.isEnabled()) return false;
        if (!entry.getLevel().isAtLeast(properties.getMinimumLevel())) return false;
        if (properties.getBlacklist().contains(entry.getType())) return false;
        return properties.getWhitelist().isEmpty() || properties.getWhitelist().contains(entry.getType());
    }

    private String currentUsername() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken) {
            return ANONYMOUS_USER;
        }
        return auth.getName();
    }
}
