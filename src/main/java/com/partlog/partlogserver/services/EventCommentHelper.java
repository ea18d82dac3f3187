package com.partlog.partlogserver.services;

import com.partlog.partlogserver.entity.log.AbstractLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Комментарий пользователя ("причина изменения") для текущего потока.
 * Ставится до сброса, читается всеми записями этого сброса и очищается
 * после его завершения.
 */
@Component
@Slf4j
public class EventCommentHelper {

    private final ThreadLocal<String> message = new ThreadLocal<>();

    public void setMessage(String newMessage) {
        if (newMessage != null && newMessage.length() > AbstractLogEntry.MAX_COMMENT_LENGTH) {
            log.warn("Комментарий к изменению обрезан до {} символов", AbstractLogEntry.MAX_COMMENT_LENGTH);
            newMessage = newMessage.substring(0, AbstractLogEntry.MAX_COMMENT_LENGTH);
        }
        if (newMessage == null || newMessage.isBlank()) {
            message.remove();
        } else {
            message.set(newMessage);
        }
    }

    public String getMessage() {
        return message.get();
    }

    public boolean isMessageSet() {
        return message.get() != null;
    }

    public void clearMessage() {
        message.remove();
    }

    /**
     * Ставит комментарий на время блока try-with-resources.
     */
    public CommentScope withMessage(String newMessage) {
        setMessage(newMessage);
        return this::clearMessage;
    }

    @FunctionalInterface
    public interface CommentScope extends AutoCloseable {
        @Override
        void close();
    }
}
