package com.partlog.partlogserver.config;

import com.partlog.partlogserver.services.EventCommentHelper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Переносит комментарий пользователя из запроса в {@link EventCommentHelper}
 * и убирает его после обработки, чтобы он не достался следующему запросу
 * в этом же потоке.
 */
@Component
@RequiredArgsConstructor
public class ChangeCommentInterceptor implements HandlerInterceptor {

    public static final String COMMENT_HEADER = "X-Change-Comment";
    public static final String COMMENT_PARAM = "_comment";

    private final EventCommentHelper commentHelper;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String comment = request.getHeader(COMMENT_HEADER);
        if (comment == null || comment.isBlank()) {
            comment = request.getParameter(COMMENT_PARAM);
        }
        if (comment != null && !comment.isBlank()) {
            commentHelper.setMessage(comment.trim());
        }
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        commentHelper.clearMessage();
    }
}
