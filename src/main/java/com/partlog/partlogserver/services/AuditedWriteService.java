package com.partlog.partlogserver.services;

import jakarta.persistence.EntityManager;
import jakarta.persistence.FlushModeType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Consumer;

/**
 * Точка входа для изменений с журналированием: вызывающий код регистрирует
 * изменения в единице работы, затем запускается цикл журнала.
 */
@Service
@RequiredArgsConstructor
public class AuditedWriteService {

    private final EntityManager entityManager;
    private final ChangeCaptureService changeCaptureService;
    private final EventCommentHelper commentHelper;

    @Transactional(rollbackFor = Exception.class)
    public void execute(Consumer<JpaUnitOfWork> work) {
        // Запросы внутри work не сбрасывают правки до сканирования
        FlushModeType flushMode = entityManager.getFlushMode();
        entityManager.setFlushMode(FlushModeType.COMMIT);
        try (JpaUnitOfWork unitOfWork = new JpaUnitOfWork(entityManager)) {
            work.accept(unitOfWork);
            changeCaptureService.flush(unitOfWork);
        } finally {
            entityManager.setFlushMode(flushMode);
        }
    }

    /**
     * То же с комментарием-причиной, который попадёт во все записи этого сброса.
     */
    @Transactional(rollbackFor = Exception.class)
    public void execute(String comment, Consumer<JpaUnitOfWork> work) {
        try (EventCommentHelper.CommentScope ignored = commentHelper.withMessage(comment)) {
            execute(work);
        }
    }
}
