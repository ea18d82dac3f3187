package com.partlog.partlogserver.services;

import lombok.Getter;

/**
 * Состояние одного сброса. Комментарий фиксируется в начале и один и тот же
 * для всех записей сброса, включая записи о создании.
 */
@Getter
public class FlushContext {

    private final UnitOfWork unitOfWork;
    private final String comment;
    private FlushPhase phase = FlushPhase.SCANNING;

    public FlushContext(UnitOfWork unitOfWork, String comment) {
        this.unitOfWork = unitOfWork;
        this.comment = comment;
    }

    public boolean hasComment() {
        return comment != null;
    }

    void requirePhase(FlushPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("Ожидалась фаза " + expected + ", текущая фаза " + phase);
        }
    }

    void advance(FlushPhase expected, FlushPhase next) {
        requirePhase(expected);
        phase = next;
    }

    void finish() {
        phase = FlushPhase.DONE;
    }
}
