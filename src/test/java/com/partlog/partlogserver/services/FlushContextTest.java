package com.partlog.partlogserver.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FlushContext")
class FlushContextTest {

    @Test
    @DisplayName("Фазы проходят по порядку")
    void shouldAdvanceThroughPhases() {
        FlushContext context = new FlushContext(new InMemoryUnitOfWork(), "c");
        assertThat(context.getPhase()).isEqualTo(FlushPhase.SCANNING);

        context.advance(FlushPhase.SCANNING, FlushPhase.AWAITING_IDENTIFIERS);
        context.advance(FlushPhase.AWAITING_IDENTIFIERS, FlushPhase.DRAINING_DEFERRED);
        context.finish();

        assertThat(context.getPhase()).isEqualTo(FlushPhase.DONE);
        assertThat(context.hasComment()).isTrue();
    }

    @Test
    @DisplayName("Переход из неверной фазы запрещён")
    void shouldRejectOutOfOrderTransition() {
        FlushContext context = new FlushContext(new InMemoryUnitOfWork(), null);

        assertThatThrownBy(() -> context.advance(FlushPhase.AWAITING_IDENTIFIERS, FlushPhase.DRAINING_DEFERRED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SCANNING");
        assertThat(context.hasComment()).isFalse();
    }
}
