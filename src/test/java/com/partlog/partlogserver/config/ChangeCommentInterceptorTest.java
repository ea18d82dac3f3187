package com.partlog.partlogserver.config;

import com.partlog.partlogserver.services.EventCommentHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeCommentInterceptorTest {

    private final EventCommentHelper commentHelper = new EventCommentHelper();
    private final ChangeCommentInterceptor interceptor = new ChangeCommentInterceptor(commentHelper);
    private final MockHttpServletResponse response = new MockHttpServletResponse();

    @AfterEach
    void tearDown() {
        commentHelper.clearMessage();
    }

    @Test
    @DisplayName("Комментарий из заголовка")
    void shouldReadHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/parts/1");
        request.addHeader(ChangeCommentInterceptor.COMMENT_HEADER, "  заменён поставщик ");
        request.setParameter(ChangeCommentInterceptor.COMMENT_PARAM, "из параметра");

        assertThat(interceptor.preHandle(request, response, new Object())).isTrue();

        assertThat(commentHelper.getMessage()).isEqualTo("заменён поставщик");
    }

    @Test
    @DisplayName("Без заголовка берётся параметр запроса")
    void shouldFallBackToParameter() {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/parts/1");
        request.setParameter(ChangeCommentInterceptor.COMMENT_PARAM, "списание");

        interceptor.preHandle(request, response, new Object());

        assertThat(commentHelper.getMessage()).isEqualTo("списание");
    }

    @Test
    @DisplayName("Без комментария ничего не ставится")
    void shouldLeaveUnsetWithoutComment() {
        interceptor.preHandle(new MockHttpServletRequest("GET", "/parts"), response, new Object());

        assertThat(commentHelper.isMessageSet()).isFalse();
    }

    @Test
    @DisplayName("После запроса комментарий очищается")
    void shouldClearAfterCompletion() {
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/parts/1");
        request.addHeader(ChangeCommentInterceptor.COMMENT_HEADER, "x");
        interceptor.preHandle(request, response, new Object());

        interceptor.afterCompletion(request, response, new Object(), null);

        assertThat(commentHelper.isMessageSet()).isFalse();
    }
}
