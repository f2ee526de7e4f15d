package com.contactcare.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void suppliedIdIsEchoedAndVisibleToDownstreamLogging() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/family-contact/statistics");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  case-7781  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                                   HttpServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        }));

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("case-7781");
        assertThat(seenInMdc.get()).isEqualTo("case-7781");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void unsafeOrMissingIdIsReplacedWithUuid() {
        String fromInjection = RequestIdFilter.acceptOrGenerate("abc\r\nforged log line");
        String fromOversized = RequestIdFilter.acceptOrGenerate("x".repeat(65));
        String fromMissing = RequestIdFilter.acceptOrGenerate(null);

        assertThat(UUID.fromString(fromInjection)).isNotNull();
        assertThat(UUID.fromString(fromOversized)).isNotNull();
        assertThat(UUID.fromString(fromMissing)).isNotNull();
    }
}
