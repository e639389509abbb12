package com.assignmenttracker.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void echoesIncomingRequestIdAndExposesItToLogging() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/students");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "  abc-123  ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                                   HttpServletResponse res) {
                seenInMdc.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
            }
        }));

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("abc-123");
        assertThat(seenInMdc.get()).isEqualTo("abc-123");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
    }

    @Test
    void generatesRequestIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/students");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String requestId = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(requestId).isNotBlank();
        assertThat(UUID.fromString(requestId)).isNotNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "has space", "line\nbreak", "<script>", "oversized-request-id-oversized-request-id-oversized-request-id-xx"})
    void replacesUnusableRequestIds(String supplied) {
        String requestId = RequestIdFilter.acceptOrGenerate(supplied);

        assertThat(requestId).isNotEqualTo(supplied);
        assertThat(UUID.fromString(requestId)).isNotNull();
    }

    @Test
    void keepsTraceStyleRequestIds() {
        assertThat(RequestIdFilter.acceptOrGenerate("gw:7f3a.b2_01")).isEqualTo("gw:7f3a.b2_01");
    }
}
