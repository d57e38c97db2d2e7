package com.phillippitts.windowanalysis.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;
    private final Map<String, String> seen = new HashMap<>();
    private final FilterChain capturingChain = (req, res) -> seen.putAll(ThreadContext.getImmutableContext());

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = new MockHttpServletRequest("POST", "/api/analyses");
        response = new MockHttpServletResponse();
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void echoesCallerRequestId() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "req-123");

        filter.doFilter(request, response, capturingChain);

        assertThat(seen).containsEntry("requestId", "req-123");
        assertThat(response.getHeader("X-Request-ID")).isEqualTo("req-123");
    }

    @Test
    void generatesRequestIdWhenHeaderIsBlank() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "   ");

        filter.doFilter(request, response, capturingChain);

        assertThat(seen.get("requestId")).matches(UUID_PATTERN);
        assertThat(response.getHeader("X-Request-ID")).isEqualTo(seen.get("requestId"));
    }

    @Test
    void populatesSessionMethodAndUri() throws ServletException, IOException {
        request.addHeader("X-Session-ID", "session-9");

        filter.doFilter(request, response, capturingChain);

        assertThat(seen)
                .containsEntry("sessionId", "session-9")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/analyses");
    }

    @Test
    void skipsBlankSessionId() throws ServletException, IOException {
        request.addHeader("X-Session-ID", " ");

        filter.doFilter(request, response, capturingChain);

        assertThat(seen).doesNotContainKey("sessionId");
    }

    @Test
    void leavesNoKeysBehind() throws ServletException, IOException {
        request.addHeader("X-Request-ID", "req-1");

        filter.doFilter(request, response, capturingChain);

        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void restoresContextEvenWhenChainThrows() {
        ThreadContext.put("analysisId", "outer");
        FilterChain failing = (req, res) -> {
            throw new ServletException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, failing))
                .isInstanceOf(ServletException.class)
                .hasMessage("boom");

        assertThat(ThreadContext.getImmutableContext()).containsOnlyKeys("analysisId");
    }
}
