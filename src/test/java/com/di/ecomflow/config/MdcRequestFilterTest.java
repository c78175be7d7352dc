package com.di.ecomflow.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcRequestFilter Tests")
class MdcRequestFilterTest {

    private final MdcRequestFilter filter = new MdcRequestFilter();

    @Test
    @DisplayName("Request id and path are visible to the handler and cleared afterwards")
    void testDoFilter_PopulatesAndClearsMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pipeline/run");
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> {
            seen.put(MdcRequestFilter.REQUEST_ID, MDC.get(MdcRequestFilter.REQUEST_ID));
            seen.put(MdcRequestFilter.REQUEST_PATH, MDC.get(MdcRequestFilter.REQUEST_PATH));
        };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertTrue(seen.get(MdcRequestFilter.REQUEST_ID).startsWith("req-"));
        assertEquals("/api/pipeline/run", seen.get(MdcRequestFilter.REQUEST_PATH));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }

    @Test
    @DisplayName("MDC is cleared when the handler fails")
    void testDoFilter_ClearsMdcOnFailure() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/pipeline/runs/latest");
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class,
                () -> filter.doFilter(request, new MockHttpServletResponse(), chain));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }

    @Test
    @DisplayName("Caller's request id is reused and echoed in the response header")
    void testDoFilter_ReusesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pipeline/run");
        request.addHeader(MdcRequestFilter.REQUEST_ID_HEADER, "req-from-caller");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> seen.put(MdcRequestFilter.REQUEST_ID, MDC.get(MdcRequestFilter.REQUEST_ID));

        filter.doFilter(request, response, chain);

        assertEquals("req-from-caller", seen.get(MdcRequestFilter.REQUEST_ID));
        assertEquals("req-from-caller", response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER));
    }

    @Test
    @DisplayName("Generated request id is echoed in the response header")
    void testDoFilter_EchoesGeneratedRequestId() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/api/pipeline/runs/latest"), response, (req, res) -> { });

        assertTrue(response.getHeader(MdcRequestFilter.REQUEST_ID_HEADER).startsWith("req-"));
    }
}
