package com.phillippitts.voiceorders.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every servlet request with Log4j2 ThreadContext keys.
 *
 * <ul>
 *   <li>requestId: the X-Request-ID header, or a generated UUID. Echoed back on the response.</li>
 *   <li>method and uri of the request.</li>
 *   <li>endpoint: {@code voice} for {@code /api/ws}, {@code transcript} for
 *       {@code /api/transcription}, {@code http} otherwise.</li>
 *   <li>upgrade: {@code websocket} on handshake requests, so handshake failures can be told apart
 *       from plain HTTP calls to the same path.</li>
 * </ul>
 * The context is cleared when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String VOICE_PATH = "/api/ws";
    static final String TRANSCRIPT_PATH = "/api/transcription";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestId(http);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                ThreadContext.put("endpoint", endpoint(http.getRequestURI()));
                if ("websocket".equalsIgnoreCase(http.getHeader("Upgrade"))) {
                    ThreadContext.put("upgrade", "websocket");
                }
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String endpoint(String uri) {
        if (VOICE_PATH.equals(uri)) {
            return "voice";
        }
        if (TRANSCRIPT_PATH.equals(uri)) {
            return "transcript";
        }
        return "http";
    }

    private static String requestId(HttpServletRequest http) {
        String header = http.getHeader(REQUEST_ID_HEADER);
        return (header == null || header.isBlank()) ? UUID.randomUUID().toString() : header.trim();
    }
}
