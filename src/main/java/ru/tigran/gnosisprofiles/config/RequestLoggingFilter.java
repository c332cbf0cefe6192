package ru.tigran.gnosisprofiles.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;
import ru.tigran.gnosisprofiles.security.ApiKeyAuthenticationFilter;
import ru.tigran.gnosisprofiles.service.AIGatewayService;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Logs every API request (headers and body) before authentication runs, so rejected
 * requests are logged too. Credential headers are redacted. Also exposes the
 * X-Correlation-ID header to log lines as the MDC key "correlationId".
 */
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    static final String REDACTED = "***REDACTED***";
    // Bytes of the body that are read ahead and logged
    static final int MAX_LOGGED_BODY_LENGTH = 2000;
    static final String TRUNCATED_SUFFIX = "...(truncated)";

    private static final Set<String> SENSITIVE_HEADERS = Set.of(
            ApiKeyAuthenticationFilter.API_KEY_HEADER.toLowerCase(),
            "authorization",
            "cookie",
            "proxy-authorization"
    );

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return ApiKeyAuthenticationFilter.isDocumentationPath(request);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        long startTime = System.currentTimeMillis();
        String correlationId = request.getHeader(AIGatewayService.CORRELATION_ID_HEADER);
        if (correlationId != null && !correlationId.isBlank()) {
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        }

        LoggedBodyRequest loggedRequest = new LoggedBodyRequest(request);

        try {
            log.info("Request: {} {} - Headers: {}", request.getMethod(), request.getRequestURI(), redactHeaders(request));
            log.info("Request body: {}", loggedRequest.getLoggedBody());

            filterChain.doFilter(loggedRequest, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response.getStatus();

            if (status >= 400) {
                log.warn("Response: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else {
                log.debug("Response: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            }
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Collects request headers with credential values replaced.
     *
     * @param request HTTP request
     * @return header name to (possibly redacted) value, in arrival order
     */
    static Map<String, String> redactHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            String value = SENSITIVE_HEADERS.contains(name.toLowerCase())
                    ? REDACTED
                    : String.join(",", Collections.list(request.getHeaders(name)));
            headers.put(name, value);
        }
        return headers;
    }

    /**
     * Request wrapper that reads only the first bytes of the body for the log line, then replays
     * them ahead of the unread rest of the original stream. The full body is never buffered here.
     */
    private static class LoggedBodyRequest extends HttpServletRequestWrapper {

        private final byte[] head;
        private final boolean truncated;
        private final ServletInputStream inputStream;
        private BufferedReader reader;

        LoggedBodyRequest(HttpServletRequest request) throws IOException {
            super(request);
            ServletInputStream original = request.getInputStream();
            byte[] peeked = original.readNBytes(MAX_LOGGED_BODY_LENGTH + 1);
            this.truncated = peeked.length > MAX_LOGGED_BODY_LENGTH;
            this.head = truncated ? Arrays.copyOf(peeked, MAX_LOGGED_BODY_LENGTH) : peeked;
            this.inputStream = new ReplayingInputStream(new ByteArrayInputStream(peeked), original);
        }

        String getLoggedBody() {
            String body = new String(head, charset());
            return truncated ? body + TRUNCATED_SUFFIX : body;
        }

        @Override
        public ServletInputStream getInputStream() {
            return inputStream;
        }

        @Override
        public BufferedReader getReader() {
            if (reader == null) {
                reader = new BufferedReader(new InputStreamReader(inputStream, charset()));
            }
            return reader;
        }

        private Charset charset() {
            String encoding = getCharacterEncoding();
            return encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
        }
    }

    /**
     * Serves the peeked bytes first, then keeps reading from the original stream.
     */
    private static class ReplayingInputStream extends ServletInputStream {

        private final ByteArrayInputStream peeked;
        private final ServletInputStream remainder;

        ReplayingInputStream(ByteArrayInputStream peeked, ServletInputStream remainder) {
            this.peeked = peeked;
            this.remainder = remainder;
        }

        @Override
        public boolean isFinished() {
            return peeked.available() == 0 && remainder.isFinished();
        }

        @Override
        public boolean isReady() {
            return peeked.available() > 0 || remainder.isReady();
        }

        @Override
        public void setReadListener(ReadListener readListener) {
            remainder.setReadListener(readListener);
        }

        @Override
        public int read() throws IOException {
            if (peeked.available() > 0) {
                return peeked.read();
            }
            return remainder.read();
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) {
                return 0;
            }
            if (peeked.available() > 0) {
                return peeked.read(b, off, len);
            }
            return remainder.read(b, off, len);
        }
    }
}
