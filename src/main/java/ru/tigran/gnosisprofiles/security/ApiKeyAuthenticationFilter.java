package ru.tigran.gnosisprofiles.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ErrorResponse;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Shared-secret authentication filter.
 * Every request outside the documentation routes must carry the configured key in the
 * X-API-KEY header; otherwise the request is answered with 401 before it reaches a controller.
 */
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-KEY";
    public static final List<String> DOCUMENTATION_PATH_PREFIXES = List.of("/docs", "/swagger-ui", "/v3/api-docs");

    private static final String PRINCIPAL = "api-client";

    private final byte[] expectedKey;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthenticationFilter(String apiKey, ObjectMapper objectMapper) {
        this.expectedKey = apiKey == null ? new byte[0] : apiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return isDocumentationPath(request);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String providedKey = request.getHeader(API_KEY_HEADER);

        if (providedKey == null) {
            log.warn("No {} header on {} {}", API_KEY_HEADER, request.getMethod(), request.getRequestURI());
            writeError(response, objectMapper, ErrorCode.MISSING_API_KEY);
            return;
        }

        if (!matches(providedKey)) {
            log.warn("Invalid {} on {} {}", API_KEY_HEADER, request.getMethod(), request.getRequestURI());
            writeError(response, objectMapper, ErrorCode.INVALID_API_KEY);
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                PRINCIPAL,
                null,
                List.of(new SimpleGrantedAuthority("ROLE_API_CLIENT"))
        );
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private boolean matches(String providedKey) {
        // An unset key never authenticates anything
        if (expectedKey.length == 0) {
            return false;
        }
        return MessageDigest.isEqual(expectedKey, providedKey.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Checks whether the request targets the API documentation (Swagger UI or OpenAPI JSON),
     * the only routes served without an API key.
     *
     * @param request HTTP request
     * @return true for documentation routes
     */
    public static boolean isDocumentationPath(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return DOCUMENTATION_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    static void writeError(HttpServletResponse response, ObjectMapper objectMapper, ErrorCode errorCode) throws IOException {
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(errorCode));
    }
}
