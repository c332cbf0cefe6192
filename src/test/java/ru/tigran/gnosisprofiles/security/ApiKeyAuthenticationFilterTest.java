package ru.tigran.gnosisprofiles.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ApiKeyAuthenticationFilter тесты")
class ApiKeyAuthenticationFilterTest {

    private ApiKeyAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ApiKeyAuthenticationFilter("secret-key", new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("верный ключ аутентифицирует запрос")
    void acceptsValidKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/1");
        request.addHeader("X-API-KEY", "secret-key");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals(200, response.getStatus());
        assertTrue(SecurityContextHolder.getContext().getAuthentication().isAuthenticated());
    }

    @Test
    @DisplayName("отсутствующий ключ возвращает 401 MISSING_API_KEY")
    void rejectsMissingKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/ais");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = mock(FilterChain.class);

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertEquals("{\"error\":\"No X-API-KEY\",\"error_code\":\"MISSING_API_KEY\"}", response.getContentAsString());
        verifyNoInteractions(chain);
    }

    @Test
    @DisplayName("неверный ключ возвращает 401 INVALID_API_KEY")
    void rejectsWrongKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/1");
        request.addHeader("X-API-KEY", "secret-kez");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = mock(FilterChain.class);

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertEquals("{\"error\":\"Invalid X-API-KEY\",\"error_code\":\"INVALID_API_KEY\"}", response.getContentAsString());
        verifyNoInteractions(chain);
    }

    @Test
    @DisplayName("пустой ключ в конфигурации ничего не пропускает")
    void blankConfiguredKeyRejectsEverything() throws Exception {
        ApiKeyAuthenticationFilter unconfigured = new ApiKeyAuthenticationFilter("", new ObjectMapper());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/1");
        request.addHeader("X-API-KEY", "");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain chain = mock(FilterChain.class);

        unconfigured.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        verifyNoInteractions(chain);
    }

    @Test
    @DisplayName("документация доступна без ключа")
    void skipsDocumentationRoutes() throws Exception {
        for (String path : new String[]{"/docs", "/swagger-ui/index.html", "/v3/api-docs", "/v3/api-docs/swagger-config"}) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
            MockHttpServletResponse response = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();

            filter.doFilter(request, response, chain);

            assertNotNull(chain.getRequest(), path);
            assertEquals(200, response.getStatus(), path);
        }
    }
}
