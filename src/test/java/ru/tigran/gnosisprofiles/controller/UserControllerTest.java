package ru.tigran.gnosisprofiles.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import ru.tigran.gnosisprofiles.config.SecurityConfig;
import ru.tigran.gnosisprofiles.config.WebConfig;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.dto.UserProfileRequest;
import ru.tigran.gnosisprofiles.dto.UserProfileResponse;
import ru.tigran.gnosisprofiles.dto.UserUpsertResponse;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ResourceNotFoundException;
import ru.tigran.gnosisprofiles.service.UserProfileService;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Модульные тесты для UserController.
 * Идут через настоящую цепочку Spring Security с X-API-KEY фильтром.
 */
@WebMvcTest(UserController.class)
@Import({SecurityConfig.class, WebConfig.class})
@ActiveProfiles("test")
@DisplayName("UserController модульные тесты")
class UserControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserProfileService userProfileService;

    private static final String USERS_URL = "/api/users";
    private static final String API_KEY = "test-api-key";

    @Test
    @DisplayName("POST /api/users - создание возвращает 201")
    void createUserReturnsCreated() throws Exception {
        when(userProfileService.createOrUpdateUser(any(UserProfileRequest.class)))
                .thenReturn(UserUpsertResponse.of(1L, UpsertAction.CREATED));

        mockMvc.perform(post(USERS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": 1, \"name\": \"Ada Lovelace\", \"display_name\": \"ada\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message", equalTo("User profile created successfully")))
                .andExpect(jsonPath("$.user_id", equalTo(1)))
                .andExpect(jsonPath("$.action", equalTo("created")));

        verify(userProfileService).createOrUpdateUser(
                new UserProfileRequest(1L, "ada", "Ada Lovelace", null, null, null));
    }

    @Test
    @DisplayName("POST /api/users - обновление возвращает 200")
    void updateUserReturnsOk() throws Exception {
        when(userProfileService.createOrUpdateUser(any(UserProfileRequest.class)))
                .thenReturn(UserUpsertResponse.of(1L, UpsertAction.UPDATED));

        mockMvc.perform(post(USERS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": 1, \"bio\": \"poet of science\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", equalTo("User profile updated successfully")))
                .andExpect(jsonPath("$.action", equalTo("updated")));
    }

    @Test
    @DisplayName("POST /api/users - без user_id возвращает 400")
    void missingUserIdReturnsBadRequest() throws Exception {
        mockMvc.perform(post(USERS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Ada Lovelace\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", equalTo("User ID is required")))
                .andExpect(jsonPath("$.error_code", equalTo("VALIDATION_ERROR")));

        verifyNoInteractions(userProfileService);
    }

    @Test
    @DisplayName("POST /api/users - невалидный JSON возвращает 400")
    void malformedBodyReturnsBadRequest() throws Exception {
        mockMvc.perform(post(USERS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code", equalTo("MALFORMED_REQUEST")));
    }

    @Test
    @DisplayName("POST /api/users - без X-API-KEY возвращает 401")
    void missingApiKeyReturnsUnauthorized() throws Exception {
        mockMvc.perform(post(USERS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_id\": 1}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error", equalTo("No X-API-KEY")))
                .andExpect(jsonPath("$.error_code", equalTo("MISSING_API_KEY")));

        verifyNoInteractions(userProfileService);
    }

    @Test
    @DisplayName("GET /api/users/{id} - неверный X-API-KEY возвращает 401")
    void invalidApiKeyReturnsUnauthorized() throws Exception {
        mockMvc.perform(get(USERS_URL + "/1").header("X-API-KEY", "wrong-key"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error", equalTo("Invalid X-API-KEY")))
                .andExpect(jsonPath("$.error_code", equalTo("INVALID_API_KEY")));

        verifyNoInteractions(userProfileService);
    }

    @Test
    @DisplayName("GET /api/users/{id} - возвращает профиль в snake_case")
    void getUserReturnsProfile() throws Exception {
        when(userProfileService.getUser(1L)).thenReturn(new UserProfileResponse(
                1L, "ada", "Ada Lovelace", "mathematician", "London",
                "https://example.com/ada.jpg", LocalDateTime.of(2024, 1, 1, 10, 0)));

        mockMvc.perform(get(USERS_URL + "/1").header("X-API-KEY", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id", equalTo(1)))
                .andExpect(jsonPath("$.display_name", equalTo("ada")))
                .andExpect(jsonPath("$.name", equalTo("Ada Lovelace")))
                .andExpect(jsonPath("$.bio", equalTo("mathematician")))
                .andExpect(jsonPath("$.location", equalTo("London")))
                .andExpect(jsonPath("$.profile_pic_url", equalTo("https://example.com/ada.jpg")))
                .andExpect(jsonPath("$.created_at", startsWith("2024-01-01T10:00")));
    }

    @Test
    @DisplayName("GET /api/users/{id} - несуществующий пользователь возвращает 404")
    void getUserNotFound() throws Exception {
        when(userProfileService.getUser(99L)).thenThrow(new ResourceNotFoundException(ErrorCode.USER_NOT_FOUND));

        mockMvc.perform(get(USERS_URL + "/99").header("X-API-KEY", API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", equalTo("User not found")))
                .andExpect(jsonPath("$.error_code", equalTo("USER_NOT_FOUND")));
    }

    @Test
    @DisplayName("GET /api/users/{id} - нечисловой id возвращает 400")
    void nonNumericUserIdReturnsBadRequest() throws Exception {
        mockMvc.perform(get(USERS_URL + "/abc").header("X-API-KEY", API_KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code", equalTo("VALIDATION_ERROR")));
    }

    @Test
    @DisplayName("GET /api/users/{id} - ошибка хранилища возвращает 500 без деталей")
    void storageFailureReturnsGenericError() throws Exception {
        when(userProfileService.getUser(1L)).thenThrow(new IllegalStateException("connection pool exhausted"));

        mockMvc.perform(get(USERS_URL + "/1").header("X-API-KEY", API_KEY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", equalTo("Internal server error")))
                .andExpect(jsonPath("$.error_code", equalTo("INTERNAL_SERVER_ERROR")));
    }

    @Test
    @DisplayName("DELETE /api/users/{id} - неподдерживаемый метод возвращает 405")
    void unsupportedMethodReturnsMethodNotAllowed() throws Exception {
        mockMvc.perform(delete(USERS_URL + "/1").header("X-API-KEY", API_KEY))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Allow", containsString("GET")))
                .andExpect(jsonPath("$.error", equalTo("Method not allowed")))
                .andExpect(jsonPath("$.error_code", equalTo("METHOD_NOT_ALLOWED")));

        verifyNoInteractions(userProfileService);
    }

    @Test
    @DisplayName("POST /api/users - тело не в JSON возвращает 415")
    void nonJsonContentTypeReturnsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post(USERS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("user_id=1"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error", equalTo("Unsupported media type")))
                .andExpect(jsonPath("$.error_code", equalTo("UNSUPPORTED_MEDIA_TYPE")));

        verifyNoInteractions(userProfileService);
    }
}
