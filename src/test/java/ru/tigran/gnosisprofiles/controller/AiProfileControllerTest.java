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
import ru.tigran.gnosisprofiles.dto.AiProfileRequest;
import ru.tigran.gnosisprofiles.dto.AiProfileResponse;
import ru.tigran.gnosisprofiles.dto.AiUpsertResponse;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.exception.AIGatewayException;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ResourceNotFoundException;
import ru.tigran.gnosisprofiles.exception.UpstreamServiceException;
import ru.tigran.gnosisprofiles.service.AiProfileService;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AiProfileController.class)
@Import({SecurityConfig.class, WebConfig.class})
@ActiveProfiles("test")
@DisplayName("AiProfileController модульные тесты")
class AiProfileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AiProfileService aiProfileService;

    private static final String AIS_URL = "/api/ais";
    private static final String API_KEY = "test-api-key";

    @Test
    @DisplayName("POST /api/ais - создание возвращает 201 и передаёт correlation ID")
    void createAiReturnsCreated() throws Exception {
        when(aiProfileService.createOrUpdateAi(any(AiProfileRequest.class), eq("corr-123")))
                .thenReturn(AiUpsertResponse.of(7L, 12L, UpsertAction.CREATED));

        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .header("X-Correlation-ID", "corr-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 12, \"profile_pic_url\": \"https://example.com/caesar.jpg\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message", equalTo("AI profile created successfully")))
                .andExpect(jsonPath("$.ai_id", equalTo(7)))
                .andExpect(jsonPath("$.content_id", equalTo(12)))
                .andExpect(jsonPath("$.action", equalTo("created")));

        verify(aiProfileService).createOrUpdateAi(
                new AiProfileRequest(12L, "https://example.com/caesar.jpg"), "corr-123");
    }

    @Test
    @DisplayName("POST /api/ais - повторная генерация возвращает 200")
    void regenerateAiReturnsOk() throws Exception {
        when(aiProfileService.createOrUpdateAi(any(AiProfileRequest.class), isNull()))
                .thenReturn(AiUpsertResponse.of(7L, 12L, UpsertAction.UPDATED));

        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action", equalTo("updated")));
    }

    @Test
    @DisplayName("POST /api/ais - без content_id возвращает 400")
    void missingContentIdReturnsBadRequest() throws Exception {
        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"profile_pic_url\": \"https://example.com/x.jpg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", equalTo("Content ID is required")));

        verifyNoInteractions(aiProfileService);
    }

    @Test
    @DisplayName("POST /api/ais - контент не найден возвращает 404")
    void contentNotFoundReturnsNotFound() throws Exception {
        when(aiProfileService.createOrUpdateAi(any(AiProfileRequest.class), any()))
                .thenThrow(new ResourceNotFoundException(ErrorCode.CONTENT_NOT_FOUND));

        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 404}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", equalTo("Content not found")))
                .andExpect(jsonPath("$.error_code", equalTo("CONTENT_NOT_FOUND")));
    }

    @Test
    @DisplayName("POST /api/ais - ошибка генерации возвращает 500 с общим сообщением")
    void generationFailureReturnsServerError() throws Exception {
        when(aiProfileService.createOrUpdateAi(any(AiProfileRequest.class), any()))
                .thenThrow(new AIGatewayException("LLM returned 3 keys for content 12", ErrorCode.PROFILE_GENERATION_FAILED));

        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 12}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", equalTo("Failed to generate AI profile")))
                .andExpect(jsonPath("$.error_code", equalTo("PROFILE_GENERATION_FAILED")));
    }

    @Test
    @DisplayName("POST /api/ais - недоступный content service возвращает 500")
    void upstreamFailureReturnsServerError() throws Exception {
        when(aiProfileService.createOrUpdateAi(any(AiProfileRequest.class), any()))
                .thenThrow(new UpstreamServiceException("Connection refused: content.test", ErrorCode.CONTENT_SERVICE_ERROR, null));

        mockMvc.perform(post(AIS_URL)
                        .header("X-API-KEY", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 12}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error", equalTo("Internal server error")))
                .andExpect(jsonPath("$.error", not(containsString("content.test"))));
    }

    @Test
    @DisplayName("POST /api/ais - без X-API-KEY возвращает 401")
    void missingApiKeyReturnsUnauthorized() throws Exception {
        mockMvc.perform(post(AIS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content_id\": 12}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code", equalTo("MISSING_API_KEY")));

        verifyNoInteractions(aiProfileService);
    }

    @Test
    @DisplayName("GET /api/ais/content/{id} - возвращает профиль")
    void getAiByContentReturnsProfile() throws Exception {
        when(aiProfileService.getAiByContent(12L)).thenReturn(new AiProfileResponse(
                7L, 12L, "VeniVidiBlogi", "Gaius Julius Caesar", "I came, I saw, I posted.",
                "Across the Rubicon", null, "You are Julius Caesar.", LocalDateTime.of(2024, 3, 15, 12, 30)));

        mockMvc.perform(get(AIS_URL + "/content/12").header("X-API-KEY", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ai_id", equalTo(7)))
                .andExpect(jsonPath("$.content_id", equalTo(12)))
                .andExpect(jsonPath("$.display_name", equalTo("VeniVidiBlogi")))
                .andExpect(jsonPath("$.systems_instructions", equalTo("You are Julius Caesar.")))
                .andExpect(jsonPath("$.profile_pic_url", nullValue()))
                .andExpect(jsonPath("$.created_at", startsWith("2024-03-15T12:30")));
    }

    @Test
    @DisplayName("GET /api/ais/content/{id} - профиль не найден возвращает 404")
    void getAiByContentNotFound() throws Exception {
        when(aiProfileService.getAiByContent(99L)).thenThrow(new ResourceNotFoundException(ErrorCode.AI_PROFILE_NOT_FOUND));

        mockMvc.perform(get(AIS_URL + "/content/99").header("X-API-KEY", API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", equalTo("AI profile not found")));
    }
}
