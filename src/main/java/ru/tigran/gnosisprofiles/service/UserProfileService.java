package ru.tigran.gnosisprofiles.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.gnosisprofiles.dto.UpsertAction;
import ru.tigran.gnosisprofiles.dto.UserProfileRequest;
import ru.tigran.gnosisprofiles.dto.UserProfileResponse;
import ru.tigran.gnosisprofiles.dto.UserUpsertResponse;
import ru.tigran.gnosisprofiles.exception.ErrorCode;
import ru.tigran.gnosisprofiles.exception.ResourceNotFoundException;
import ru.tigran.gnosisprofiles.exception.ValidationException;
import ru.tigran.gnosisprofiles.model.User;
import ru.tigran.gnosisprofiles.repository.UserRepository;

import java.util.Optional;

import static ru.tigran.gnosisprofiles.util.FieldMergeUtils.mergeIfPresent;

/**
 * Сервис для управления профилями пользователей.
 * Создаёт или обновляет профиль по user_id и отдаёт его целиком.
 */
@Slf4j
@Service
public class UserProfileService {

    private final UserRepository userRepository;
    private final ProfileUpsertExecutor upsertExecutor;
    private final MeterRegistry meterRegistry;

    public UserProfileService(
            UserRepository userRepository,
            ProfileUpsertExecutor upsertExecutor,
            MeterRegistry meterRegistry
    ) {
        this.userRepository = userRepository;
        this.upsertExecutor = upsertExecutor;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Создаёт профиль или обновляет существующий.
     * Поля, которых нет в запросе, сохраняют прежние значения.
     *
     * @param request данные профиля, user_id обязателен
     * @return результат с action = created или updated
     */
    public UserUpsertResponse createOrUpdateUser(UserProfileRequest request) {
        if (request == null || request.userId() == null) {
            throw new ValidationException(ErrorCode.USER_ID_REQUIRED);
        }

        Long userId = request.userId();
        log.info("Upserting user profile {}", userId);

        UserUpsertResponse response = upsertExecutor.upsert("user " + userId, () -> writeUser(request));

        meterRegistry.counter("profiles.user.upsert", "action", response.action().getValue()).increment();
        log.info("User profile {} {}", userId, response.action().getValue());
        return response;
    }

    /**
     * Получает профиль пользователя.
     *
     * @param userId ID пользователя
     * @return UserProfileResponse
     */
    @Transactional(readOnly = true)
    public UserProfileResponse getUser(Long userId) {
        log.debug("Getting user profile {}", userId);

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.USER_NOT_FOUND));

        return mapToResponse(user);
    }

    private UserUpsertResponse writeUser(UserProfileRequest request) {
        Optional<User> existing = userRepository.findById(request.userId());
        boolean isUpdate = existing.isPresent();
        User user = existing.orElseGet(() -> new User(request.userId()));

        mergeIfPresent(request.displayName(), user::setDisplayName);
        mergeIfPresent(request.name(), user::setName);
        mergeIfPresent(request.bio(), user::setBio);
        mergeIfPresent(request.location(), user::setLocation);
        mergeIfPresent(request.profilePicUrl(), user::setProfilePicUrl);

        User saved = userRepository.saveAndFlush(user);
        return UserUpsertResponse.of(saved.getUserId(), UpsertAction.of(isUpdate));
    }

    private UserProfileResponse mapToResponse(User user) {
        return new UserProfileResponse(
                user.getUserId(),
                user.getDisplayName(),
                user.getName(),
                user.getBio(),
                user.getLocation(),
                user.getProfilePicUrl(),
                user.getCreatedAt()
        );
    }
}
