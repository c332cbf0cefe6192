package ru.tigran.gnosisprofiles.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Конфигурация для поддержки аудита сущностей
 * Автоматически заполняет createdAt
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {
}
