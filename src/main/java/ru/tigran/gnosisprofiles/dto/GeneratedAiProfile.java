package ru.tigran.gnosisprofiles.dto;

/**
 * Validated LLM output: exactly the five profile fields, all strings.
 *
 * @param displayName witty display name reflecting the author's persona
 * @param name full name of the author, if known
 * @param bio social media bio written in the author's style
 * @param location location related to the author or their work
 * @param systemsInstructions instructions describing how the AI agent should communicate
 */
public record GeneratedAiProfile(
        String displayName,
        String name,
        String bio,
        String location,
        String systemsInstructions
) {
}
