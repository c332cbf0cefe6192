package ru.tigran.gnosisprofiles.service;

import ru.tigran.gnosisprofiles.dto.ContentMetadata;

/**
 * Builder for constructing AI prompts for AI profile generation.
 *
 * Usage:
 * String systemPrompt = AiProfilePromptBuilder.buildSystemPrompt();
 * String userPrompt = AiProfilePromptBuilder.buildUserPrompt(content);
 *
 * Missing content fields are rendered as "Unknown", a missing custom prompt as "None".
 */
public class AiProfilePromptBuilder {

    static final String UNKNOWN = "Unknown";
    static final String NO_CUSTOM_PROMPT = "None";

    private static final String SYSTEM_PROMPT = "You are a profile creation specialist.";

    private AiProfilePromptBuilder() {
    }

    /**
     * Builds the system message for the chat completion.
     *
     * @return System prompt string
     */
    public static String buildSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Builds the user prompt describing the content and the expected JSON answer.
     *
     * @param content Metadata fetched from the content service
     * @return User prompt string
     */
    public static String buildUserPrompt(ContentMetadata content) {
        return String.format("""
                Based on the following content information, create a detailed social media profile for an AI agent that embodies the author's persona in the context of their work.

                Content Details:
                Title: %s
                Author: %s
                Topic: %s
                Genre: %s

                Take into account the following custom prompt:
                Custom Prompt: %s

                Make all of the below clever, witty, and engaging.

                First think about the following:
                Who is the author?
                What are they writing about?
                Describe their tone and writing style.
                What is their persona? their character? their values? their worldview?

                Then create a profile that includes:
                1. A witty display name that reflects the author's persona
                2. A full name (if known)
                3. A social media bio written in the style of the author (be witty and original)
                4. A location related to the author or their work (make it something unique/funny)
                5. Detailed system instructions for how this AI should communicate. Describe the tone, style, and personality of the author. Take on the persona of the author and describe to the AI how it should act. E.g. "You are Julius Caesar in his writing of De Bello Gallico, your verbiage is precise and to the point, and you are detailed in your descriptions of military strategy. etc etc"

                Please respond in JSON format with the following structure:
                {
                    "display_name": "Creative display name",
                    "name": "Full name",
                    "bio": "Detailed biography",
                    "location": "Relevant location",
                    "systems_instructions": "Detailed instructions for AI communication style"
                }
                """,
                orDefault(content.title(), UNKNOWN),
                orDefault(content.author(), UNKNOWN),
                orDefault(content.topic(), UNKNOWN),
                orDefault(content.genre(), UNKNOWN),
                orDefault(content.customPrompt(), NO_CUSTOM_PROMPT)
        );
    }

    /**
     * Title used in log lines, "Unknown" when the content has none.
     */
    public static String describe(ContentMetadata content) {
        return orDefault(content.title(), UNKNOWN);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
