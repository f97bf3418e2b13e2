package io.tiller.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates {@link ChatModel} instances for the clarifier's model calls.
///
/// Supports Anthropic (Claude), OpenAI (GPT/o1) and DeepSeek models. DeepSeek uses the
/// OpenAI-compatible API with a custom base URL. Extraction wants deterministic
/// output, so the default temperature is 0.
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
public final class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    private static final int DEFAULT_MAX_TOKENS = 1024;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final double DEFAULT_TEMPERATURE = 0.0;

    private LangChain4jModelFactory() {}

    public static boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("deepseek");
    }

    /// Creates a chat model with default sampling settings.
    ///
    /// @param modelName provider model name, not null
    /// @param credentials API keys keyed by name, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    public static ChatModel create(String modelName, Map<String, String> credentials) {
        return create(modelName, credentials, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_TIMEOUT);
    }

    public static ChatModel create(
            String modelName,
            Map<String, String> credentials,
            double temperature,
            int maxTokens,
            Duration timeout) {
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        logger.info("Creating LangChain4j chat model: " + modelName);

        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return openAi(
                    modelName,
                    requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"),
                    null,
                    temperature,
                    maxTokens,
                    timeout);
        } else if (modelName.startsWith("deepseek")) {
            return openAi(
                    modelName,
                    requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY"),
                    "https://api.deepseek.com",
                    temperature,
                    maxTokens,
                    timeout);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private static ChatModel openAi(
            String modelName,
            String apiKey,
            String baseUrl,
            double temperature,
            int maxTokens,
            Duration timeout) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .timeout(timeout);
        if (baseUrl != null) builder.baseUrl(baseUrl);
        return builder.build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
