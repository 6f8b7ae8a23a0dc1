package io.revisor.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.util.Map;
import java.util.logging.Logger;

/// Creates LangChain4j [ChatModel] instances from a model name.
///
/// Supports Anthropic (Claude), OpenAI (GPT/o1) and DeepSeek models. DeepSeek uses the
/// OpenAI-compatible API with a custom base URL.
///
/// ### Credentials
/// | Model prefix | Keys tried in order |
/// |---|---|
/// | `claude` | `anthropic_api_key`, `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1` | `openai_api_key`, `OPENAI_API_KEY` |
/// | `deepseek` | `deepseek_api_key`, `DEEPSEEK_API_KEY` |
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
public class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("deepseek");
    }

    /// Creates the chat model matching the model name prefix.
    ///
    /// @param settings model parameters, not null
    /// @param credentials API keys keyed by name, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    public ChatModel createModel(ModelSettings settings, Map<String, String> credentials) {
        String modelName = settings.modelName();
        logger.info("Creating LangChain4j chat model: " + modelName);

        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(modelName)
                    .temperature(settings.temperature())
                    .maxTokens(settings.maxTokens())
                    .timeout(settings.timeout())
                    .build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return createOpenAiModel(
                    settings, requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"), null);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(
                    settings,
                    requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY"),
                    DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private ChatModel createOpenAiModel(ModelSettings settings, String apiKey, String baseUrl) {
        OpenAiChatModel.OpenAiChatModelBuilder builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(settings.modelName())
                        .temperature(settings.temperature())
                        .maxTokens(settings.maxTokens())
                        .timeout(settings.timeout());
        if (baseUrl != null) builder.baseUrl(baseUrl);
        return builder.build();
    }

    private String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
