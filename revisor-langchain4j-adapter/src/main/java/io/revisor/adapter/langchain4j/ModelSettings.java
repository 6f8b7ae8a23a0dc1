package io.revisor.adapter.langchain4j;

import java.time.Duration;
import java.util.Objects;

/// Chat model parameters shared by every review stage.
///
/// ### Default Values
/// - `temperature`: `0.1`, low to keep reviews reproducible
/// - `maxTokens`: `4000`
/// - `timeout`: `120 s`
///
/// @param modelName provider model name, e.g. `deepseek-coder` or `claude-sonnet-4`, not null
/// @param temperature sampling temperature
/// @param maxTokens upper bound on generated tokens
/// @param timeout HTTP timeout of one model call, not null
public record ModelSettings(String modelName, double temperature, int maxTokens, Duration timeout) {

    public static final double DEFAULT_TEMPERATURE = 0.1;
    public static final int DEFAULT_MAX_TOKENS = 4000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    public ModelSettings {
        Objects.requireNonNull(modelName, "modelName must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static ModelSettings of(String modelName) {
        return new ModelSettings(
                modelName, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, DEFAULT_TIMEOUT);
    }
}
