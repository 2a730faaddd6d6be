package com.shepherd.ai;

import com.shepherd.config.ShepherdProperties;
import com.shepherd.error.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * 根据 ShepherdProperties.ModelProfile 创建对应的 ChatModel。
 *
 * provider 约定：
 *  - openai / openai-compatible / deepseek → OpenAI 兼容协议（OpenAiApi + OpenAiChatModel）
 *  - ollama → OllamaApi + OllamaChatModel
 */
@Slf4j
@Component
public class AnalysisChatModelFactory {

    static final String OPENAI_BASE_URL = "https://api.openai.com";
    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";
    static final String OLLAMA_BASE_URL = "http://localhost:11434";

    public ChatModel create(ShepherdProperties.ModelProfile profile) {
        String provider = Optional.ofNullable(profile.getProvider())
                .filter(StringUtils::hasText)
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .orElseThrow(() -> new ConfigException("shepherd.analysis.profile.provider must be set"));

        return switch (provider) {
            case "openai", "openai-compatible" -> buildOpenAiCompatibleModel(profile, OPENAI_BASE_URL);
            case "deepseek" -> buildOpenAiCompatibleModel(profile, DEEPSEEK_BASE_URL);
            case "ollama" -> buildOllamaModel(profile);
            default -> throw new ConfigException("Unsupported provider: " + provider);
        };
    }

    private ChatModel buildOpenAiCompatibleModel(ShepherdProperties.ModelProfile profile, String defaultBaseUrl) {
        String baseUrl = Optional.ofNullable(profile.getBaseUrl())
                .filter(StringUtils::hasText)
                .orElse(defaultBaseUrl);

        String apiKey = Optional.ofNullable(profile.getApiKey())
                .filter(StringUtils::hasText)
                .orElseThrow(() -> new ConfigException(
                        "apiKey must be set for provider=" + profile.getProvider()));

        String modelId = requireModelId(profile);

        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .build();

        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(modelId);
        if (profile.getTemperature() != null) {
            builder.temperature(profile.getTemperature());
        }

        OpenAiChatModel model = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(builder.build())
                .build();

        log.info("[AnalysisChatModelFactory] built OpenAI-compatible model provider={} baseUrl={} modelId={}",
                profile.getProvider(), baseUrl, modelId);
        return model;
    }

    private ChatModel buildOllamaModel(ShepherdProperties.ModelProfile profile) {
        String baseUrl = Optional.ofNullable(profile.getBaseUrl())
                .filter(StringUtils::hasText)
                .orElse(OLLAMA_BASE_URL);
        String modelId = requireModelId(profile);

        OllamaOptions.Builder builder = OllamaOptions.builder().model(modelId);
        if (profile.getTemperature() != null) {
            builder.temperature(profile.getTemperature());
        }

        OllamaChatModel model = OllamaChatModel.builder()
                .ollamaApi(OllamaApi.builder().baseUrl(baseUrl).build())
                .defaultOptions(builder.build())
                .build();

        log.info("[AnalysisChatModelFactory] built Ollama model baseUrl={} modelId={}", baseUrl, modelId);
        return model;
    }

    private static String requireModelId(ShepherdProperties.ModelProfile profile) {
        return Optional.ofNullable(profile.getModelId())
                .filter(StringUtils::hasText)
                .orElseThrow(() -> new ConfigException(
                        "modelId must be set for provider=" + profile.getProvider()));
    }
}
