package saig.email.app.config;

import com.theokanning.openai.service.OpenAiService;
import saig.email.app.ai.GeminiIntentResolver;
import saig.email.app.ai.IntentResolver;
import saig.email.app.ai.OpenAiIntentResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the language model behind the assistant.
 * Set ai.provider=gemini or ai.provider=openai in application.properties
 */
@Configuration
public class AIServiceConfig {

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "gemini")
    public IntentResolver geminiIntentResolver(@Value("${gemini.api.key:}") String apiKey) {
        return new GeminiIntentResolver(apiKey);
    }

    @Bean
    @ConditionalOnProperty(name = "ai.provider", havingValue = "openai", matchIfMissing = true)
    public IntentResolver openAiIntentResolver(@Value("${openai.api.key:}") String apiKey,
                                               @Value("${openai.timeout-seconds:30}") long timeoutSeconds) {
        return new OpenAiIntentResolver(new OpenAiService(apiKey, Duration.ofSeconds(timeoutSeconds)));
    }
}
