package saig.email.app.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.OpenAiHttpException;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.service.OpenAiService;
import saig.email.app.command.Intent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

@Slf4j
public class OpenAiIntentResolver implements IntentResolver {
    private static final String MODEL = "gpt-3.5-turbo";

    private final OpenAiService openAiService;
    private final ObjectMapper objectMapper;

    public OpenAiIntentResolver(OpenAiService openAiService) {
        this.openAiService = openAiService;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Intent resolve(String text) {
        ChatMessage message = new ChatMessage("user", IntentPrompts.build(text));
        ChatCompletionRequest request = ChatCompletionRequest.builder()
            .model(MODEL)
            .messages(List.of(message))
            .maxTokens(300)
            .temperature(0.0)
            .build();

        ChatCompletionResult result;
        try {
            result = openAiService.createChatCompletion(request);
        } catch (RuntimeException e) {
            throw translate(e);
        }
        if (result == null || result.getChoices() == null || result.getChoices().isEmpty()) {
            throw new ResolutionException("OpenAI returned no choices");
        }
        String content = result.getChoices().get(0).getMessage().getContent();
        Intent intent = IntentPrompts.parse(content, objectMapper);
        log.debug("Resolved '{}' to intent {}", text, intent.getName());
        return intent;
    }

    private ResolutionException translate(RuntimeException e) {
        String errorMessage = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        if (e instanceof OpenAiHttpException ||
            errorMessage.contains("quota") ||
            errorMessage.contains("rate limit") ||
            (e.getCause() != null && e.getCause().getMessage() != null &&
             e.getCause().getMessage().contains("429"))) {
            return new QuotaException("OpenAI quota/rate limit exceeded during intent resolution: " + e.getMessage(), e);
        }
        return new ResolutionException("OpenAI error during intent resolution: " + e.getMessage(), e);
    }
}
