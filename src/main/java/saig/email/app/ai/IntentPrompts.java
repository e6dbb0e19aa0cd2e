package saig.email.app.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import saig.email.app.command.Intent;
import saig.email.app.command.IntentType;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prompt and response format shared by the intent resolvers.
 */
final class IntentPrompts {
    private static final int MAX_INPUT_LENGTH = 2000;

    private static final String INSTRUCTIONS =
        "You translate an email user's request into exactly one JSON object of the form " +
        "{\"name\": \"<intent>\", \"parameters\": {...}}.\n" +
        "Allowed intents: %s.\n" +
        "Parameters by intent:\n" +
        "- search: query, sender, subject, label, unread, starred, urgent, after, before (ISO dates), inTrash, limit\n" +
        "- mark_read, mark_unread, star, unstar, move_to_trash, restore: emailId or emailIds, or a filter object " +
        "with the search parameters\n" +
        "- compose: to (list of addresses), cc, subject, body\n" +
        "- reply: emailId, body\n" +
        "- create_action_item: title, description, dueDate (ISO-8601), priority (low|medium|high|urgent)\n" +
        "- complete_action_item, dismiss_action_item: actionItemId\n" +
        "- list_action_items: status (pending|completed|dismissed)\n" +
        "- create_huddle: name, description, members (list of addresses)\n" +
        "Leave out any parameter the user did not give. Never invent recipients or ids. " +
        "If the request fits no intent, use {\"name\": \"unsupported\", \"parameters\": {}}.\n" +
        "Respond with ONLY the JSON object.\n\nRequest:\n%s";

    private IntentPrompts() {
    }

    static String build(String text) {
        String names = Arrays.stream(IntentType.values())
                .map(IntentType::externalName)
                .collect(Collectors.joining(", "));
        String input = text.length() > MAX_INPUT_LENGTH ? text.substring(0, MAX_INPUT_LENGTH) + "..." : text;
        return String.format(INSTRUCTIONS, names, input);
    }

    /**
     * Reads the model's reply, tolerating a surrounding code fence or prose.
     */
    static Intent parse(String reply, ObjectMapper objectMapper) {
        if (reply == null || reply.isBlank()) {
            throw new IntentResolver.ResolutionException("Empty response from model");
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IntentResolver.ResolutionException("Model response is not JSON: " + reply);
        }
        try {
            Map<String, Object> json = objectMapper.readValue(reply.substring(start, end + 1),
                    new TypeReference<Map<String, Object>>() { });
            Object name = json.get("name");
            if (name == null) {
                throw new IntentResolver.ResolutionException("Model response has no intent name: " + reply);
            }
            Object parameters = json.get("parameters");
            Map<String, Object> params = new LinkedHashMap<>();
            if (parameters instanceof Map) {
                ((Map<?, ?>) parameters).forEach((k, v) -> params.put(String.valueOf(k), v));
            }
            return Intent.of(name.toString(), params);
        } catch (JsonProcessingException e) {
            throw new IntentResolver.ResolutionException("Model response is not valid JSON: " + e.getMessage(), e);
        }
    }
}
