package saig.email.app.command;

import saig.email.app.entity.ActionPriority;
import saig.email.app.entity.ActionStatus;
import saig.email.app.exception.IncompleteIntentException;
import saig.email.app.repository.EmailFilter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Typed, lenient access to an intent's loosely typed parameter map. Values that are present but
 * cannot be read as the requested type count as missing.
 */
class IntentParameters {
    private final String intentName;
    private final Map<String, Object> values;

    IntentParameters(String intentName, Map<String, Object> values) {
        this.intentName = intentName;
        this.values = values != null ? values : Map.of();
    }

    /**
     * First non-blank value among the given keys.
     */
    String string(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().strip();
            }
        }
        return null;
    }

    String requireString(String key, String... aliases) {
        String[] keys = new String[aliases.length + 1];
        keys[0] = key;
        System.arraycopy(aliases, 0, keys, 1, aliases.length);
        String value = string(keys);
        if (value == null) {
            throw new IncompleteIntentException(intentName, List.of(key));
        }
        return value;
    }

    /**
     * A list parameter given either as a list or as a comma-separated string.
     */
    List<String> stringList(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value instanceof Collection) {
                List<String> list = ((Collection<?>) value).stream()
                        .filter(v -> v != null && !v.toString().isBlank())
                        .map(v -> v.toString().strip())
                        .collect(Collectors.toList());
                if (!list.isEmpty()) {
                    return list;
                }
            } else if (value != null && !value.toString().isBlank()) {
                return Arrays.stream(value.toString().split("[,;]"))
                        .map(String::strip)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList());
            }
        }
        return List.of();
    }

    Boolean bool(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value != null) {
            String s = value.toString().strip().toLowerCase(Locale.ROOT);
            if (s.equals("true") || s.equals("yes")) {
                return Boolean.TRUE;
            }
            if (s.equals("false") || s.equals("no")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * ISO-8601 instant, or a date meaning start of that day in UTC.
     */
    Instant instant(String... keys) {
        String value = string(keys);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            } catch (DateTimeParseException ignored) {
                throw new IncompleteIntentException(intentName, List.of(keys[0]));
            }
        }
    }

    ActionPriority priority(String... keys) {
        String value = string(keys);
        if (value == null) {
            return null;
        }
        try {
            return ActionPriority.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IncompleteIntentException(intentName, List.of(keys[0]));
        }
    }

    ActionStatus status(String... keys) {
        String value = string(keys);
        if (value == null) {
            return null;
        }
        try {
            return ActionStatus.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IncompleteIntentException(intentName, List.of(keys[0]));
        }
    }

    /**
     * Builds a match filter from a nested {@code filter} map, falling back to top-level keys.
     */
    EmailFilter filter(boolean inTrash) {
        Object nested = values.get("filter");
        IntentParameters source = this;
        if (nested instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) nested).entrySet()) {
                if (entry.getKey() != null) {
                    copy.put(entry.getKey().toString(), entry.getValue());
                }
            }
            source = new IntentParameters(intentName, copy);
        }
        return EmailFilter.builder()
                .query(source.string("query", "q"))
                .sender(source.string("sender", "from"))
                .subjectContains(source.string("subject"))
                .label(source.string("label"))
                .unread(source.bool("unread"))
                .starred(source.bool("starred"))
                .urgent(source.bool("urgent"))
                .receivedAfter(source.instant("after"))
                .receivedBefore(source.instant("before"))
                .inTrash(inTrash)
                .build();
    }

    /**
     * Names of the given keys that have no value.
     */
    List<String> missing(String... keys) {
        List<String> missing = new ArrayList<>();
        for (String key : keys) {
            if (string(key) == null || stringList(key).isEmpty()) {
                missing.add(key);
            }
        }
        return missing;
    }
}
