package saig.email.app.command;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured instruction: an operation name plus its parameters, as produced by an intent resolver.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Intent {
    private String name;
    private Map<String, Object> parameters = new LinkedHashMap<>();

    public static Intent of(String name, Map<String, Object> parameters) {
        return new Intent(name, parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>());
    }

    public static Intent of(IntentType type, Map<String, Object> parameters) {
        return of(type.externalName(), parameters);
    }
}
