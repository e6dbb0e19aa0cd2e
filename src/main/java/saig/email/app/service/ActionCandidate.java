package saig.email.app.service;

import saig.email.app.entity.ActionPriority;
import lombok.Value;

import java.time.Instant;

/**
 * An action item proposed by {@link ActionExtractionService}, not yet stored.
 */
@Value
public class ActionCandidate {
    String title;
    String normalizedTitle;
    String description;
    /** Null when no deadline was found or it could not be resolved to one date. */
    Instant dueDate;
    ActionPriority priority;
}
