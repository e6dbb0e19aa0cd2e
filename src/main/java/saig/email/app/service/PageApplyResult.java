package saig.email.app.service;

import lombok.Value;

/**
 * Counts for one committed page.
 */
@Value
public class PageApplyResult {
    int created;
    int updated;
    int skipped;
    int extractionPasses;
    int actionItemsCreated;
}
