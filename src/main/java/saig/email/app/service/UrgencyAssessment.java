package saig.email.app.service;

import lombok.Value;

import java.util.List;

@Value
public class UrgencyAssessment {
    boolean urgent;
    /** 0 to 100. */
    int score;
    List<String> reasons;

    public String reasonText() {
        return reasons.isEmpty() ? "No specific urgency indicators" : String.join("; ", reasons);
    }
}
