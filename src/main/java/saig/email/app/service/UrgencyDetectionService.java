package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores incoming mail for urgency from its wording, its sender and any deadline it mentions.
 * Each signal group counts once; the total is capped at 100 and compared with
 * {@code saig.urgency.threshold}.
 */
@Slf4j
@Service
public class UrgencyDetectionService {
    private static final int MAX_SCORE = 100;

    private static final Pattern HIGH_PRIORITY = Pattern.compile(
            "\\b(urgent|asap|critical|emergency|immediate|crisis|escalation|blocker|showstopper)\\b");
    private static final Pattern TIME_SENSITIVE = Pattern.compile(
            "\\b(today|tomorrow|eod|cob|deadline|due date|by end of|within|expires|expiring|overdue)\\b");
    private static final Pattern ACTION_REQUIRED = Pattern.compile(
            "\\b(please review|need approval|waiting for|action required|please confirm|please respond"
                    + "|need your|require your|can you|could you|would you|will you)\\b");
    private static final Pattern FOLLOW_UP = Pattern.compile(
            "\\b(follow up|following up|reminder|second request|haven't heard|checking in|any update|status update)\\b");
    private static final Pattern IMPORTANT_TITLE = Pattern.compile(
            "\\b(ceo|cto|cfo|coo|president|vice president|vp|director|manager|supervisor|head of|chief|executive)\\b");
    private static final Pattern IMPORTANT_DOMAIN = Pattern.compile("\\b(legal|compliance|finance|hr|security)\\b");
    private static final Pattern SUBJECT_TAG = Pattern.compile("\\[(urgent|important|action|priority)]");
    private static final Pattern REPLY_PREFIX = Pattern.compile("\\bre:");

    private final ActionExtractionService actionExtractionService;
    private final Clock clock;
    private final int threshold;
    private final List<String> vipSenders;
    private final List<String> ignoredSenders;

    public UrgencyDetectionService(ActionExtractionService actionExtractionService, EngineProperties properties, Clock clock) {
        this.actionExtractionService = actionExtractionService;
        this.clock = clock;
        this.threshold = properties.getUrgency().getThreshold();
        this.vipSenders = lowerCase(properties.getUrgency().getVipSenders());
        this.ignoredSenders = lowerCase(properties.getUrgency().getIgnoredSenders());
    }

    public UrgencyAssessment assess(String subject, String body, String sender, Instant receivedAt) {
        String subjectText = subject != null ? subject : "";
        String content = (subjectText + " " + (body != null ? body : "")).toLowerCase(Locale.ROOT);
        String senderText = sender != null ? sender.toLowerCase(Locale.ROOT) : "";

        if (matchesAny(senderText, ignoredSenders)) {
            return new UrgencyAssessment(false, 0, List.of("Ignored sender"));
        }

        List<String> reasons = new ArrayList<>();
        int score = 0;

        String keyword = firstMatch(HIGH_PRIORITY, content);
        if (keyword != null) {
            score += 30;
            reasons.add("High-priority keyword: " + keyword);
        }
        keyword = firstMatch(TIME_SENSITIVE, content);
        if (keyword != null) {
            score += 20;
            reasons.add("Time-sensitive: " + keyword);
        }
        Matcher action = ACTION_REQUIRED.matcher(content);
        int actions = 0;
        while (actions < 2 && action.find()) {
            score += 15;
            reasons.add("Action required: " + action.group(1));
            actions++;
        }
        keyword = firstMatch(FOLLOW_UP, content);
        if (keyword != null) {
            score += 15;
            reasons.add("Follow-up: " + keyword);
        }

        score += senderScore(senderText, reasons);
        score += subjectScore(subjectText, reasons);

        Instant reference = receivedAt != null ? receivedAt : clock.instant();
        Instant due = actionExtractionService.resolveDeadline(content, reference);
        if (due != null && due.isBefore(reference.plus(Duration.ofHours(48)))) {
            score += 25;
            reasons.add("Deadline within 48 hours");
        }

        score = Math.min(score, MAX_SCORE);
        boolean urgent = score >= threshold;
        if (urgent) {
            log.debug("Urgent ({}) '{}': {}", score, subject, reasons);
        }
        return new UrgencyAssessment(urgent, score, reasons);
    }

    private int senderScore(String sender, List<String> reasons) {
        if (sender.isEmpty()) {
            return 0;
        }
        if (matchesAny(sender, vipSenders)) {
            reasons.add("VIP sender");
            return 50;
        }
        String title = firstMatch(IMPORTANT_TITLE, sender);
        if (title != null) {
            reasons.add("Important sender title: " + title);
            return 40;
        }
        String domain = firstMatch(IMPORTANT_DOMAIN, sender);
        if (domain != null) {
            reasons.add("Important sender: " + domain);
            return 30;
        }
        return 0;
    }

    private static int subjectScore(String subject, List<String> reasons) {
        int score = 0;
        for (String word : subject.split("\\s+")) {
            if (word.length() > 2 && word.chars().anyMatch(Character::isLetter)
                    && word.equals(word.toUpperCase(Locale.ROOT))) {
                score += 10;
                reasons.add("All-caps words in subject");
                break;
            }
        }
        if (subject.contains("!!")) {
            score += 10;
            reasons.add("Multiple exclamation marks");
        }
        String lower = subject.toLowerCase(Locale.ROOT);
        if (SUBJECT_TAG.matcher(lower).find()) {
            score += 20;
            reasons.add("Priority tag in subject");
        }
        if (lower.startsWith("re:")) {
            int replies = 0;
            Matcher prefix = REPLY_PREFIX.matcher(lower);
            while (prefix.find()) {
                replies++;
            }
            if (replies >= 2) {
                score += 15;
                reasons.add("Multiple replies in thread (" + replies + ")");
            }
        }
        return score;
    }

    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static boolean matchesAny(String sender, List<String> fragments) {
        return !sender.isEmpty() && fragments.stream().anyMatch(sender::contains);
    }

    private static List<String> lowerCase(List<String> values) {
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                result.add(value.strip().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
