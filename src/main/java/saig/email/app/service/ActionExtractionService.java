package saig.email.app.service;

import saig.email.app.config.EngineProperties;
import saig.email.app.entity.ActionPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extraction of action items from email text. Stateless and free of I/O.
 */
@Slf4j
@Service
public class ActionExtractionService {
    private static final int MIN_TITLE_LENGTH = 10;
    private static final int MAX_TITLE_LENGTH = 200;
    private static final LocalTime DEFAULT_DUE_TIME = LocalTime.of(17, 0);

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.?!])\\s+|[\\r\\n]+");

    private static final Pattern REQUEST = Pattern.compile(
            "\\b(?:please|could you|can you|would you|will you|need to|needs to|must|have to)\\s+(.{5,})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern IMPERATIVE = Pattern.compile(
            "^(?:[-*\\u2022]\\s*|\\d+[.)]\\s*)?((?:Review|Complete|Send|Submit|Prepare|Schedule|Call|Email|Contact|Finish|Confirm|Approve|Sign)\\b.{5,})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern DEADLINE_MARKER = Pattern.compile(
            "\\b(?:due|deadline|by|before|until|no later than)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DEADLINE_SENTENCE = Pattern.compile(
            "\\b(?:due|deadline)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:by|before|due|on|until)\\s+(?:(this|next)\\s+)?(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2}|\\d{4}))?\\b");

    private static final Pattern MONTH_DATE = Pattern.compile(
            "\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WITHIN = Pattern.compile(
            "\\bwithin\\s+(\\d{1,3})\\s+(hour|hours|day|days|business days)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern TODAY = Pattern.compile("\\b(?:today|eod|end of (?:the )?day|tonight)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOMORROW = Pattern.compile("\\btomorrow\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_OF_WEEK = Pattern.compile("\\b(?:eow|end of (?:the )?week)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_OF_MONTH = Pattern.compile("\\b(?:eom|end of (?:the )?month)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEXT_WEEK = Pattern.compile("\\bnext week\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern URGENT = Pattern.compile("\\b(?:urgent|urgently|asap|immediately|emergency|critical)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern IMPORTANT = Pattern.compile("\\b(?:important|high priority|soon)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOW = Pattern.compile("\\b(?:no rush|whenever|eventually|when you get time|low priority)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<String> SKIP_PHRASES = List.of("thank you", "thanks", "regards", "sincerely", "unsubscribe");

    private final Clock clock;
    private final ZoneId zone;
    private final int maxItemsPerEmail;

    public ActionExtractionService(Clock clock, EngineProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getExtraction().getZone());
        this.maxItemsPerEmail = properties.getExtraction().getMaxItemsPerEmail();
    }

    /**
     * Scans subject and body for requests and deadlines.
     * @param subject Email subject, may be null
     * @param body Email body, may be null
     * @param receivedAt Reference point for relative dates such as "tomorrow"; now if null
     * @return candidates in order of appearance, de-duplicated by normalized title
     */
    public List<ActionCandidate> extract(String subject, String body, Instant receivedAt) {
        String text = (subject != null ? subject : "") + "\n" + (body != null ? body : "");
        if (text.isBlank()) {
            return List.of();
        }
        Instant reference = receivedAt != null ? receivedAt : clock.instant();
        boolean urgentSubject = subject != null && URGENT.matcher(subject).find();

        Map<String, ActionCandidate> byTitle = new LinkedHashMap<>();
        for (String raw : SENTENCE_SPLIT.split(text)) {
            String sentence = raw.strip();
            if (sentence.isEmpty()) {
                continue;
            }
            String title = titleOf(sentence);
            if (title == null || isNoise(title)) {
                continue;
            }
            String normalized = normalizeTitle(title);
            if (byTitle.containsKey(normalized)) {
                continue;
            }
            Instant due = resolveDeadline(sentence, reference);
            ActionPriority priority = priorityOf(sentence, urgentSubject, due);
            byTitle.put(normalized, new ActionCandidate(title, normalized, sentence, due, priority));
            if (byTitle.size() >= maxItemsPerEmail) {
                break;
            }
        }
        if (!byTitle.isEmpty()) {
            log.debug("Extracted {} action candidates from '{}'", byTitle.size(), subject);
        }
        return new ArrayList<>(byTitle.values());
    }

    private String titleOf(String sentence) {
        Matcher imperative = IMPERATIVE.matcher(sentence);
        if (imperative.find()) {
            return clean(imperative.group(1));
        }
        Matcher request = REQUEST.matcher(sentence);
        if (request.find()) {
            return clean(request.group(1));
        }
        if (DEADLINE_SENTENCE.matcher(sentence).find()) {
            return clean(sentence);
        }
        return null;
    }

    private static String clean(String s) {
        String t = s.strip().replaceAll("[\\s]+", " ").replaceAll("[.?!,;:]+$", "");
        if (t.length() > MAX_TITLE_LENGTH) {
            t = t.substring(0, MAX_TITLE_LENGTH).strip();
        }
        if (t.isEmpty()) {
            return t;
        }
        return Character.toUpperCase(t.charAt(0)) + t.substring(1);
    }

    private static boolean isNoise(String title) {
        if (title.length() < MIN_TITLE_LENGTH) {
            return true;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        return SKIP_PHRASES.stream().anyMatch(lower::contains);
    }

    /**
     * Lowercased, punctuation stripped, whitespace collapsed. Used as the de-duplication key.
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .strip();
    }

    /**
     * Resolves a deadline phrase to an instant. Returns null when no phrase is present or when
     * the phrase cannot be pinned to a single date.
     */
    Instant resolveDeadline(String sentence, Instant reference) {
        LocalDate today = reference.atZone(zone).toLocalDate();

        Matcher within = WITHIN.matcher(sentence);
        if (within.find()) {
            long amount = Long.parseLong(within.group(1));
            String unit = within.group(2).toLowerCase(Locale.ROOT);
            if (unit.startsWith("hour")) {
                return reference.plus(Duration.ofHours(amount));
            }
            if (unit.startsWith("business")) {
                return endOfDay(addBusinessDays(today, amount));
            }
            return endOfDay(today.plusDays(amount));
        }
        if (TOMORROW.matcher(sentence).find()) {
            return endOfDay(today.plusDays(1));
        }
        if (TODAY.matcher(sentence).find()) {
            return endOfDay(today);
        }
        if (END_OF_WEEK.matcher(sentence).find()) {
            return endOfDay(today.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY)));
        }
        if (END_OF_MONTH.matcher(sentence).find()) {
            return endOfDay(today.with(TemporalAdjusters.lastDayOfMonth()));
        }

        Matcher weekday = WEEKDAY.matcher(sentence);
        if (weekday.find()) {
            DayOfWeek day = DayOfWeek.valueOf(weekday.group(2).toUpperCase(Locale.ROOT));
            LocalDate date = today.with(TemporalAdjusters.nextOrSame(day));
            if ("next".equalsIgnoreCase(weekday.group(1)) && date.isBefore(today.plusDays(7))) {
                date = date.plusWeeks(1);
            }
            return endOfDay(date);
        }

        Matcher numeric = NUMERIC_DATE.matcher(sentence);
        if (numeric.find()) {
            Integer year = numeric.group(3) != null ? normalizeYear(Integer.parseInt(numeric.group(3))) : null;
            LocalDate date = dateOf(Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2)), year, today);
            return date != null ? endOfDay(date) : null;
        }

        Matcher monthDate = MONTH_DATE.matcher(sentence);
        if (monthDate.find() && DEADLINE_MARKER.matcher(sentence).find()) {
            int month = monthOf(monthDate.group(1));
            LocalDate date = dateOf(month, Integer.parseInt(monthDate.group(2)), null, today);
            return date != null ? endOfDay(date) : null;
        }

        if (NEXT_WEEK.matcher(sentence).find()) {
            return endOfDay(today.with(TemporalAdjusters.next(DayOfWeek.MONDAY)));
        }
        return null;
    }

    private static LocalDate dateOf(int month, int day, Integer year, LocalDate today) {
        try {
            if (year != null) {
                return LocalDate.of(year, month, day);
            }
            LocalDate date = LocalDate.of(today.getYear(), month, day);
            // A month/day already past this year means next year's date.
            return date.isBefore(today) ? date.plusYears(1) : date;
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int normalizeYear(int year) {
        return year < 100 ? 2000 + year : year;
    }

    private static int monthOf(String token) {
        String prefix = token.substring(0, 3).toUpperCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().startsWith(prefix)) {
                return month.getValue();
            }
        }
        throw new IllegalArgumentException("Unknown month: " + token);
    }

    private static LocalDate addBusinessDays(LocalDate start, long days) {
        LocalDate date = start;
        long added = 0;
        while (added < days) {
            date = date.plusDays(1);
            if (date.getDayOfWeek() != DayOfWeek.SATURDAY && date.getDayOfWeek() != DayOfWeek.SUNDAY) {
                added++;
            }
        }
        return date;
    }

    private Instant endOfDay(LocalDate date) {
        return date.atTime(DEFAULT_DUE_TIME).atZone(zone).toInstant();
    }

    ActionPriority priorityOf(String sentence, boolean urgentSubject, Instant due) {
        if (urgentSubject || URGENT.matcher(sentence).find()) {
            return ActionPriority.URGENT;
        }
        if (due != null && due.isBefore(clock.instant().plus(Duration.ofHours(24)))) {
            return ActionPriority.HIGH;
        }
        if (IMPORTANT.matcher(sentence).find()) {
            return ActionPriority.HIGH;
        }
        if (LOW.matcher(sentence).find()) {
            return ActionPriority.LOW;
        }
        return ActionPriority.MEDIUM;
    }
}
