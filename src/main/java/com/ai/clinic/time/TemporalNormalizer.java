package com.ai.clinic.time;

import com.ai.clinic.config.ClinicProperties;
import com.ai.clinic.exception.SchedulingException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form date and time text into clinic-local values.
 * <p>
 * Relative phrases are tried first, then a lenient day-first parser. Dates
 * without a usable year resolve to the next occurrence of that calendar day,
 * and the result must always fall after today.
 */
@Component
public class TemporalNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TemporalNormalizer.class);

    public static final Duration SLOT_DURATION = Duration.ofMinutes(30);

    public static final DateTimeFormatter TIME_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("hh:mm a")
            .toFormatter(Locale.ENGLISH);

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-yyyy", Locale.ENGLISH);

    private static final Pattern ORDINAL = Pattern.compile("(\\d+)(st|nd|rd|th)\\b");
    private static final Pattern IN_N_DAYS = Pattern.compile("^in\\s+(\\d{1,3})\\s+days?$");
    private static final String WEEKDAYS = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";
    private static final Pattern NEXT_WEEKDAY = Pattern.compile("^next\\s+(" + WEEKDAYS + ")$");
    private static final Pattern BARE_WEEKDAY = Pattern.compile("^(?:on\\s+|this\\s+|coming\\s+|this\\s+coming\\s+)?(" + WEEKDAYS + ")$");

    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})\\b");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b(\\d{1,2})[-/.](\\d{1,2})(?:[-/.](\\d{2,4}))?\\b");
    private static final Pattern DAY_MONTH = Pattern.compile("\\b(\\d{1,2})\\s*(?:of\\s+)?([a-z]{3,9})\\.?(?:\\s+(\\d{4}))?\\b");
    private static final Pattern MONTH_DAY = Pattern.compile("\\b([a-z]{3,9})\\.?\\s+(\\d{1,2})(?:\\s+(\\d{4}))?\\b");

    private static final Set<String> TODAY = Set.of("today", "tdy");
    private static final Set<String> TOMORROW = Set.of("tomorrow", "tomorow", "tommorow", "tommorrow", "tmrw", "tmr");
    private static final Set<String> DAY_AFTER_TOMORROW = Set.of(
            "day after tomorrow", "the day after tomorrow", "day after tomorow",
            "day after tommorow", "day after tommorrow", "day-after-tomorrow", "overmorrow");

    private static final Pattern TWELVE_HOUR = Pattern.compile("\\b(\\d{1,2})(?:[:.](\\d{2}))?\\s*(am|pm)\\b");
    private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("\\b(\\d{1,2})[:.](\\d{2})\\b");
    private static final Pattern BARE_HOUR = Pattern.compile("\\b(\\d{1,2})\\b");
    private static final Pattern NOON = Pattern.compile("(?<!after)\\bnoon\\b");
    private static final Pattern LATER_IN_DAY = Pattern.compile("afternoon|evening|night");

    private final Clock clock;
    private final ZoneOffset offset;

    public TemporalNormalizer(Clock clock, ClinicProperties properties) {
        this.clock = clock;
        this.offset = properties.offset();
    }

    public ZoneOffset offset() {
        return offset;
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(offset);
    }

    public LocalDate today() {
        return now().toLocalDate();
    }

    // =========================================================
    // DATE
    // =========================================================
    public LocalDate normalizeDate(String raw) {
        return normalizeDate(raw, today());
    }

    public LocalDate normalizeDate(String raw, LocalDate today) {
        if (StringUtils.isBlank(raw)) {
            throw SchedulingException.invalidDate("Please tell me the date you'd like, for example 15 August or tomorrow.");
        }
        String s = cleanDate(raw);

        LocalDate resolved = resolveRelative(s, today)
                .orElseGet(() -> resolveCalendarDate(s, raw, today));

        if (!resolved.isAfter(today)) {
            throw SchedulingException.invalidDate(
                    "The appointment date must be after today's date (" + today.format(DATE_FORMAT) + ").");
        }
        log.debug("Normalized date '{}' -> {}", raw, resolved);
        return resolved;
    }

    private static String cleanDate(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        s = ORDINAL.matcher(s).replaceAll("$1");
        s = s.replace(",", "");
        return s.replaceAll("\\s+", " ").trim();
    }

    private Optional<LocalDate> resolveRelative(String s, LocalDate today) {
        if (TODAY.contains(s)) {
            return Optional.of(today);
        }
        if (TOMORROW.contains(s)) {
            return Optional.of(today.plusDays(1));
        }
        if (DAY_AFTER_TOMORROW.contains(s)) {
            return Optional.of(today.plusDays(2));
        }
        Matcher inDays = IN_N_DAYS.matcher(s);
        if (inDays.matches()) {
            return Optional.of(today.plusDays(Integer.parseInt(inDays.group(1))));
        }
        Matcher next = NEXT_WEEKDAY.matcher(s);
        if (next.matches()) {
            return Optional.of(today.with(TemporalAdjusters.next(weekday(next.group(1)))));
        }
        Matcher bare = BARE_WEEKDAY.matcher(s);
        if (bare.matches()) {
            // never today: a bare weekday equal to today means a week from now
            return Optional.of(today.with(TemporalAdjusters.next(weekday(bare.group(1)))));
        }
        return Optional.empty();
    }

    private static DayOfWeek weekday(String name) {
        return DayOfWeek.valueOf(name.toUpperCase(Locale.ROOT));
    }

    private LocalDate resolveCalendarDate(String s, String raw, LocalDate today) {
        ParsedDate parsed = parseDayFirst(s)
                .orElseThrow(() -> SchedulingException.invalidDate(
                        "Could not understand the date '" + raw + "'. Please use a format like 15-08-2025 or 15 August."));

        try {
            if (parsed.year() != null) {
                LocalDate explicit = LocalDate.of(parsed.year(), parsed.month(), parsed.day());
                if (!explicit.isBefore(today)) {
                    return explicit;
                }
            }
            LocalDate candidate = LocalDate.of(today.getYear(), parsed.month(), parsed.day());
            if (!candidate.isAfter(today)) {
                candidate = LocalDate.of(today.getYear() + 1, parsed.month(), parsed.day());
            }
            return candidate;
        } catch (DateTimeException e) {
            throw SchedulingException.invalidDate("'" + raw + "' is not a valid calendar date.");
        }
    }

    private Optional<ParsedDate> parseDayFirst(String s) {
        Matcher iso = ISO_DATE.matcher(s);
        if (iso.find()) {
            return Optional.of(new ParsedDate(
                    Integer.parseInt(iso.group(3)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(1))));
        }

        Matcher numeric = NUMERIC_DATE.matcher(s);
        if (numeric.find()) {
            return Optional.of(new ParsedDate(
                    Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2)), year(numeric.group(3))));
        }

        Matcher dayMonth = DAY_MONTH.matcher(s);
        while (dayMonth.find()) {
            Optional<Month> month = month(dayMonth.group(2));
            if (month.isPresent()) {
                return Optional.of(new ParsedDate(
                        Integer.parseInt(dayMonth.group(1)), month.get().getValue(), year(dayMonth.group(3))));
            }
        }

        Matcher monthDay = MONTH_DAY.matcher(s);
        while (monthDay.find()) {
            Optional<Month> month = month(monthDay.group(1));
            if (month.isPresent()) {
                return Optional.of(new ParsedDate(
                        Integer.parseInt(monthDay.group(2)), month.get().getValue(), year(monthDay.group(3))));
            }
        }
        return Optional.empty();
    }

    private static Integer year(String group) {
        if (group == null) return null;
        int y = Integer.parseInt(group);
        return group.length() == 2 ? 2000 + y : y;
    }

    private static Optional<Month> month(String token) {
        for (Month m : Month.values()) {
            if (m.name().toLowerCase(Locale.ROOT).startsWith(token)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    private record ParsedDate(int day, int month, Integer year) {
    }

    // =========================================================
    // TIME
    // =========================================================

    /**
     * Returns the canonical {@code hh:mm AM/PM} form of the given time text.
     */
    public String normalizeTime(String raw) {
        return formatTime(parseTime(raw));
    }

    public LocalTime parseTime(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw SchedulingException.invalidTime("Please tell me a time, for example 9 AM or 10:30 AM.");
        }
        String lower = raw.trim().toLowerCase(Locale.ROOT);
        boolean later = LATER_IN_DAY.matcher(lower).find();
        String s = NOON.matcher(lower
                        .replace("a.m.", "am")
                        .replace("p.m.", "pm"))
                .replaceAll("12 pm")
                .replaceAll("\\bmidnight\\b", "12 am");

        try {
            Matcher twelve = TWELVE_HOUR.matcher(s);
            if (twelve.find()) {
                int hour = Integer.parseInt(twelve.group(1));
                int minute = twelve.group(2) != null ? Integer.parseInt(twelve.group(2)) : 0;
                if (hour < 1 || hour > 12) {
                    throw invalidTime(raw);
                }
                boolean pm = "pm".equals(twelve.group(3));
                return LocalTime.of(hour % 12 + (pm ? 12 : 0), minute);
            }

            Matcher twentyFour = TWENTY_FOUR_HOUR.matcher(s);
            if (twentyFour.find()) {
                return afternoonAware(later, LocalTime.of(
                        Integer.parseInt(twentyFour.group(1)), Integer.parseInt(twentyFour.group(2))));
            }

            Matcher bare = BARE_HOUR.matcher(s);
            if (bare.find()) {
                return afternoonAware(later, LocalTime.of(Integer.parseInt(bare.group(1)), 0));
            }
        } catch (DateTimeException e) {
            throw invalidTime(raw);
        }
        throw invalidTime(raw);
    }

    private static LocalTime afternoonAware(boolean later, LocalTime time) {
        return later && time.getHour() < 12 ? time.plusHours(12) : time;
    }

    private static SchedulingException invalidTime(String raw) {
        return SchedulingException.invalidTime(
                "Invalid time format: " + raw + ". Please provide a valid time like 9 AM or 10:30 AM.");
    }

    public static String formatTime(LocalTime time) {
        return time.format(TIME_FORMAT);
    }

    public static String formatDate(LocalDate date) {
        return date.format(DATE_FORMAT);
    }

    // =========================================================
    // INTERVAL
    // =========================================================
    public SlotInterval resolveInterval(LocalDate date, String time) {
        LocalTime localTime;
        try {
            localTime = LocalTime.parse(time, TIME_FORMAT);
        } catch (DateTimeParseException e) {
            localTime = parseTime(time);
        }
        return SlotInterval.of(OffsetDateTime.of(date, localTime, offset), SLOT_DURATION);
    }

    /** Normalizes both parts and anchors the slot in the clinic offset. */
    public SlotInterval resolveInterval(String rawDate, String rawTime) {
        LocalDate date = normalizeDate(rawDate);
        String time = normalizeTime(rawTime);
        return resolveInterval(date, time);
    }
}
