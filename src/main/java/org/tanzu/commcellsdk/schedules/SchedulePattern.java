package org.tanzu.commcellsdk.schedules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@code pattern} JSON of a schedule from a {@link PatternSpec}.
 *
 * Dates and times are sent as seconds since the epoch, read as UTC: a date is its
 * midnight, a time is its offset into 1 January 1970.
 */
public class SchedulePattern {

    /** Weekday bits of a weekly {@code freq_interval}, sunday first */
    static final List<String> WEEKDAYS =
            Arrays.asList("sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday");

    /** Relative weekday codes, starting at 1 */
    static final List<String> RELATIVE_WEEKDAYS = Arrays.asList(
            "sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday",
            "days", "weekday", "weekend_day");

    /** Relative day codes, starting at 1 */
    static final List<String> RELATIVE_DAYS = Arrays.asList("first", "second", "third", "fourth", "last");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("M/d/yyyy");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SchedulePattern(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    public SchedulePattern(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the pattern node for the spec's frequency.
     *
     * @throws SdkException Schedules/102 for a missing or unknown frequency and for
     *         invalid dates, times, weekdays or months
     */
    public ObjectNode create(PatternSpec spec) {
        if (spec.getFreqType() == null || spec.getFreqType().trim().isEmpty()) {
            throw new SdkException("Schedules", "102", "Frequency type is required to create pattern");
        }
        FrequencyType type = FrequencyType.fromName(spec.getFreqType());
        if (type == null) {
            throw new SdkException("Schedules", "102", "freq_type specified is wrong");
        }

        int recurrenceFactor = 0;
        int interval = 0;
        int relativeInterval = 0;
        switch (type) {
            case DAILY:
                recurrenceFactor = orDefault(spec.getRepeatDays(), 1);
                break;
            case WEEKLY:
                if (spec.getWeekdays().isEmpty()) {
                    throw new SdkException("Schedules", "102", "Weekdays need to be specified");
                }
                interval = weekdayBits(spec.getWeekdays());
                recurrenceFactor = orDefault(spec.getRepeatWeeks(), 1);
                break;
            case MONTHLY:
                recurrenceFactor = orDefault(spec.getRepeatMonths(), 1);
                interval = orDefault(spec.getOnDay(), 10);
                break;
            case MONTHLY_RELATIVE:
                recurrenceFactor = orDefault(spec.getRepeatMonths(), 1);
                interval = relativeWeekday(spec.getRelativeWeekday());
                relativeInterval = relativeDay(spec.getRelativeTime());
                break;
            case YEARLY:
                recurrenceFactor = month(spec.getOnMonth());
                interval = orDefault(spec.getOnDay(), 10);
                break;
            case YEARLY_RELATIVE:
                recurrenceFactor = month(spec.getOnMonth());
                interval = relativeWeekday(spec.getRelativeWeekday());
                relativeInterval = relativeDay(spec.getRelativeTime());
                break;
            case CONTINUOUS:
                interval = orDefault(spec.getJobInterval(), 30);
                break;
            case AFTER_JOB_COMPLETES:
                recurrenceFactor = orDefault(spec.getRepeatDays(), 4096);
                break;
            default:
                break;
        }

        String defaultStartTime = type == FrequencyType.ONE_TIME
                ? LocalTime.now(clock).format(DateTimeFormatter.ofPattern("HH:mm"))
                : "09:00";
        String startDate = spec.getActiveStartDate() != null
                ? spec.getActiveStartDate()
                : LocalDate.now(clock).format(DateTimeFormatter.ofPattern("MM/dd/yyyy"));
        String startTime = spec.getActiveStartTime() != null ? spec.getActiveStartTime() : defaultStartTime;

        ObjectNode pattern = objectMapper.createObjectNode();
        if (type == FrequencyType.AFTER_JOB_COMPLETES) {
            pattern.put("freq_type", "After_Job_Completes");
        } else {
            pattern.put("freq_type", type.getCode());
        }
        pattern.put("active_start_date", dateToEpoch(startDate));
        pattern.put("active_start_time", timeToSeconds(startTime));
        pattern.put("freq_recurrence_factor", recurrenceFactor);
        pattern.put("freq_interval", interval);
        pattern.put("freq_relative_interval", relativeInterval);
        pattern.putObject("timeZone").put("TimeZoneName", spec.getTimeZone() == null ? "" : spec.getTimeZone());

        if (spec.getActiveEndDate() != null) {
            pattern.put("active_end_date", dateToEpoch(spec.getActiveEndDate()));
        }
        if (!spec.getExceptionDates().isEmpty()) {
            ObjectNode exception = pattern.putArray("repeatPattern").addObject();
            exception.put("exception", true);
            exception.put("onDayNumber", exceptionDays(spec.getExceptionDates()));
        }
        if (spec.getEndAfter() != null) {
            pattern.put("active_end_occurence", spec.getEndAfter());
        }
        if (spec.getRepeatEvery() != null) {
            if (spec.getRepeatEnd() == null) {
                throw new SdkException("Schedules", "102", "repeat_end is required with repeat_every");
            }
            pattern.put("freq_subday_interval", timeToSeconds(spec.getRepeatEvery()));
            pattern.put("active_end_time", timeToSeconds(spec.getRepeatEnd()));
        }
        return pattern;
    }

    /**
     * Attaches a pattern to every subtask of a task request and names the subtasks.
     *
     * @param taskRequest a request with a {@code taskInfo.subTasks} array
     * @return the same request
     */
    public ObjectNode createSchedule(ObjectNode taskRequest, PatternSpec spec) {
        ObjectNode pattern = create(spec);
        for (JsonNode subTask : taskRequest.path("taskInfo").path("subTasks")) {
            ObjectNode node = (ObjectNode) subTask;
            if (spec.getScheduleName() != null) {
                JsonNode inner = node.get("subTask");
                ObjectNode target = inner instanceof ObjectNode ? (ObjectNode) inner : node.putObject("subTask");
                target.put("subTaskName", spec.getScheduleName());
            }
            node.set("pattern", pattern.deepCopy());
        }
        return taskRequest;
    }

    /**
     * Day-of-month bit mask for exception dates: day n sets bit n-1.
     *
     * @throws SdkException Schedules/102 for a day outside 1 to 31
     */
    public static int exceptionDays(List<Integer> days) {
        int onDay = 0;
        for (Integer day : days) {
            if (day == null || day < 1 || day > 31) {
                throw new SdkException("Schedules", "102", "Incorrect exception day specified: " + day);
            }
            onDay |= 1 << (day - 1);
        }
        return onDay;
    }

    static int weekdayBits(List<String> weekdays) {
        int bits = 0;
        for (String weekday : weekdays) {
            int index = WEEKDAYS.indexOf(weekday.toLowerCase(Locale.ROOT));
            if (index < 0) {
                throw new SdkException("Schedules", "102", "Incorrect weekday specified");
            }
            bits |= 1 << index;
        }
        return bits;
    }

    private static int relativeWeekday(String weekday) {
        if (weekday == null) {
            return 1;
        }
        int index = RELATIVE_WEEKDAYS.indexOf(weekday.toLowerCase(Locale.ROOT));
        if (index < 0) {
            throw new SdkException("Schedules", "102", "Incorrect relative weekday specified: " + weekday);
        }
        return index + 1;
    }

    private static int relativeDay(String relativeTime) {
        if (relativeTime == null) {
            return 1;
        }
        int index = RELATIVE_DAYS.indexOf(relativeTime.toLowerCase(Locale.ROOT));
        if (index < 0) {
            throw new SdkException("Schedules", "102", "Incorrect relative time specified: " + relativeTime);
        }
        return index + 1;
    }

    private static int month(String monthName) {
        if (monthName == null) {
            return 1;
        }
        try {
            return Month.valueOf(monthName.trim().toUpperCase(Locale.ROOT)).getValue();
        } catch (IllegalArgumentException e) {
            throw new SdkException("Schedules", "102", "Incorrect month specified: " + monthName, e);
        }
    }

    static long dateToEpoch(String date) {
        try {
            return LocalDate.parse(date.trim(), DATE_FORMAT).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new SdkException("Schedules", "102", "Incorrect data format, should be %m/%d/%Y %H:%M", e);
        }
    }

    static long timeToSeconds(String time) {
        try {
            return LocalTime.parse(time.trim(), TIME_FORMAT).toSecondOfDay();
        } catch (DateTimeParseException e) {
            throw new SdkException("Schedules", "102", "Incorrect data format, should be %m/%d/%Y %H:%M", e);
        }
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
