package org.tanzu.commcellsdk.schedules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input for {@link SchedulePattern}. Only {@code freqType} is required; every other value
 * falls back to the server defaults for the chosen frequency.
 *
 * Dates use {@code MM/dd/yyyy}, times use {@code HH:mm}.
 */
public class PatternSpec {

    private String freqType;
    private String scheduleName;
    private String activeStartDate;
    private String activeStartTime;
    private String activeEndDate;
    private String timeZone;
    private Integer repeatDays;
    private Integer repeatWeeks;
    private final List<String> weekdays = new ArrayList<>();
    private Integer repeatMonths;
    private Integer onDay;
    private String relativeTime;
    private String relativeWeekday;
    private String onMonth;
    private Integer jobInterval;
    private final List<Integer> exceptionDates = new ArrayList<>();
    private Integer endAfter;
    private String repeatEvery;
    private String repeatEnd;

    public PatternSpec() {
    }

    public PatternSpec(String freqType) {
        this.freqType = freqType;
    }

    public PatternSpec freqType(String freqType) { this.freqType = freqType; return this; }
    public PatternSpec scheduleName(String scheduleName) { this.scheduleName = scheduleName; return this; }
    public PatternSpec activeStartDate(String activeStartDate) { this.activeStartDate = activeStartDate; return this; }
    public PatternSpec activeStartTime(String activeStartTime) { this.activeStartTime = activeStartTime; return this; }
    public PatternSpec activeEndDate(String activeEndDate) { this.activeEndDate = activeEndDate; return this; }
    public PatternSpec timeZone(String timeZone) { this.timeZone = timeZone; return this; }
    public PatternSpec repeatDays(int repeatDays) { this.repeatDays = repeatDays; return this; }
    public PatternSpec repeatWeeks(int repeatWeeks) { this.repeatWeeks = repeatWeeks; return this; }
    public PatternSpec weekdays(List<String> weekdays) { this.weekdays.addAll(weekdays); return this; }
    public PatternSpec repeatMonths(int repeatMonths) { this.repeatMonths = repeatMonths; return this; }
    public PatternSpec onDay(int onDay) { this.onDay = onDay; return this; }
    public PatternSpec relativeTime(String relativeTime) { this.relativeTime = relativeTime; return this; }
    public PatternSpec relativeWeekday(String relativeWeekday) { this.relativeWeekday = relativeWeekday; return this; }
    public PatternSpec onMonth(String onMonth) { this.onMonth = onMonth; return this; }
    public PatternSpec jobInterval(int jobInterval) { this.jobInterval = jobInterval; return this; }
    public PatternSpec exceptionDates(List<Integer> days) { this.exceptionDates.addAll(days); return this; }
    public PatternSpec endAfter(int occurrences) { this.endAfter = occurrences; return this; }

    /**
     * Repeats the job every {@code every} ({@code HH:mm}) until {@code end} ({@code HH:mm}).
     */
    public PatternSpec repeat(String every, String end) {
        this.repeatEvery = every;
        this.repeatEnd = end;
        return this;
    }

    public String getFreqType() { return freqType; }
    public String getScheduleName() { return scheduleName; }
    public String getActiveStartDate() { return activeStartDate; }
    public String getActiveStartTime() { return activeStartTime; }
    public String getActiveEndDate() { return activeEndDate; }
    public String getTimeZone() { return timeZone; }
    public Integer getRepeatDays() { return repeatDays; }
    public Integer getRepeatWeeks() { return repeatWeeks; }
    public List<String> getWeekdays() { return Collections.unmodifiableList(weekdays); }
    public Integer getRepeatMonths() { return repeatMonths; }
    public Integer getOnDay() { return onDay; }
    public String getRelativeTime() { return relativeTime; }
    public String getRelativeWeekday() { return relativeWeekday; }
    public String getOnMonth() { return onMonth; }
    public Integer getJobInterval() { return jobInterval; }
    public List<Integer> getExceptionDates() { return Collections.unmodifiableList(exceptionDates); }
    public Integer getEndAfter() { return endAfter; }
    public String getRepeatEvery() { return repeatEvery; }
    public String getRepeatEnd() { return repeatEnd; }
}
