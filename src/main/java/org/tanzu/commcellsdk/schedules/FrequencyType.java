package org.tanzu.commcellsdk.schedules;

import java.util.Locale;

/**
 * Schedule frequencies and the {@code freq_type} value the server expects for each.
 */
public enum FrequencyType {

    ONE_TIME(1),
    DAILY(4),
    WEEKLY(8),
    MONTHLY(16),
    MONTHLY_RELATIVE(32),
    YEARLY(64),
    YEARLY_RELATIVE(128),
    CONTINUOUS(4096),
    AFTER_JOB_COMPLETES(-1);

    private final int code;

    FrequencyType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Parses names such as "daily" or "One_Time", ignoring case.
     *
     * @return the frequency, or null for an unknown name
     */
    public static FrequencyType fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (FrequencyType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
