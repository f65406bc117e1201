package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import org.tanzu.commcellsdk.schedules.PatternSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Request to create a schedule policy.
 *
 * Associations and app groups are sent as given, for example
 * {@code {"clientName": "client1"}} or {@code {"appGroupName": "Protected Files"}}.
 */
public class SchedulePolicySpec {

    private final String name;
    private final PolicyType policyType;
    private final List<Map<String, Object>> associations = new ArrayList<>();
    private final List<Schedule> schedules = new ArrayList<>();
    private final List<Map<String, Object>> appGroups = new ArrayList<>();

    public SchedulePolicySpec(String name, PolicyType policyType) {
        this.name = name;
        this.policyType = policyType;
    }

    public SchedulePolicySpec association(Map<String, Object> association) {
        this.associations.add(association);
        return this;
    }

    public SchedulePolicySpec schedule(String scheduleName, PatternSpec pattern, JsonNode options) {
        this.schedules.add(new Schedule(scheduleName, pattern, options));
        return this;
    }

    public SchedulePolicySpec appGroup(Map<String, Object> appGroup) {
        this.appGroups.add(appGroup);
        return this;
    }

    public String getName() { return name; }
    public PolicyType getPolicyType() { return policyType; }
    public List<Map<String, Object>> getAssociations() { return Collections.unmodifiableList(associations); }
    public List<Schedule> getSchedules() { return Collections.unmodifiableList(schedules); }
    public List<Map<String, Object>> getAppGroups() { return Collections.unmodifiableList(appGroups); }

    /**
     * One schedule of the policy. A null pattern means a daily schedule.
     */
    public static class Schedule {
        private final String name;
        private final PatternSpec pattern;
        private final JsonNode options;

        public Schedule(String name, PatternSpec pattern, JsonNode options) {
            this.name = name;
            this.pattern = pattern;
            this.options = options;
        }

        public String getName() { return name; }
        public PatternSpec getPattern() { return pattern; }
        public JsonNode getOptions() { return options; }
    }
}
