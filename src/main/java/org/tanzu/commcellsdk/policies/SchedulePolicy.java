package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One schedule policy. The task definition is read from {@code SchedulePolicy/{id}} on
 * first access.
 */
public class SchedulePolicy {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePolicy.class);

    /** Flags set on associations by {@link #updateAssociations} */
    public enum AssociationOperation {
        INCLUDE("include"), EXCLUDE("exclude"), DELETE("deleted");

        private final String flag;

        AssociationOperation(String flag) {
            this.flag = flag;
        }

        public String getFlag() {
            return flag;
        }
    }

    private final Commcell commcell;
    private final String schedulePolicyName;
    private final String schedulePolicyId;

    private volatile JsonNode taskInfo;

    public SchedulePolicy(Commcell commcell, String schedulePolicyName, String schedulePolicyId) {
        this.commcell = commcell;
        this.schedulePolicyName = schedulePolicyName;
        this.schedulePolicyId = schedulePolicyId;
    }

    public String getSchedulePolicyName() { return schedulePolicyName; }
    public String getSchedulePolicyId() { return schedulePolicyId; }

    public JsonNode taskInfo() {
        if (taskInfo == null) {
            refresh();
        }
        return taskInfo;
    }

    public void refresh() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.SCHEDULE_POLICY, schedulePolicyId));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.has("taskInfo")) {
            throw new SdkException("Response", "102");
        }
        this.taskInfo = json.get("taskInfo");
    }

    public PolicyType getPolicyType() {
        return PolicyType.fromCode(taskInfo().path("task").path("policyType").asInt(-1));
    }

    public JsonNode getAssociations() {
        return taskInfo().path("associations");
    }

    public JsonNode getAppGroups() {
        return taskInfo().path("appGroup").path("appGroups");
    }

    /**
     * Schedules of this policy, schedule name to subtask id.
     */
    public Map<String, String> allSchedules() {
        Map<String, String> schedules = new LinkedHashMap<>();
        for (JsonNode subTask : taskInfo().path("subTasks")) {
            JsonNode inner = subTask.path("subTask");
            schedules.put(inner.path("subTaskName").asText(""), inner.path("subTaskId").asText());
        }
        return schedules;
    }

    /**
     * Re-sends the task with the given associations flagged for the operation.
     */
    public void updateAssociations(ArrayNode associations, AssociationOperation operation) {
        for (JsonNode association : associations) {
            ((ObjectNode) association).putObject("flags").put(operation.getFlag(), true);
        }
        ObjectNode request = commcell.objectMapper().createObjectNode();
        ObjectNode info = request.putObject("taskInfo");
        info.put("taskOperation", 1);
        info.set("associations", associations);
        info.set("task", taskInfo().path("task").deepCopy());
        info.putObject("appGroup").set("appGroups", getAppGroups().isArray()
                ? getAppGroups().deepCopy() : commcell.objectMapper().createArrayNode());
        info.set("subTasks", taskInfo().path("subTasks").deepCopy());

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.PUT,
                commcell.services().url(Endpoint.CREATE_UPDATE_SCHEDULE_POLICY), request);
        String failure = SchedulePolicies.taskFailure(commcell, response);
        refresh();
        if (failure != null) {
            throw new SdkException("Schedules", "102",
                    "Failed to update properties of Schedule Policy\nError: \"" + failure + "\"");
        }
        logger.info("Updated associations of schedule policy {}", schedulePolicyName);
    }

    public void enable() {
        changeState(Endpoint.ENABLE_SCHEDULE, "enable");
    }

    public void disable() {
        changeState(Endpoint.DISABLE_SCHEDULE, "disable");
    }

    private void changeState(Endpoint endpoint, String action) {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(endpoint), "taskId=" + schedulePolicyId);
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        if (ResponseClassifier.hasErrorCode(json)) {
            String message = "Failed to " + action + " Schedule Policy";
            if (json.hasNonNull("errorMessage")) {
                message = message + "\nError: " + json.get("errorMessage").asText();
            }
            throw new SdkException("Schedules", "102", message);
        }
        logger.info("Schedule policy {}: {}d", schedulePolicyName, action);
    }

    @Override
    public String toString() {
        return "SchedulePolicy{name='" + schedulePolicyName + "', id='" + schedulePolicyId + "'}";
    }
}
