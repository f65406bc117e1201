package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.Mutator;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;
import org.tanzu.commcellsdk.schedules.PatternSpec;
import org.tanzu.commcellsdk.schedules.SchedulePattern;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schedule policies on the Commcell, keyed by task name with the task id as value.
 */
public class SchedulePolicies extends NamedEntityCollection<SchedulePolicy>
        implements Mutator<SchedulePolicy, SchedulePolicySpec> {

    private static final Logger logger = LoggerFactory.getLogger(SchedulePolicies.class);

    /** Task type of a schedule policy */
    static final int TASK_TYPE_POLICY = 4;
    static final int INITIATED_FROM_GUI = 2;
    static final int OP_TYPE_DELETE = 3;
    static final int ENTITY_TYPE_TASK = 69;

    private final SchedulePattern schedulePattern;

    public SchedulePolicies(Commcell commcell) {
        this(commcell, new SchedulePattern(commcell.objectMapper()));
    }

    SchedulePolicies(Commcell commcell, SchedulePattern schedulePattern) {
        super(commcell);
        this.schedulePattern = schedulePattern;
    }

    @Override
    protected String module() {
        return "Schedules";
    }

    @Override
    protected String entityLabel() {
        return "Schedule Policy";
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.SCHEDULE_POLICIES));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        Map<String, JsonNode> policies = new LinkedHashMap<>();
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            return policies;
        }
        if (!json.has("taskDetail")) {
            throw new SdkException("Response", "102");
        }
        for (JsonNode policy : json.get("taskDetail")) {
            JsonNode task = policy.path("task");
            if (task.hasNonNull("taskName")) {
                policies.put(task.get("taskName").asText(), TextNode.valueOf(task.path("taskId").asText()));
            }
        }
        return policies;
    }

    @Override
    protected SchedulePolicy wrap(String name, JsonNode properties) {
        return new SchedulePolicy(commcell, name, properties.asText());
    }

    /**
     * Creates a schedule policy and returns it.
     *
     * @throws SdkException Schedules/102 when the policy type cannot be created or the
     *         server refuses the policy
     */
    @Override
    public SchedulePolicy add(SchedulePolicySpec spec) {
        requireName(spec.getName());
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.CREATE_UPDATE_SCHEDULE_POLICY), buildAddRequest(spec));
        String failure = taskFailure(commcell, response);
        refresh();
        if (failure != null) {
            throw new SdkException(module(), "102", "Failed to update properties of Schedule\nError: \"" + failure + "\"");
        }
        logger.info("Created schedule policy {} of type {}", spec.getName(), spec.getPolicyType().getDisplayName());
        return get(spec.getName());
    }

    ObjectNode buildAddRequest(SchedulePolicySpec spec) {
        PolicyType type = spec.getPolicyType();
        if (type == null) {
            throw new SdkException(module(), "102", "Policy type is required to create a schedule policy");
        }
        ObjectNode request = commcell.objectMapper().createObjectNode();
        ObjectNode taskInfo = request.putObject("taskInfo");
        taskInfo.set("associations", commcell.objectMapper().valueToTree(spec.getAssociations()));

        ObjectNode task = taskInfo.putObject("task");
        task.put("description", "");
        task.put("taskType", TASK_TYPE_POLICY);
        task.put("initiatedFrom", INITIATED_FROM_GUI);
        task.put("policyType", type.getCode());
        task.put("taskName", spec.getName());
        task.putObject("securityAssociations");
        task.putObject("taskSecurity");
        task.putObject("alert").put("alertName", "");
        ObjectNode taskFlags = task.putObject("taskFlags");
        taskFlags.put("isEdgeDrive", false);
        taskFlags.put("disabled", false);

        taskInfo.putObject("appGroup").set("appGroups", commcell.objectMapper().valueToTree(spec.getAppGroups()));

        ArrayNode subTasks = taskInfo.putArray("subTasks");
        for (SchedulePolicySpec.Schedule schedule : spec.getSchedules()) {
            subTasks.add(scheduleJson(type, schedule));
        }
        return request;
    }

    /**
     * One {@code subTasks} entry: operation, subtask, options and pattern.
     */
    ObjectNode scheduleJson(PolicyType type, SchedulePolicySpec.Schedule schedule) {
        ObjectNode subTask = commcell.objectMapper().createObjectNode();
        subTask.put("subTaskOperation", 1);
        ObjectNode inner = type.subTask(commcell.objectMapper());
        inner.put("subTaskName", schedule.getName() == null ? "" : schedule.getName());
        subTask.set("subTask", inner);
        subTask.set("options", type.options(commcell.objectMapper(), schedule.getOptions()));

        PatternSpec pattern = schedule.getPattern() != null ? schedule.getPattern() : new PatternSpec();
        if (pattern.getFreqType() == null) {
            pattern.freqType("daily");
        }
        ObjectNode wrapper = commcell.objectMapper().createObjectNode();
        wrapper.putObject("taskInfo").putArray("subTasks").add(subTask);
        schedulePattern.createSchedule(wrapper, pattern);
        return subTask;
    }

    /**
     * Failure message of a task create or update response, or null when it succeeded.
     */
    static String taskFailure(Commcell commcell, CommcellResponse response) {
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        if (json.hasNonNull("taskId") && !json.get("taskId").asText().isEmpty()) {
            return null;
        }
        if (json.has("errorCode")) {
            if (!ResponseClassifier.hasErrorCode(json)) {
                return null;
            }
            return json.path("errorMessage").asText("");
        }
        throw new SdkException("Response", "102");
    }

    /**
     * Deletes a schedule policy through a task operation qcommand.
     *
     * @throws SdkException Schedules/102 when no policy has that name or the server refuses
     */
    @Override
    public void delete(String name) {
        requireName(name);
        JsonNode taskId = all().get(normalize(name));
        if (taskId == null) {
            throw new SdkException(module(), "102", "No schedule policy exists for: " + name);
        }
        ObjectNode request = commcell.objectMapper().createObjectNode();
        ObjectNode operation = request.putObject("TMMsg_TaskOperationReq");
        operation.put("opType", OP_TYPE_DELETE);
        ObjectNode entity = operation.putArray("taskEntities").addObject();
        entity.put("_type_", ENTITY_TYPE_TASK);
        entity.put("taskId", taskId.asText());

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.EXECUTE_QCOMMAND), request);
        if (!response.isOk()) {
            throw new SdkException(module(), "102", "Failed to delete schedule policy\nError: \""
                    + ResponseClassifier.updateResponse(response.getBody()) + "\"");
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        if (ResponseClassifier.hasErrorCode(json)) {
            throw new SdkException(module(), "102", json.path("errorMessage").asText(""));
        }
        logger.info("Deleted schedule policy {}", name);
        refresh();
    }
}
