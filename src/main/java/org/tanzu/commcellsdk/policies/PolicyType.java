package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tanzu.commcellsdk.commcell.SdkException;

/**
 * Schedule policy types with their {@code policyType} code.
 *
 * Only {@link #DATA_PROTECTION} and {@link #AUXILIARY_COPY} carry a subtask type, so
 * only those can be created.
 */
public enum PolicyType {

    DATA_PROTECTION("Data Protection", 0, 2, 2),
    AUXILIARY_COPY("Auxiliary Copy", 1, 1, 4003),
    PRIMARY_STORAGE_REPORTS("Primary Storage Reports", 2),
    BACKUP_COPY("Backup Copy", 3),
    SRM_DATA_COLLECTION("SRM Data Collection", 4),
    SUBCLIENT_FILTER_FOR_BACKUP_JOB_REPORT("Subclient Filter for BackupJob Report", 5),
    OFFLINE_CONTENT_INDEXING("Offline Content Indexing", 6),
    INSTALL_UPDATES("Install Updates", 7),
    NETWORK_THROTTLE("Network Throttle", 8);

    private final String displayName;
    private final int code;
    private final int subTaskType;
    private final int operationType;

    PolicyType(String displayName, int code) {
        this(displayName, code, -1, -1);
    }

    PolicyType(String displayName, int code, int subTaskType, int operationType) {
        this.displayName = displayName;
        this.code = code;
        this.subTaskType = subTaskType;
        this.operationType = operationType;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getCode() {
        return code;
    }

    public boolean hasSubTask() {
        return subTaskType >= 0;
    }

    /**
     * The {@code subTask} node of a new schedule of this type.
     *
     * @throws SdkException Schedules/102 when the type has no subtask mapping
     */
    ObjectNode subTask(ObjectMapper objectMapper) {
        if (!hasSubTask()) {
            throw new SdkException("Schedules", "102", "Schedule policies of type " + displayName + " cannot be created");
        }
        ObjectNode subTask = objectMapper.createObjectNode();
        subTask.put("subTaskType", subTaskType);
        subTask.put("operationType", operationType);
        return subTask;
    }

    /**
     * Default job options of this type, overlaid with the given options.
     */
    ObjectNode options(ObjectMapper objectMapper, JsonNode overrides) {
        ObjectNode values = objectMapper.createObjectNode();
        ObjectNode options = objectMapper.createObjectNode();
        if (this == AUXILIARY_COPY) {
            values.put("maxNumberOfStreams", 0);
            values.put("useMaximumStreams", true);
            values.put("useScallableResourceManagement", true);
            values.put("totalJobsToProcess", 1000);
            values.put("allCopies", true);
            values.putObject("mediaAgent").put("mediaAgentName", "<ANY MEDIAAGENT>");
            overlay(values, overrides);
            options.putObject("backupOpts").putObject("mediaOpt").set("auxcopyJobOption", values);
        } else {
            values.put("backupLevel", "Incremental");
            values.put("incLevel", 1);
            values.put("runIncrementalBackup", false);
            overlay(values, overrides);
            options.set("backupOpts", values);
        }
        return options;
    }

    private static void overlay(ObjectNode target, JsonNode overrides) {
        if (overrides != null && overrides.isObject()) {
            overrides.fields().forEachRemaining(field -> target.set(field.getKey(), field.getValue()));
        }
    }

    /**
     * Finds a type by display name or code, ignoring case.
     *
     * @return the type, or null when nothing matches
     */
    public static PolicyType fromName(String name) {
        for (PolicyType type : values()) {
            if (type.displayName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        return null;
    }

    public static PolicyType fromCode(int code) {
        for (PolicyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return null;
    }
}
