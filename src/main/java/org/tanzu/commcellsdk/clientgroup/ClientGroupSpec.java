package org.tanzu.commcellsdk.clientgroup;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to create a client group.
 *
 * Activity control is only sent when one of the enable flags was set explicitly.
 */
public class ClientGroupSpec {

    private final String name;
    private final List<String> clients = new ArrayList<>();
    private String description = "";
    private JsonNode scgRule;
    private Boolean enableBackup;
    private Boolean enableRestore;
    private Boolean enableDataAging;

    public ClientGroupSpec(String name) {
        this.name = name;
    }

    public ClientGroupSpec clients(List<String> clientNames) {
        this.clients.addAll(clientNames);
        return this;
    }

    public ClientGroupSpec description(String description) {
        this.description = description;
        return this;
    }

    /**
     * Smart client group rule; makes the group a smart group.
     */
    public ClientGroupSpec scgRule(JsonNode scgRule) {
        this.scgRule = scgRule;
        return this;
    }

    public ClientGroupSpec enableBackup(boolean enable) {
        this.enableBackup = enable;
        return this;
    }

    public ClientGroupSpec enableRestore(boolean enable) {
        this.enableRestore = enable;
        return this;
    }

    public ClientGroupSpec enableDataAging(boolean enable) {
        this.enableDataAging = enable;
        return this;
    }

    public String getName() { return name; }
    public List<String> getClients() { return Collections.unmodifiableList(clients); }
    public String getDescription() { return description; }
    public JsonNode getScgRule() { return scgRule; }
    public Boolean getEnableBackup() { return enableBackup; }
    public Boolean getEnableRestore() { return enableRestore; }
    public Boolean getEnableDataAging() { return enableDataAging; }

    public boolean isSmart() {
        return scgRule != null && !scgRule.isEmpty();
    }

    public boolean hasActivityControl() {
        return enableBackup != null || enableRestore != null || enableDataAging != null;
    }
}
