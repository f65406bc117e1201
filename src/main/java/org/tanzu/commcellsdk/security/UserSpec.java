package org.tanzu.commcellsdk.security;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request to create a local or external user.
 *
 * A user with a domain is external: its name becomes {@code domain\name} and no
 * password is sent. A local user without a password gets a system generated one.
 */
public class UserSpec {

    private final String userName;
    private final String email;
    private String fullName;
    private String domain;
    private String password;
    private boolean systemGeneratedPassword;
    private final List<String> localUserGroups = new ArrayList<>();
    private JsonNode securityAssociations;

    public UserSpec(String userName, String email) {
        this.userName = userName;
        this.email = email;
    }

    public UserSpec fullName(String fullName) { this.fullName = fullName; return this; }
    public UserSpec domain(String domain) { this.domain = domain; return this; }
    public UserSpec password(String password) { this.password = password; return this; }
    public UserSpec systemGeneratedPassword(boolean value) { this.systemGeneratedPassword = value; return this; }
    public UserSpec localUserGroups(List<String> groups) { this.localUserGroups.addAll(groups); return this; }

    /**
     * Association entries sent under {@code securityAssociations.associations}.
     */
    public UserSpec securityAssociations(JsonNode associations) { this.securityAssociations = associations; return this; }

    public String getUserName() { return userName; }
    public String getEmail() { return email; }
    public String getFullName() { return fullName; }
    public String getDomain() { return domain; }
    public String getPassword() { return password; }
    public boolean isSystemGeneratedPassword() { return systemGeneratedPassword; }
    public List<String> getLocalUserGroups() { return Collections.unmodifiableList(localUserGroups); }
    public JsonNode getSecurityAssociations() { return securityAssociations; }

    /**
     * Name the user is created under.
     */
    public String qualifiedName() {
        return domain == null || domain.isEmpty() ? userName : domain + "\\" + userName;
    }
}
