package org.tanzu.commcellsdk.security;

public class UserGroup {

    private final String userGroupName;
    private final String userGroupId;

    public UserGroup(String userGroupName, String userGroupId) {
        this.userGroupName = userGroupName;
        this.userGroupId = userGroupId;
    }

    public String getUserGroupName() { return userGroupName; }
    public String getUserGroupId() { return userGroupId; }

    @Override
    public String toString() {
        return "UserGroup{name='" + userGroupName + "', id='" + userGroupId + "'}";
    }
}
