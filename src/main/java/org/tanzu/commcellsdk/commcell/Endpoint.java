package org.tanzu.commcellsdk.commcell;

/**
 * REST endpoints of the Commcell web service, relative to the web service base URL.
 * Templates use {@code %s} for path or query parameters.
 */
public enum Endpoint {

    LOGIN("Login"),
    LOGOUT("Logout"),
    RENEW_LOGIN_TOKEN("RenewLoginToken"),
    WHO_AM_I("WhoAmI"),
    COMMSERV("CommServ"),
    EXECUTE_QCOMMAND("Qcommand/qoperation execute"),

    GET_ALL_CLIENTS("Client"),
    CLIENT("Client/%s"),
    DELETE_CLIENT("Client/%s?forceDelete=1"),

    CLIENTGROUPS("ClientGroup"),
    CLIENTGROUP("ClientGroup/%s"),

    STORAGE_POLICY("StoragePolicy/%s"),
    GET_ALL_STORAGE_POLICIES("StoragePolicy?getAll=TRUE"),
    DELETE_STORAGE_POLICY("V2/StoragePolicy/%s"),

    SCHEDULE_POLICIES("SchedulePolicy"),
    SCHEDULE_POLICY("SchedulePolicy/%s"),
    ENABLE_SCHEDULE("Schedules/task/Action/Enable"),
    DISABLE_SCHEDULE("Schedules/task/Action/Disable"),
    CREATE_UPDATE_SCHEDULE_POLICY("Task"),

    USERS("User"),
    USER("User/%s?Level=50"),
    DELETE_USER("User/%s?newUserId=%s&newUserGroupId=%s"),
    USERGROUPS("UserGroup?includeSystemCreated=true"),

    GET_REPLICATION_PAIRS("Replications/Monitors/streaming?"),
    GET_REPLICATION_PAIR("Replications/Monitors/streaming?replicationPairId=%s"),

    GET_BLR_PAIRS("Replications/Monitors/continuous"),
    GET_BLR_PAIR("Replications/Monitors/continuous?replicationPairId=%s"),
    DELETE_BLR_PAIR("Replications/Monitors/continuous/%s"),
    CREATE_BLR_PAIR("Replications/Groups"),

    GET_ANALYTICS_ENGINES("dcube/getAnalyticsEngine"),
    GET_ALL_DATASOURCES("dcube/GetDataSources?summary=1"),
    START_JOB_DATASOURCE("dcube/startjob/%s"),
    GET_CRAWL_HISTORY("dcube/GetHistory/%s"),

    EDISCOVERY_CRAWL("EDiscoveryClients/Clients/%s/Jobs?datasourceId=%s&type=%s&operation=%s"),
    EDISCOVERY_JOBS_HISTORY("EDiscoveryClients/Clients/%s/Jobs/History?type=%s&datasourceId=%s"),
    EDISCOVERY_JOB_STATUS("EDiscoveryClients/Clients/%s/Jobs/Status?type=%s&datasourceId=%s");

    private final String template;

    Endpoint(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
