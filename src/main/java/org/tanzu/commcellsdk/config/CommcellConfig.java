package org.tanzu.commcellsdk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for a Commcell web service.
 *
 * Bound from the "commcell" prefix, so properties such as "commcell.host" or the
 * COMMCELL_HOST environment variable map directly onto this class. Missing credentials
 * may be completed from a Cloud Foundry binding by {@link CommcellConfigProcessor}.
 *
 * Either a username/password pair or an authtoken is required to open a session.
 */
@Component
@ConfigurationProperties(prefix = "commcell")
public class CommcellConfig {

    /** Commcell web server hostname or IP address */
    private String host;

    /** Commcell user name */
    private String username;

    /** Plain text password, encoded before it is sent */
    private String password;

    /** Pre-authenticated token (QSDK or SAML) used instead of username/password */
    private String authtoken;

    /** Only try the https scheme during service discovery */
    private boolean forceHttps = false;

    /** CA bundle path; setting it implies https */
    private String certificatePath;

    /** Skip SSL certificate validation */
    private boolean insecure = true;

    /** Time allowed for the web service reachability check */
    private Duration serviceCheckTimeout = Duration.ofSeconds(184);

    /** Interval between eDiscovery crawl job status polls */
    private Duration crawlPollInterval = Duration.ofSeconds(10);

    /** Number of requests tried with a renewed token before giving up */
    private int maxLoginAttempts = 3;

    /** Size of the pool used for parallel feature initialization */
    private int initThreadCount = 4;

    public String getHost() { return host; }

    public void setHost(String host) { this.host = host; }

    public String getUsername() { return username; }

    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }

    public void setPassword(String password) { this.password = password; }

    public String getAuthtoken() { return authtoken; }

    public void setAuthtoken(String authtoken) { this.authtoken = authtoken; }

    public boolean isForceHttps() { return forceHttps; }

    public void setForceHttps(boolean forceHttps) { this.forceHttps = forceHttps; }

    public String getCertificatePath() { return certificatePath; }

    public void setCertificatePath(String certificatePath) { this.certificatePath = certificatePath; }

    public boolean isInsecure() { return insecure; }

    public void setInsecure(boolean insecure) { this.insecure = insecure; }

    public Duration getServiceCheckTimeout() { return serviceCheckTimeout; }

    public void setServiceCheckTimeout(Duration serviceCheckTimeout) { this.serviceCheckTimeout = serviceCheckTimeout; }

    public Duration getCrawlPollInterval() { return crawlPollInterval; }

    public void setCrawlPollInterval(Duration crawlPollInterval) { this.crawlPollInterval = crawlPollInterval; }

    public int getMaxLoginAttempts() { return maxLoginAttempts; }

    public void setMaxLoginAttempts(int maxLoginAttempts) { this.maxLoginAttempts = maxLoginAttempts; }

    public int getInitThreadCount() { return initThreadCount; }

    public void setInitThreadCount(int initThreadCount) { this.initThreadCount = initThreadCount; }

    /**
     * True when a certificate path is configured or https is forced.
     * @return whether plain http must not be attempted
     */
    public boolean isHttpsOnly() {
        return forceHttps || hasText(certificatePath);
    }

    public static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }

    /**
     * Password and token are hidden so the configuration can be logged.
     */
    @Override
    public String toString() {
        return "CommcellConfig{" +
                "host='" + host + '\'' +
                ", username='" + username + '\'' +
                ", password='[HIDDEN]'" +
                ", authtoken=" + (hasText(authtoken) ? "'[HIDDEN]'" : "null") +
                ", forceHttps=" + forceHttps +
                ", insecure=" + insecure +
                ", serviceCheckTimeout=" + serviceCheckTimeout +
                '}';
    }
}
