package org.tanzu.commcellsdk.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

import java.util.Locale;

/**
 * Completes {@link CommcellConfig} from a Cloud Foundry service binding.
 *
 * When host or credentials are still missing after property binding, the
 * VCAP_SERVICES variable is searched for a service whose name mentions "commcell"
 * or "commvault", and its credentials fill only the values that are not yet set.
 *
 * Configuration priority (highest to lowest):
 * 1. Environment variables and application.properties
 * 2. Cloud Foundry service binding (VCAP_SERVICES)
 * 3. Default values
 */
@Component
public class CommcellConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommcellConfigProcessor.class);

    private final CommcellConfig commcellConfig;

    private final Environment environment;

    private final ObjectMapper mapper = new ObjectMapper();

    public CommcellConfigProcessor(CommcellConfig commcellConfig, Environment environment) {
        this.commcellConfig = commcellConfig;
        this.environment = environment;
    }

    @PostConstruct
    public void processVcapServices() {
        logger.info("Processing Commcell configuration: {}", commcellConfig);

        if (isConfigurationComplete()) {
            logger.info("Commcell configuration is complete from properties");
            return;
        }

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.warn("VCAP_SERVICES not available and Commcell configuration incomplete");
            return;
        }

        try {
            JsonNode credentials = findCommcellCredentials(mapper.readTree(vcapServices));
            if (credentials == null) {
                logger.warn("No Commcell service found in VCAP_SERVICES");
                return;
            }
            updateConfigurationFromVcap(credentials);
            logger.info("Commcell configuration updated from VCAP_SERVICES: {}", commcellConfig);
        } catch (JsonProcessingException e) {
            logger.error("VCAP_SERVICES is not valid JSON: {}", e.getOriginalMessage());
        }
    }

    boolean isConfigurationComplete() {
        boolean hostValid = CommcellConfig.hasText(commcellConfig.getHost());
        boolean tokenValid = CommcellConfig.hasText(commcellConfig.getAuthtoken());
        boolean credentialsValid = CommcellConfig.hasText(commcellConfig.getUsername())
                && CommcellConfig.hasText(commcellConfig.getPassword());
        logger.debug("Configuration validation - host: {}, token: {}, credentials: {}",
                hostValid, tokenValid, credentialsValid);
        return hostValid && (tokenValid || credentialsValid);
    }

    private JsonNode findCommcellCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText().toLowerCase(Locale.ROOT);
                if (serviceName.contains("commcell") || serviceName.contains("commvault")) {
                    logger.info("Found Commcell service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    private void updateConfigurationFromVcap(JsonNode credentials) {
        if (!CommcellConfig.hasText(commcellConfig.getHost()) && credentials.hasNonNull("host")) {
            commcellConfig.setHost(credentials.path("host").asText());
        }
        if (!CommcellConfig.hasText(commcellConfig.getUsername()) && credentials.hasNonNull("username")) {
            commcellConfig.setUsername(credentials.path("username").asText());
        }
        if (!CommcellConfig.hasText(commcellConfig.getPassword()) && credentials.hasNonNull("password")) {
            commcellConfig.setPassword(credentials.path("password").asText());
        }
        if (!CommcellConfig.hasText(commcellConfig.getAuthtoken()) && credentials.hasNonNull("authtoken")) {
            commcellConfig.setAuthtoken(credentials.path("authtoken").asText());
        }
        if (credentials.has("insecure")) {
            commcellConfig.setInsecure(credentials.path("insecure").asBoolean(true));
        }
        if (credentials.has("force_https")) {
            commcellConfig.setForceHttps(credentials.path("force_https").asBoolean(false));
        }
    }
}
