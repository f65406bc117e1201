package org.tanzu.commcellsdk;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.commcellsdk.mcp.CommcellToolService;

import java.util.List;

/**
 * Spring Boot entry point of the Commcell SDK.
 *
 * The application wires the shared Commcell session through
 * {@link org.tanzu.commcellsdk.commcell.CommcellConnector}, together with its WebClient
 * builder and init executor. It then exposes the read-only Commcell tools through the
 * Spring AI MCP server.
 *
 * Connection settings come from the {@code commcell.*} properties, the matching
 * {@code COMMCELL_*} environment variables, or a Cloud Foundry service binding. The
 * session is opened on the first tool call, so the server starts even when the
 * Commcell cannot be reached yet.
 */
@SpringBootApplication
@EnableConfigurationProperties
public class CommcellSdkApplication {

    /**
     * Starts the MCP server.
     *
     * The MCP server name and version are set as system properties before the context
     * starts, so they win over any value in {@code application.properties}.
     *
     * @param args command line arguments passed to Spring Boot
     */
    public static void main(String[] args) {
        System.setProperty("spring.ai.mcp.server.name", "commcell-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(CommcellSdkApplication.class, args);
    }

    /**
     * Registers the Commcell tools with the MCP server.
     *
     * Every {@code @Tool} method of {@link CommcellToolService} becomes a tool callback
     * that the MCP server publishes to its clients.
     *
     * @param commcellToolService the service holding the tool methods
     * @return the tool callbacks for the MCP server
     */
    @Bean
    public List<ToolCallback> registerTools(CommcellToolService commcellToolService) {
        return List.of(ToolCallbacks.from(commcellToolService));
    }
}
