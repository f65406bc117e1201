package org.tanzu.commcellsdk.commcell;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.commcellsdk.config.CommcellConfig;

import java.util.concurrent.ExecutorService;

/**
 * Holds the application's shared {@link Commcell} session.
 *
 * The session is opened on first use rather than at startup, so the application starts
 * even when the Commcell is not reachable. A logged out session is replaced by a new one
 * on the next call.
 */
@Component
public class CommcellConnector {

    private static final Logger logger = LoggerFactory.getLogger(CommcellConnector.class);

    private final CommcellConfig commcellConfig;
    private final WebClient.Builder webClientBuilder;
    private final ExecutorService initTaskExecutor;

    private Commcell session;

    public CommcellConnector(CommcellConfig commcellConfig, WebClient.Builder commcellWebClientBuilder,
                             ExecutorService initTaskExecutor) {
        this.commcellConfig = commcellConfig;
        this.webClientBuilder = commcellWebClientBuilder;
        this.initTaskExecutor = initTaskExecutor;
    }

    /**
     * Returns the open session, connecting first when there is none.
     */
    public synchronized Commcell session() {
        if (session == null || session.isLoggedOut()) {
            logger.info("Opening Commcell session to {}", commcellConfig.getHost());
            session = new Commcell(commcellConfig, webClientBuilder.build(), initTaskExecutor);
        }
        return session;
    }

    public synchronized boolean isConnected() {
        return session != null && !session.isLoggedOut();
    }

    @PreDestroy
    public synchronized void close() {
        if (session != null && !session.isLoggedOut()) {
            logger.info("Closing Commcell session: {}", session.logout());
        }
        session = null;
    }
}
