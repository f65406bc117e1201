package org.tanzu.commcellsdk.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.io.File;

/**
 * WebClient setup for the Commcell web service.
 *
 * Every Commcell session builds its {@link WebClient} from the builder defined here,
 * so each request made by the SDK shares one Netty connector configuration.
 *
 * Certificate handling follows {@link CommcellConfig}: a configured certificate path is
 * used as the trust store, otherwise insecure mode trusts every certificate. Without
 * either, the JVM default trust store validates the server.
 *
 * The connect and response timeouts follow the service check timeout, which also
 * bounds how long web service discovery waits for each candidate URL.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder used for Commcell sessions.
     *
     * The builder sends JSON Accept headers by default and raises the in-memory codec
     * limit to 16 MB, since list responses such as the client or job lists can be
     * large on busy Commcells.
     *
     * The TLS setup comes from {@link #buildSslContext(CommcellConfig)}. When that
     * returns null, Reactor Netty's default SSL handling is left in place.
     *
     * @param commcellConfig the Commcell connection settings
     * @return a builder each session turns into its own WebClient
     */
    @Bean
    public WebClient.Builder commcellWebClientBuilder(CommcellConfig commcellConfig) {
        logger.info("Configuring WebClient.Builder for Commcell: {} (insecure={})",
                commcellConfig.getHost(), commcellConfig.isInsecure());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) commcellConfig.getServiceCheckTimeout().toMillis())
                .responseTimeout(commcellConfig.getServiceCheckTimeout());

        SslContext sslContext = buildSslContext(commcellConfig);
        if (sslContext != null) {
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
        }

        return WebClient.builder()
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    /**
     * Builds the client SSL context for the configured trust mode.
     *
     * @return the SSL context, or null to keep the default validation
     * @throws IllegalStateException when the certificate bundle cannot be loaded
     */
    private SslContext buildSslContext(CommcellConfig commcellConfig) {
        try {
            if (CommcellConfig.hasText(commcellConfig.getCertificatePath())) {
                logger.info("Using certificate bundle {} for Commcell connection", commcellConfig.getCertificatePath());
                return SslContextBuilder.forClient()
                        .trustManager(new File(commcellConfig.getCertificatePath()))
                        .build();
            }
            if (commcellConfig.isInsecure()) {
                logger.warn("SSL validation is DISABLED for Commcell connection (insecure=true)");
                return SslContextBuilder.forClient()
                        .trustManager(InsecureTrustManagerFactory.INSTANCE)
                        .build();
            }
        } catch (SSLException e) {
            logger.error("Failed to configure SSL context: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to configure SSL context for Commcell connection", e);
        }
        logger.info("Using default SSL validation for Commcell connection");
        return null;
    }
}
