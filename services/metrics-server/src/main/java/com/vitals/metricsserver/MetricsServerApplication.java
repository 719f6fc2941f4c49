package com.vitals.metricsserver;

import com.vitals.metricsserver.config.MetricsServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Vitals metrics server: serves a health endpoint and a Prometheus stats endpoint.
 *
 * <p>Runs either as a single node or, with {@code vitals.server.cluster.enabled=true}, as a
 * coordinator in front of a pool of in-process workers. In cluster mode the health endpoint merges
 * the status of every worker into the coordinator's own, and the stats endpoint renders the
 * workers' meters side by side.
 */
@SpringBootApplication
@EnableConfigurationProperties(MetricsServerProperties.class)
public class MetricsServerApplication {

    private static final Logger log = LoggerFactory.getLogger(MetricsServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(MetricsServerApplication.class, args);
        log.info("Vitals metrics server started successfully");
    }
}
