package com.vitals.metricsserver.api;

import com.vitals.metricsserver.handler.HealthRequestHandler;
import com.vitals.metricsserver.handler.StatsRequestHandler;
import jakarta.servlet.http.HttpServletRequest;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * The health and stats endpoints. Both complete asynchronously, so no servlet thread waits for
 * workers or scrapes.
 */
@RestController
public class MetricsEndpointController {

    /** The bound {@code vitals.server} properties, so mappings see the same defaults as the filter. */
    private static final String PROPERTIES =
            "@'vitals.server-com.vitals.metricsserver.config.MetricsServerProperties'";

    private final HealthRequestHandler healthHandler;
    private final StatsRequestHandler statsHandler;

    public MetricsEndpointController(HealthRequestHandler healthHandler, StatsRequestHandler statsHandler) {
        this.healthHandler = healthHandler;
        this.statsHandler = statsHandler;
    }

    @GetMapping("#{" + PROPERTIES + ".endpoints().health()}")
    public CompletableFuture<ResponseEntity<String>> health(HttpServletRequest request) {
        return healthHandler.handle(request::getHeader);
    }

    @GetMapping("#{" + PROPERTIES + ".endpoints().stats()}")
    public CompletableFuture<ResponseEntity<String>> stats(HttpServletRequest request) {
        return statsHandler.handle(request::getHeader);
    }
}
