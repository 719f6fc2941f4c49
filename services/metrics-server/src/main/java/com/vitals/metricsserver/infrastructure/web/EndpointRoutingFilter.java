package com.vitals.metricsserver.infrastructure.web;

import com.vitals.metricsserver.config.MetricsServerProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Lets only {@code GET} requests for the health and stats endpoints through.
 *
 * <p>Anything else, another method or another path, is answered with 404 before it reaches Spring
 * MVC. The path is matched exactly, without the query string.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EndpointRoutingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(EndpointRoutingFilter.class);

    private final Set<String> paths;

    public EndpointRoutingFilter(MetricsServerProperties properties) {
        this.paths = Set.of(properties.endpoints().health(), properties.endpoints().stats());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (HttpMethod.GET.matches(request.getMethod()) && paths.contains(path)) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("No endpoint for {} {}", request.getMethod(), path);
        ResponseWriter.writeNotFound(response);
    }
}
