package com.openforge.clusterlens.stream;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Location of the external agent's progress feed.
 *
 * agent:
 *   stream:
 *     base-url: http://127.0.0.1:8765
 *     path: /analyze                 # GET {base-url}{path}?query_id=<id>
 */
@ConfigurationProperties(prefix = "agent.stream")
public record AgentStreamProperties(
        @DefaultValue("http://127.0.0.1:8765") String baseUrl,
        @DefaultValue("/analyze")              String path
) {

    public String streamUrl() {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String suffix = path.startsWith("/") ? path : "/" + path;
        return base + suffix;
    }
}
