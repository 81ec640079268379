package com.openforge.clusterlens.config;

import com.openforge.clusterlens.llm.LlmProperties;
import com.openforge.clusterlens.stream.AgentStreamProperties;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Kubernetes: asks the API server for its version through the configured client
 *   - Model providers: primary + optional fallback (API key is masked)
 *   - Investigation loop and agent feed settings
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final KubernetesClient        kubernetesClient;
    private final LlmProperties           llmProperties;
    private final InvestigationProperties investigationProperties;
    private final AgentStreamProperties   streamProperties;
    private final Environment             env;

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");
        LlmProperties.ProviderConfig primary = llmProperties.primary();

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║            ClusterLens  —  Startup Summary               ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Kubernetes                                              ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Model Providers                                         ║
                ║    Primary        : {}  [{}]  key={}
                ║    Fallback       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Investigation                                           ║
                ║    Max Iterations : {}
                ║    Output Limit   : {} chars
                ║    Throttle Window: {} ms
                ║    Agent Feed     : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                checkCluster(),

                primary == null ? "(not configured)" : primary.name(),
                primary == null ? "-" : primary.model(),
                primary == null ? "-" : maskKey(primary.apiKey()),
                describeFallback(),

                investigationProperties.maxIterations(),
                investigationProperties.outputLimit(),
                investigationProperties.throttleWindow().toMillis(),
                streamProperties.streamUrl()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Reads the API server version. Returns a one-line summary or error message.
     */
    private String checkCluster() {
        String master = String.valueOf(kubernetesClient.getMasterUrl());
        try {
            VersionInfo version = kubernetesClient.getKubernetesVersion();
            return "✔ Connected  version=" + version.getGitVersion() + "  url=" + master;
        } catch (KubernetesClientException e) {
            return "✘ FAILED — " + master + "  " + e.getMessage();
        }
    }

    private String describeFallback() {
        if (!llmProperties.hasFallback()) {
            return "(none)";
        }
        LlmProperties.ProviderConfig fallback = llmProperties.fallback();
        return "%s  [%s]  key=%s".formatted(fallback.name(), fallback.model(), maskKey(fallback.apiKey()));
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     * Returns "(not set)" if the key looks like a placeholder.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank() || key.startsWith("sk-placeholder")) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
