package com.openforge.clusterlens.investigation.diagnostic;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resource kinds the generic tools understand, keyed by every spelling the
 * model tends to use: kind, plural and kubectl short name, in any case.
 */
public final class ResourceKinds {

    private static final Map<String, ResourceDefinitionContext> BY_ALIAS = new HashMap<>();

    static {
        register("",                          "v1",      "Pod",                     "pods",                     true,  "po");
        register("",                          "v1",      "Service",                 "services",                 true,  "svc");
        register("",                          "v1",      "ConfigMap",               "configmaps",               true,  "cm");
        register("",                          "v1",      "Secret",                  "secrets",                  true);
        register("",                          "v1",      "PersistentVolumeClaim",   "persistentvolumeclaims",   true,  "pvc");
        register("",                          "v1",      "Endpoints",               "endpoints",                true,  "ep");
        register("",                          "v1",      "ServiceAccount",          "serviceaccounts",          true,  "sa");
        register("",                          "v1",      "Event",                   "events",                   true,  "ev");
        register("",                          "v1",      "PersistentVolume",        "persistentvolumes",        false, "pv");
        register("",                          "v1",      "Node",                    "nodes",                    false, "no");
        register("",                          "v1",      "Namespace",               "namespaces",               false, "ns");
        register("apps",                      "v1",      "Deployment",              "deployments",              true,  "deploy");
        register("apps",                      "v1",      "ReplicaSet",              "replicasets",              true,  "rs");
        register("apps",                      "v1",      "StatefulSet",             "statefulsets",             true,  "sts");
        register("apps",                      "v1",      "DaemonSet",               "daemonsets",               true,  "ds");
        register("batch",                     "v1",      "Job",                     "jobs",                     true);
        register("batch",                     "v1",      "CronJob",                 "cronjobs",                 true,  "cj");
        register("networking.k8s.io",         "v1",      "Ingress",                 "ingresses",                true,  "ing");
        register("networking.k8s.io",         "v1",      "NetworkPolicy",           "networkpolicies",          true,  "netpol");
        register("autoscaling",               "v2",      "HorizontalPodAutoscaler", "horizontalpodautoscalers", true,  "hpa");
        register("policy",                    "v1",      "PodDisruptionBudget",     "poddisruptionbudgets",     true,  "pdb");
        register("rbac.authorization.k8s.io", "v1",      "Role",                    "roles",                    true);
        register("rbac.authorization.k8s.io", "v1",      "RoleBinding",             "rolebindings",             true);
        register("storage.k8s.io",            "v1",      "StorageClass",            "storageclasses",           false, "sc");
    }

    private ResourceKinds() {
    }

    public static Optional<ResourceDefinitionContext> resolve(String kind) {
        if (kind == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(kind.trim().toLowerCase(Locale.ROOT)));
    }

    /** Resolves a kind or fails with a message the tool layer reports as "not found". */
    public static ResourceDefinitionContext require(String kind, String command) {
        return resolve(kind).orElseThrow(() -> new DiagnosticException(
                "resource kind \"%s\" not found; supported kinds: %s".formatted(kind, supportedKinds()), command));
    }

    public static String supportedKinds() {
        return BY_ALIAS.values().stream()
                .map(ResourceDefinitionContext::getKind)
                .distinct()
                .sorted()
                .reduce((a, b) -> a + ", " + b)
                .orElse("");
    }

    private static void register(String group, String version, String kind, String plural,
                                 boolean namespaced, String... shortNames) {
        ResourceDefinitionContext context = new ResourceDefinitionContext.Builder()
                .withGroup(group.isEmpty() ? null : group)
                .withVersion(version)
                .withKind(kind)
                .withPlural(plural)
                .withNamespaced(namespaced)
                .build();
        BY_ALIAS.put(kind.toLowerCase(Locale.ROOT), context);
        BY_ALIAS.put(plural, context);
        for (String shortName : shortNames) {
            BY_ALIAS.put(shortName, context);
        }
    }
}
