package com.openforge.clusterlens.investigation.diagnostic;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.EndpointSubset;
import io.fabric8.kubernetes.api.model.Endpoints;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServicePort;
import io.fabric8.kubernetes.api.model.Taint;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetrics;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetrics;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link DiagnosticProvider} backed by the fabric8 Kubernetes client.
 *
 * Every call is a GET against the API server. Results are rendered as short,
 * kubectl-like text because the consumer is a language model, not a program.
 * API failures are rethrown as {@link DiagnosticException} with the server's
 * message intact.
 *
 * Pod-only tools (logs, usage, node, storage) accept a workload target too:
 * the first pod matched by the workload's selector is used.
 */
@Slf4j
@Component
public class KubernetesDiagnosticProvider implements DiagnosticProvider {

    private static final int MAX_OWNER_DEPTH = 5;

    // kubectl-style output: no document marker, scalars unquoted unless ambiguous
    private static final YAMLMapper YAML = YAMLMapper.builder()
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private final KubernetesClient client;

    public KubernetesDiagnosticProvider(KubernetesClient client) {
        this.client = client;
    }

    // ── Manifest & events ────────────────────────────────────────────────────

    @Override
    public DiagnosticResult yaml(TargetResource target) {
        String command = "kubectl get %s %s%s -o yaml".formatted(
                kindArg(target.kind()), target.name(), namespaceFlag(target.namespace()));
        return call(command, () -> toYaml(getGeneric(target.kind(), target.namespace(), target.name(), command), command));
    }

    @Override
    public DiagnosticResult events(TargetResource target) {
        String command = "kubectl get events%s --field-selector involvedObject.name=%s".formatted(
                namespaceFlag(target.namespace()), target.name());
        return call(command, () -> {
            List<Event> events = eventsFor(target.namespace(), target.kind(), target.name());
            if (events.isEmpty()) {
                return "No events found for " + target.display();
            }
            return formatEvents(events);
        });
    }

    // ── Logs ─────────────────────────────────────────────────────────────────

    @Override
    public DiagnosticResult logs(TargetResource target, Optional<String> container, int tailLines) {
        return readLogs(target, container, tailLines, false);
    }

    @Override
    public DiagnosticResult previousLogs(TargetResource target, Optional<String> container, int tailLines) {
        return readLogs(target, container, tailLines, true);
    }

    private DiagnosticResult readLogs(TargetResource target, Optional<String> container,
                                      int tailLines, boolean previous) {
        String ns = target.namespace();
        String placeholder = "kubectl logs %s%s%s --tail=%d%s".formatted(
                target.name(), namespaceFlag(ns), container.map(c -> " -c " + c).orElse(""),
                tailLines, previous ? " --previous" : "");

        Pod pod = fetch(placeholder, () -> resolvePod(target, placeholder));
        String podName = pod.getMetadata().getName();
        String containerName = resolveContainer(pod, container, placeholder);
        String command = "kubectl logs %s%s -c %s --tail=%d%s".formatted(
                podName, namespaceFlag(ns), containerName, tailLines, previous ? " --previous" : "");

        return call(command, () -> {
            var containerResource = client.pods().inNamespace(ns).withName(podName).inContainer(containerName);
            String output;
            if (previous) {
                try {
                    output = containerResource.terminated().tailingLines(tailLines).getLog();
                } catch (KubernetesClientException e) {
                    // the API answers 400 when the container never terminated
                    if (!isNoPreviousContainer(e)) {
                        throw e;
                    }
                    log.debug("[Diagnostics] No terminated instance of {}/{}: {}", podName, containerName, apiMessage(e));
                    output = null;
                }
            } else {
                output = containerResource.tailingLines(tailLines).getLog();
            }
            if (output == null || output.isBlank()) {
                return previous
                        ? "No previous logs for container %s of pod %s (the container has not restarted)".formatted(containerName, podName)
                        : "No log output from container %s of pod %s".formatted(containerName, podName);
            }
            return output;
        });
    }

    /**
     * Exact match first, then case-insensitive, then substring either way.
     * Anything else is reported with the list of valid names.
     */
    static String resolveContainer(Pod pod, Optional<String> requested, String command) {
        List<String> names = Optional.ofNullable(pod.getSpec())
                .map(spec -> spec.getContainers())
                .orElse(List.of())
                .stream()
                .map(Container::getName)
                .filter(Objects::nonNull)
                .toList();
        String podName = pod.getMetadata().getName();
        if (names.isEmpty()) {
            throw new DiagnosticException("pod %s has no containers".formatted(podName), command);
        }
        if (requested.isEmpty()) {
            return names.get(0);
        }

        String wanted = requested.get();
        if (names.contains(wanted)) {
            return wanted;
        }
        String lower = wanted.toLowerCase(Locale.ROOT);
        Optional<String> match = names.stream()
                .filter(n -> n.toLowerCase(Locale.ROOT).equals(lower))
                .findFirst()
                .or(() -> names.stream()
                        .filter(n -> n.toLowerCase(Locale.ROOT).contains(lower)
                                || lower.contains(n.toLowerCase(Locale.ROOT)))
                        .findFirst());
        if (match.isPresent()) {
            log.debug("[Diagnostics] Container '{}' resolved to '{}' for pod {}", wanted, match.get(), podName);
            return match.get();
        }
        throw new DiagnosticException("container %s is not valid for pod %s, valid containers: [%s]"
                .formatted(wanted, podName, String.join(", ", names)), command);
    }

    // ── Workload relationships ───────────────────────────────────────────────

    @Override
    public DiagnosticResult relatedPods(TargetResource target) {
        String ns = target.namespace();
        String command = "kubectl get pods%s -o wide".formatted(namespaceFlag(ns));
        return call(command, () -> {
            List<Pod> pods;
            String basis;
            if (target.isPod()) {
                Pod pod = resolvePod(target, command);
                Optional<OwnerReference> owner = controllerOf(pod);
                Map<String, String> labels = Optional.ofNullable(pod.getMetadata().getLabels()).orElse(Map.of());
                if (owner.isPresent()) {
                    String uid = owner.get().getUid();
                    pods = client.pods().inNamespace(ns).list().getItems().stream()
                            .filter(p -> controllerOf(p).map(o -> Objects.equals(o.getUid(), uid)).orElse(false))
                            .toList();
                    basis = "owner %s/%s".formatted(owner.get().getKind(), owner.get().getName());
                } else if (appLabel(labels).isPresent()) {
                    Map.Entry<String, String> app = appLabel(labels).get();
                    pods = client.pods().inNamespace(ns).withLabel(app.getKey(), app.getValue()).list().getItems();
                    basis = "label %s=%s".formatted(app.getKey(), app.getValue());
                } else {
                    return "Pod %s has no owner and no app label; it has no related pods".formatted(pod.getMetadata().getName());
                }
            } else {
                Map<String, String> selector = selectorOf(getGeneric(target.kind(), ns, target.name(), command));
                if (selector.isEmpty()) {
                    return "%s has no pod selector".formatted(target.display());
                }
                pods = client.pods().inNamespace(ns).withLabels(selector).list().getItems();
                basis = "selector " + formatLabels(selector);
            }

            if (pods.isEmpty()) {
                return "No pods found by " + basis;
            }
            StringBuilder sb = new StringBuilder("Pods sharing ").append(basis).append(":\n");
            sb.append("%-48s %-6s %-26s %-8s %s%n".formatted("NAME", "READY", "STATUS", "RESTARTS", "NODE"));
            pods.stream()
                    .sorted(Comparator.comparing(p -> p.getMetadata().getName()))
                    .forEach(p -> sb.append(podRow(p)).append('\n'));
            return sb.toString().stripTrailing();
        });
    }

    @Override
    public DiagnosticResult parentDetails(TargetResource target) {
        String ns = target.namespace();
        String command = "kubectl get %s %s%s -o jsonpath='{.metadata.ownerReferences}'".formatted(
                kindArg(target.kind()), target.name(), namespaceFlag(ns));
        return call(command, () -> {
            GenericKubernetesResource current = getGeneric(target.kind(), ns, target.name(), command);
            StringBuilder sb = new StringBuilder(target.kind()).append('/').append(target.name());
            boolean owned = false;
            for (int depth = 0; depth < MAX_OWNER_DEPTH; depth++) {
                Optional<OwnerReference> owner = controllerOf(current);
                if (owner.isEmpty()) {
                    break;
                }
                owned = true;
                OwnerReference ref = owner.get();
                sb.append("\n  ↳ owned by ").append(ref.getKind()).append('/').append(ref.getName());
                Optional<ResourceDefinitionContext> context = ResourceKinds.resolve(ref.getKind());
                if (context.isEmpty()) {
                    sb.append(" (").append(ref.getApiVersion()).append(", not inspected)");
                    break;
                }
                GenericKubernetesResource parent = findGeneric(context.get(), ns, ref.getName());
                if (parent == null) {
                    sb.append(" (not found, possibly deleted)");
                    break;
                }
                String status = workloadStatus(parent);
                if (!status.isEmpty()) {
                    sb.append("  ").append(status);
                }
                current = parent;
            }
            if (!owned) {
                sb.append(" has no owner references (standalone resource)");
            }
            return sb.toString();
        });
    }

    @Override
    public DiagnosticResult networkCheck(TargetResource target) {
        String ns = target.namespace();
        String command = "kubectl get services,endpoints%s".formatted(namespaceFlag(ns));
        return call(command, () -> {
            List<Service> services;
            if ("Service".equalsIgnoreCase(target.kind())) {
                Service service = client.services().inNamespace(ns).withName(target.name()).get();
                if (service == null) {
                    throw new DiagnosticException("services \"%s\" not found".formatted(target.name()), command);
                }
                services = List.of(service);
            } else {
                Pod pod = resolvePod(target, command);
                Map<String, String> labels = Optional.ofNullable(pod.getMetadata().getLabels()).orElse(Map.of());
                services = client.services().inNamespace(ns).list().getItems().stream()
                        .filter(s -> selects(s, labels))
                        .toList();
                if (services.isEmpty()) {
                    return "No services select pod %s (labels %s); it is not reachable through a Service"
                            .formatted(pod.getMetadata().getName(), formatLabels(labels));
                }
            }

            StringBuilder sb = new StringBuilder();
            for (Service service : services) {
                String name = service.getMetadata().getName();
                Endpoints endpoints = client.endpoints().inNamespace(ns).withName(name).get();
                int ready = 0;
                int notReady = 0;
                if (endpoints != null && endpoints.getSubsets() != null) {
                    for (EndpointSubset subset : endpoints.getSubsets()) {
                        ready    += subset.getAddresses() == null ? 0 : subset.getAddresses().size();
                        notReady += subset.getNotReadyAddresses() == null ? 0 : subset.getNotReadyAddresses().size();
                    }
                }
                sb.append("Service/%s type=%s ports=%s endpoints: ready=%d notReady=%d%s%n".formatted(
                        name,
                        service.getSpec() == null ? "-" : service.getSpec().getType(),
                        formatPorts(service),
                        ready, notReady,
                        endpoints == null ? " (no Endpoints object)" : ""));
            }
            return sb.toString().stripTrailing();
        });
    }

    // ── Pod runtime ──────────────────────────────────────────────────────────

    @Override
    public DiagnosticResult resourceUsage(TargetResource target) {
        String ns = target.namespace();
        String placeholder = "kubectl top pod %s%s --containers".formatted(target.name(), namespaceFlag(ns));
        Pod pod = fetch(placeholder, () -> resolvePod(target, placeholder));
        String podName = pod.getMetadata().getName();
        String command = "kubectl top pod %s%s --containers".formatted(podName, namespaceFlag(ns));

        PodMetrics metrics;
        try {
            metrics = client.top().pods().inNamespace(ns).withName(podName).metric();
        } catch (KubernetesClientException e) {
            throw new DiagnosticException("metrics API (metrics.k8s.io) unavailable: " + apiMessage(e), command, e);
        }
        if (metrics == null || metrics.getContainers() == null) {
            throw new DiagnosticException("metrics API (metrics.k8s.io) returned no data for pod " + podName, command);
        }

        Map<String, Container> specs = Optional.ofNullable(pod.getSpec())
                .map(spec -> spec.getContainers())
                .orElse(List.of())
                .stream()
                .collect(Collectors.toMap(Container::getName, c -> c, (a, b) -> a, LinkedHashMap::new));

        StringBuilder sb = new StringBuilder("%-24s %-10s %-10s %-22s %s%n".formatted(
                "CONTAINER", "CPU", "MEMORY", "REQUESTS (cpu/mem)", "LIMITS (cpu/mem)"));
        for (ContainerMetrics cm : metrics.getContainers()) {
            Map<String, Quantity> usage = Optional.ofNullable(cm.getUsage()).orElse(Map.of());
            Container spec = specs.get(cm.getName());
            Map<String, Quantity> requests = spec == null || spec.getResources() == null
                    ? Map.of() : Optional.ofNullable(spec.getResources().getRequests()).orElse(Map.of());
            Map<String, Quantity> limits = spec == null || spec.getResources() == null
                    ? Map.of() : Optional.ofNullable(spec.getResources().getLimits()).orElse(Map.of());
            sb.append("%-24s %-10s %-10s %-22s %s%n".formatted(
                    cm.getName(),
                    quantity(usage.get("cpu")),
                    quantity(usage.get("memory")),
                    quantity(requests.get("cpu")) + "/" + quantity(requests.get("memory")),
                    quantity(limits.get("cpu")) + "/" + quantity(limits.get("memory"))));
        }
        return new DiagnosticResult(sb.toString().stripTrailing(), command);
    }

    @Override
    public DiagnosticResult nodeInfo(TargetResource target) {
        String nodeName;
        if ("Node".equalsIgnoreCase(target.kind())) {
            nodeName = target.name();
        } else {
            String lookup = "kubectl get %s %s%s -o jsonpath='{.spec.nodeName}'".formatted(
                    kindArg(target.kind()), target.name(), namespaceFlag(target.namespace()));
            Pod pod = fetch(lookup, () -> resolvePod(target, lookup));
            nodeName = pod.getSpec() == null ? null : pod.getSpec().getNodeName();
            if (nodeName == null || nodeName.isBlank()) {
                return new DiagnosticResult(
                        "Pod %s is not scheduled to a node yet".formatted(pod.getMetadata().getName()), lookup);
            }
        }
        String command = "kubectl describe node " + nodeName;
        return call(command, () -> {
            Node node = client.nodes().withName(nodeName).get();
            if (node == null) {
                throw new DiagnosticException("nodes \"%s\" not found".formatted(nodeName), command);
            }
            return formatNode(node);
        });
    }

    @Override
    public DiagnosticResult storageCheck(TargetResource target) {
        String ns = target.namespace();
        String command = "kubectl get pvc%s".formatted(namespaceFlag(ns));
        return call(command, () -> {
            Pod pod = resolvePod(target, command);
            List<String> claims = Optional.ofNullable(pod.getSpec())
                    .map(spec -> spec.getVolumes())
                    .orElse(List.of())
                    .stream()
                    .map(Volume::getPersistentVolumeClaim)
                    .filter(Objects::nonNull)
                    .map(source -> source.getClaimName())
                    .toList();
            if (claims.isEmpty()) {
                return "Pod %s mounts no PersistentVolumeClaims".formatted(pod.getMetadata().getName());
            }
            StringBuilder sb = new StringBuilder();
            for (String claim : claims) {
                PersistentVolumeClaim pvc = client.persistentVolumeClaims().inNamespace(ns).withName(claim).get();
                if (pvc == null) {
                    sb.append("PVC/%s NOT FOUND (referenced by pod %s)%n".formatted(claim, pod.getMetadata().getName()));
                    continue;
                }
                var spec   = pvc.getSpec();
                var status = pvc.getStatus();
                sb.append("PVC/%s phase=%s volume=%s capacity=%s storageClass=%s accessModes=%s%n".formatted(
                        claim,
                        status == null ? "-" : status.getPhase(),
                        spec == null || spec.getVolumeName() == null ? "-" : spec.getVolumeName(),
                        status == null || status.getCapacity() == null ? "-" : quantity(status.getCapacity().get("storage")),
                        spec == null || spec.getStorageClassName() == null ? "-" : spec.getStorageClassName(),
                        spec == null ? "[]" : spec.getAccessModes()));
            }
            return sb.toString().stripTrailing();
        });
    }

    // ── Generic access ───────────────────────────────────────────────────────

    @Override
    public DiagnosticResult listResources(TargetResource target, String kind) {
        String ns = target.namespace();
        String command = "kubectl get %s%s".formatted(kindArg(kind), namespaceFlag(ns));
        return call(command, () -> {
            ResourceDefinitionContext context = ResourceKinds.require(kind, command);
            var operation = client.genericKubernetesResources(context);
            List<GenericKubernetesResource> items = context.isNamespaceScoped() && !ns.isBlank()
                    ? operation.inNamespace(ns).list().getItems()
                    : operation.list().getItems();
            if (items.isEmpty()) {
                return "No %s resources found%s".formatted(context.getKind(),
                        context.isNamespaceScoped() && !ns.isBlank() ? " in namespace " + ns : "");
            }
            StringBuilder sb = new StringBuilder("%-48s %s%n".formatted("NAME", "STATUS"));
            items.stream()
                    .sorted(Comparator.comparing(r -> r.getMetadata().getName()))
                    .forEach(r -> sb.append("%-48s %s%n".formatted(r.getMetadata().getName(), workloadStatus(r))));
            return sb.toString().stripTrailing();
        });
    }

    @Override
    public DiagnosticResult describe(TargetResource target, String kind, String name) {
        String ns = target.namespace();
        String command = "kubectl describe %s %s%s".formatted(kindArg(kind), name, namespaceFlag(ns));
        return call(command, () -> {
            GenericKubernetesResource resource = getGeneric(kind, ns, name, command);
            List<Event> events = eventsFor(ns, resource.getKind(), name);
            return toYaml(resource, command)
                    + "\nEvents:\n"
                    + (events.isEmpty() ? "  <none>" : formatEvents(events));
        });
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private <T> T fetch(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubernetesClientException e) {
            throw new DiagnosticException(apiMessage(e), command, e);
        }
    }

    private DiagnosticResult call(String command, Supplier<String> action) {
        return new DiagnosticResult(fetch(command, action), command);
    }

    private static boolean isNoPreviousContainer(KubernetesClientException e) {
        String marker = "previous terminated container";
        return Optional.ofNullable(apiMessage(e)).map(m -> m.toLowerCase(Locale.ROOT).contains(marker)).orElse(false)
                || Optional.ofNullable(e.getMessage()).map(m -> m.toLowerCase(Locale.ROOT).contains(marker)).orElse(false);
    }

    private static String apiMessage(KubernetesClientException e) {
        String status = e.getStatus() != null && e.getStatus().getMessage() != null
                ? e.getStatus().getMessage()
                : e.getMessage();
        return e.getCode() > 0 ? "HTTP %d: %s".formatted(e.getCode(), status) : status;
    }

    private GenericKubernetesResource getGeneric(String kind, String ns, String name, String command) {
        ResourceDefinitionContext context = ResourceKinds.require(kind, command);
        GenericKubernetesResource resource = findGeneric(context, ns, name);
        if (resource == null) {
            throw new DiagnosticException("%s \"%s\" not found%s".formatted(
                    context.getPlural(), name, ns.isBlank() ? "" : " in namespace " + ns), command);
        }
        return resource;
    }

    private GenericKubernetesResource findGeneric(ResourceDefinitionContext context, String ns, String name) {
        var operation = client.genericKubernetesResources(context);
        return context.isNamespaceScoped() && !ns.isBlank()
                ? operation.inNamespace(ns).withName(name).get()
                : operation.withName(name).get();
    }

    /** The target pod itself, or the first pod selected by a workload target. */
    private Pod resolvePod(TargetResource target, String command) {
        String ns = target.namespace();
        if (target.isPod()) {
            Pod pod = client.pods().inNamespace(ns).withName(target.name()).get();
            if (pod == null) {
                throw new DiagnosticException("pods \"%s\" not found in namespace %s".formatted(target.name(), ns), command);
            }
            return pod;
        }
        Map<String, String> selector = selectorOf(getGeneric(target.kind(), ns, target.name(), command));
        if (selector.isEmpty()) {
            throw new DiagnosticException("%s has no pod selector".formatted(target.display()), command);
        }
        return client.pods().inNamespace(ns).withLabels(selector).list().getItems().stream()
                .min(Comparator.comparing(p -> p.getMetadata().getName()))
                .orElseThrow(() -> new DiagnosticException(
                        "pods not found for %s (selector %s)".formatted(target.display(), formatLabels(selector)), command));
    }

    private List<Event> eventsFor(String ns, String kind, String name) {
        var events = ns.isBlank()
                ? client.v1().events().inAnyNamespace().list().getItems()
                : client.v1().events().inNamespace(ns).list().getItems();
        return events.stream()
                .filter(e -> e.getInvolvedObject() != null && name.equals(e.getInvolvedObject().getName()))
                .filter(e -> kind == null || e.getInvolvedObject().getKind() == null
                        || kind.equalsIgnoreCase(e.getInvolvedObject().getKind()))
                .sorted(Comparator.comparing(KubernetesDiagnosticProvider::eventTime,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();
    }

    private static String eventTime(Event event) {
        if (event.getLastTimestamp() != null) {
            return event.getLastTimestamp();
        }
        return event.getFirstTimestamp();
    }

    private static String formatEvents(List<Event> events) {
        StringBuilder sb = new StringBuilder();
        for (Event e : events) {
            sb.append("%-8s %-24s x%-4d %s  %s%n".formatted(
                    e.getType() == null ? "-" : e.getType(),
                    e.getReason() == null ? "-" : e.getReason(),
                    e.getCount() == null ? 1 : e.getCount(),
                    Optional.ofNullable(eventTime(e)).orElse("-"),
                    e.getMessage() == null ? "" : e.getMessage().strip()));
        }
        return sb.toString().stripTrailing();
    }

    private static String toYaml(GenericKubernetesResource resource, String command) {
        if (resource.getMetadata() != null) {
            resource.getMetadata().setManagedFields(null);
        }
        try {
            return YAML.writeValueAsString(resource).stripTrailing();
        } catch (JsonProcessingException e) {
            throw new DiagnosticException("could not render %s/%s as YAML: %s".formatted(
                    resource.getKind(), resource.getMetadata() == null ? "?" : resource.getMetadata().getName(),
                    e.getOriginalMessage()), command, e);
        }
    }

    private static Optional<OwnerReference> controllerOf(HasMetadata resource) {
        List<OwnerReference> refs = resource.getMetadata() == null ? null : resource.getMetadata().getOwnerReferences();
        if (refs == null || refs.isEmpty()) {
            return Optional.empty();
        }
        return refs.stream()
                .filter(r -> Boolean.TRUE.equals(r.getController()))
                .findFirst()
                .or(() -> Optional.of(refs.get(0)));
    }

    private static Optional<Map.Entry<String, String>> appLabel(Map<String, String> labels) {
        for (String key : List.of("app.kubernetes.io/name", "app", "k8s-app")) {
            if (labels.containsKey(key)) {
                return Optional.of(Map.entry(key, labels.get(key)));
            }
        }
        return Optional.empty();
    }

    /** spec.selector.matchLabels for workloads, spec.selector for Services. */
    static Map<String, String> selectorOf(GenericKubernetesResource resource) {
        Object selector = path(resource, "spec", "selector", "matchLabels");
        if (!(selector instanceof Map<?, ?>)) {
            selector = path(resource, "spec", "selector");
        }
        if (!(selector instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, String> labels = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v instanceof String s) {
                labels.put(String.valueOf(k), s);
            }
        });
        return labels;
    }

    private static Object path(GenericKubernetesResource resource, String... keys) {
        Object current = resource.getAdditionalProperties();
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    /** Replica or phase summary from the status block, empty when there is none. */
    private static String workloadStatus(GenericKubernetesResource resource) {
        Object status = path(resource, "status");
        if (!(status instanceof Map<?, ?> map)) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (String key : List.of("phase", "replicas", "readyReplicas", "availableReplicas",
                "currentNumberScheduled", "numberReady", "active", "succeeded", "failed")) {
            Object value = map.get(key);
            if (value != null) {
                parts.add(key + "=" + value);
            }
        }
        return String.join(" ", parts);
    }

    private static boolean selects(Service service, Map<String, String> labels) {
        Map<String, String> selector = service.getSpec() == null ? null : service.getSpec().getSelector();
        if (selector == null || selector.isEmpty()) {
            return false;
        }
        return selector.entrySet().stream()
                .allMatch(e -> Objects.equals(labels.get(e.getKey()), e.getValue()));
    }

    private static String formatPorts(Service service) {
        if (service.getSpec() == null || service.getSpec().getPorts() == null) {
            return "[]";
        }
        return service.getSpec().getPorts().stream()
                .map(KubernetesDiagnosticProvider::formatPort)
                .collect(Collectors.joining(",", "[", "]"));
    }

    private static String formatPort(ServicePort port) {
        String target = port.getTargetPort() == null ? ""
                : "→" + (port.getTargetPort().getIntVal() != null
                        ? port.getTargetPort().getIntVal().toString()
                        : port.getTargetPort().getStrVal());
        return port.getPort() + "/" + (port.getProtocol() == null ? "TCP" : port.getProtocol()) + target;
    }

    private static String podRow(Pod pod) {
        List<ContainerStatus> statuses = pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null
                ? List.of() : pod.getStatus().getContainerStatuses();
        int total = pod.getSpec() == null || pod.getSpec().getContainers() == null
                ? statuses.size() : pod.getSpec().getContainers().size();
        long ready = statuses.stream().filter(s -> Boolean.TRUE.equals(s.getReady())).count();
        int restarts = statuses.stream().mapToInt(s -> s.getRestartCount() == null ? 0 : s.getRestartCount()).sum();
        return "%-48s %-6s %-26s %-8d %s".formatted(
                pod.getMetadata().getName(),
                ready + "/" + total,
                podStatus(pod, statuses),
                restarts,
                pod.getSpec() == null || pod.getSpec().getNodeName() == null ? "<none>" : pod.getSpec().getNodeName());
    }

    private static String podStatus(Pod pod, List<ContainerStatus> statuses) {
        for (ContainerStatus s : statuses) {
            if (s.getState() != null && s.getState().getWaiting() != null && s.getState().getWaiting().getReason() != null) {
                return s.getState().getWaiting().getReason();
            }
            if (s.getState() != null && s.getState().getTerminated() != null && s.getState().getTerminated().getReason() != null) {
                return s.getState().getTerminated().getReason();
            }
        }
        return pod.getStatus() == null || pod.getStatus().getPhase() == null ? "Unknown" : pod.getStatus().getPhase();
    }

    private static String formatNode(Node node) {
        StringBuilder sb = new StringBuilder("Node/").append(node.getMetadata().getName()).append('\n');
        var status = node.getStatus();
        if (status != null && status.getNodeInfo() != null) {
            sb.append("Kubelet: ").append(status.getNodeInfo().getKubeletVersion())
                    .append("  OS: ").append(status.getNodeInfo().getOsImage()).append('\n');
        }
        sb.append("Conditions:\n");
        List<NodeCondition> conditions = status == null || status.getConditions() == null ? List.of() : status.getConditions();
        for (NodeCondition c : conditions) {
            sb.append("  %-20s %-6s %s%n".formatted(c.getType(), c.getStatus(),
                    c.getReason() == null ? "" : c.getReason()));
        }
        if (status != null) {
            sb.append("Capacity:    ").append(formatQuantities(status.getCapacity())).append('\n');
            sb.append("Allocatable: ").append(formatQuantities(status.getAllocatable())).append('\n');
        }
        List<Taint> taints = node.getSpec() == null || node.getSpec().getTaints() == null
                ? List.of() : node.getSpec().getTaints();
        sb.append("Taints: ").append(taints.isEmpty() ? "<none>" : taints.stream()
                .map(t -> t.getKey() + (t.getValue() == null ? "" : "=" + t.getValue()) + ":" + t.getEffect())
                .collect(Collectors.joining(", ")));
        if (node.getSpec() != null && Boolean.TRUE.equals(node.getSpec().getUnschedulable())) {
            sb.append("\nUnschedulable: true (cordoned)");
        }
        return sb.toString();
    }

    private static String formatQuantities(Map<String, Quantity> values) {
        if (values == null || values.isEmpty()) {
            return "-";
        }
        return List.of("cpu", "memory", "pods", "ephemeral-storage").stream()
                .filter(values::containsKey)
                .map(k -> k + "=" + quantity(values.get(k)))
                .collect(Collectors.joining(" "));
    }

    private static String quantity(Quantity quantity) {
        if (quantity == null || quantity.getAmount() == null) {
            return "-";
        }
        return quantity.getAmount() + (quantity.getFormat() == null ? "" : quantity.getFormat());
    }

    private static String formatLabels(Map<String, String> labels) {
        return labels.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(","));
    }

    private static String namespaceFlag(String namespace) {
        return namespace == null || namespace.isBlank() ? "" : " -n " + namespace;
    }

    private static String kindArg(String kind) {
        return ResourceKinds.resolve(kind)
                .map(c -> c.getKind().toLowerCase(Locale.ROOT))
                .orElse(kind.toLowerCase(Locale.ROOT));
    }
}
