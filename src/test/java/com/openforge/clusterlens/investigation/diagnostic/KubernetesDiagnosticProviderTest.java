package com.openforge.clusterlens.investigation.diagnostic;

import com.openforge.clusterlens.investigation.tool.ToolErrorClassifier;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EndpointsBuilder;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.api.model.TaintBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.api.model.apps.ReplicaSetBuilder;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.ContainerMetricsBuilder;
import io.fabric8.kubernetes.api.model.metrics.v1beta1.PodMetricsBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableKubernetesMockClient(crud = true)
class KubernetesDiagnosticProviderTest {

    private static final TargetResource WEB_1 = new TargetResource("Pod", "shop", "web-1");
    private static final String WEB_1_PATH = "/api/v1/namespaces/shop/pods/web-1";

    KubernetesMockServer server;
    KubernetesClient client;

    private KubernetesDiagnosticProvider provider;

    @BeforeEach
    void setUp() {
        provider = new KubernetesDiagnosticProvider(client);
        client.pods().inNamespace("shop").resource(pod("web-1", "web", "istio-proxy")).create();
        client.pods().inNamespace("shop").resource(pod("web-2", "web")).create();
    }

    @Test
    void shouldRenderManifestAsYaml() {
        DiagnosticResult result = provider.yaml(WEB_1);

        assertTrue(result.text().contains("name: web-1"));
        assertTrue(result.text().contains("istio-proxy"));
        assertEquals("kubectl get pod web-1 -n shop -o yaml", result.commandEquivalent());
    }

    @Test
    void shouldReportMissingResourceAsNotFound() {
        DiagnosticException e = assertThrows(DiagnosticException.class,
                () -> provider.yaml(new TargetResource("Pod", "shop", "ghost")));

        assertEquals("pods \"ghost\" not found in namespace shop", e.getMessage());
        assertEquals("kubectl get pod ghost -n shop -o yaml", e.commandEquivalent());
    }

    @Test
    void shouldListOnlyEventsOfTheTarget() {
        client.v1().events().inNamespace("shop").resource(event("ev-1", "web-1", "BackOff", "Back-off restarting failed container")).create();
        client.v1().events().inNamespace("shop").resource(event("ev-2", "web-2", "Pulled", "Image pulled")).create();

        String text = provider.events(WEB_1).text();

        assertTrue(text.contains("BackOff"));
        assertTrue(text.contains("Back-off restarting failed container"));
        assertFalse(text.contains("Pulled"));
    }

    @Test
    void shouldSayWhenThereAreNoEvents() {
        assertEquals("No events found for Pod/web-1 in namespace shop", provider.events(WEB_1).text());
    }

    @Test
    void shouldFindSiblingsByAppLabel() {
        String text = provider.relatedPods(WEB_1).text();

        assertTrue(text.startsWith("Pods sharing label app=web:"));
        assertTrue(text.contains("web-1"));
        assertTrue(text.contains("web-2"));
    }

    @Test
    void shouldListResourcesOfAnyKnownKind() {
        client.apps().deployments().inNamespace("shop").resource(new DeploymentBuilder()
                .withNewMetadata().withName("web").withNamespace("shop").endMetadata()
                .withNewSpec().withReplicas(2)
                .withNewSelector().addToMatchLabels("app", "web").endSelector()
                .withNewTemplate().withNewMetadata().addToLabels("app", "web").endMetadata()
                .withNewSpec().addToContainers(new ContainerBuilder().withName("web").withImage("nginx").build()).endSpec()
                .endTemplate()
                .endSpec()
                .build()).create();

        DiagnosticResult result = provider.listResources(WEB_1, "deploy");

        assertEquals("kubectl get deployment -n shop", result.commandEquivalent());
        assertTrue(result.text().startsWith("NAME"));
        assertTrue(result.text().contains("web"));

        DiagnosticResult described = provider.describe(WEB_1, "deployment", "web");
        assertTrue(described.text().contains("replicas: 2"));
        assertTrue(described.text().contains("Events:\n  <none>"));
    }

    @Test
    void shouldRejectUnknownKind() {
        DiagnosticException e = assertThrows(DiagnosticException.class,
                () -> provider.listResources(WEB_1, "widgets"));

        assertTrue(e.getMessage().startsWith("resource kind \"widgets\" not found"));
    }

    @Test
    void shouldReportNothingMountedForStorage() {
        assertEquals("Pod web-1 mounts no PersistentVolumeClaims", provider.storageCheck(WEB_1).text());
    }

    @Test
    void shouldTailLogsOfResolvedContainer() {
        server.expect().get()
                .withPath(WEB_1_PATH + "/log?pretty=false&container=istio-proxy&tailLines=50")
                .andReturn(200, "envoy started\nupstream connect error")
                .once();

        DiagnosticResult result = provider.logs(WEB_1, Optional.of("istio"), 50);

        assertEquals("envoy started\nupstream connect error", result.text());
        assertEquals("kubectl logs web-1 -n shop -c istio-proxy --tail=50", result.commandEquivalent());
    }

    @Test
    void shouldReadPreviousLogsOfRestartedContainer() {
        server.expect().get()
                .withPath(WEB_1_PATH + "/log?pretty=false&container=web&previous=true&tailLines=20")
                .andReturn(200, "panic: nil map")
                .once();

        DiagnosticResult result = provider.previousLogs(WEB_1, Optional.empty(), 20);

        assertEquals("panic: nil map", result.text());
        assertEquals("kubectl logs web-1 -n shop -c web --tail=20 --previous", result.commandEquivalent());
    }

    @Test
    void shouldReportNoPreviousLogsWhenContainerNeverRestarted() {
        server.expect().get()
                .withPath(WEB_1_PATH + "/log?pretty=false&container=web&previous=true&tailLines=20")
                .andReturn(400, new StatusBuilder()
                        .withStatus("Failure")
                        .withCode(400)
                        .withReason("BadRequest")
                        .withMessage("previous terminated container \"web\" in pod \"web-1\" not found")
                        .build())
                .once();

        DiagnosticResult result = provider.previousLogs(WEB_1, Optional.of("web"), 20);

        assertEquals("No previous logs for container web of pod web-1 (the container has not restarted)", result.text());
    }

    @Test
    void shouldShowServicesSelectingThePod() {
        client.services().inNamespace("shop").resource(new ServiceBuilder()
                .withNewMetadata().withName("web").withNamespace("shop").endMetadata()
                .withNewSpec()
                .withType("ClusterIP")
                .withSelector(Map.of("app", "web"))
                .addNewPort().withPort(80).withProtocol("TCP").withTargetPort(new IntOrString(8080)).endPort()
                .endSpec()
                .build()).create();
        client.endpoints().inNamespace("shop").resource(new EndpointsBuilder()
                .withNewMetadata().withName("web").withNamespace("shop").endMetadata()
                .addNewSubset()
                .addNewAddress().withIp("10.0.0.7").endAddress()
                .addNewNotReadyAddress().withIp("10.0.0.8").endNotReadyAddress()
                .endSubset()
                .build()).create();

        DiagnosticResult result = provider.networkCheck(WEB_1);

        assertEquals("Service/web type=ClusterIP ports=[80/TCP→8080] endpoints: ready=1 notReady=1", result.text());
        assertEquals("kubectl get services,endpoints -n shop", result.commandEquivalent());
    }

    @Test
    void shouldSayWhenNoServiceSelectsThePod() {
        assertTrue(provider.networkCheck(WEB_1).text()
                .startsWith("No services select pod web-1 (labels app=web)"));
    }

    @Test
    void shouldFollowOwnerChainUpToDeployment() {
        client.apps().deployments().inNamespace("shop").resource(new DeploymentBuilder()
                .withNewMetadata().withName("web").withNamespace("shop").withUid("uid-deploy").endMetadata()
                .build()).create();
        client.apps().replicaSets().inNamespace("shop").resource(new ReplicaSetBuilder()
                .withNewMetadata().withName("web-7d9f").withNamespace("shop").withUid("uid-rs")
                .withOwnerReferences(owner("apps/v1", "Deployment", "web", "uid-deploy"))
                .endMetadata()
                .build()).create();
        client.pods().inNamespace("shop").resource(new PodBuilder()
                .withNewMetadata().withName("web-7d9f-x2p4q").withNamespace("shop")
                .withOwnerReferences(owner("apps/v1", "ReplicaSet", "web-7d9f", "uid-rs"))
                .endMetadata()
                .build()).create();

        String text = provider.parentDetails(new TargetResource("Pod", "shop", "web-7d9f-x2p4q")).text();

        assertTrue(text.startsWith("Pod/web-7d9f-x2p4q"));
        assertTrue(text.contains("\n  ↳ owned by ReplicaSet/web-7d9f"));
        assertTrue(text.contains("\n  ↳ owned by Deployment/web"));
        assertTrue(text.indexOf("ReplicaSet/web-7d9f") < text.indexOf("Deployment/web"));
    }

    @Test
    void shouldReportStandaloneResource() {
        assertEquals("Pod/web-1 has no owner references (standalone resource)",
                provider.parentDetails(WEB_1).text());
    }

    @Test
    void shouldReportContainerUsageFromMetricsApi() {
        server.expect().get()
                .withPath("/apis/metrics.k8s.io/v1beta1/namespaces/shop/pods/web-1")
                .andReturn(200, new PodMetricsBuilder()
                        .withNewMetadata().withName("web-1").withNamespace("shop").endMetadata()
                        .addToContainers(new ContainerMetricsBuilder()
                                .withName("web")
                                .addToUsage("cpu", new Quantity("25m"))
                                .addToUsage("memory", new Quantity("64Mi"))
                                .build())
                        .build())
                .once();

        DiagnosticResult result = provider.resourceUsage(WEB_1);

        assertEquals("kubectl top pod web-1 -n shop --containers", result.commandEquivalent());
        String row = result.text().lines().filter(l -> l.startsWith("web ")).findFirst().orElseThrow();
        assertTrue(row.contains("25m"));
        assertTrue(row.contains("64Mi"));
    }

    @Test
    void shouldReportMetricsApiFailureAsMetricsUnavailable() {
        DiagnosticException e = assertThrows(DiagnosticException.class, () -> provider.resourceUsage(WEB_1));

        assertTrue(e.getMessage().startsWith("metrics API (metrics.k8s.io)"));
        assertEquals(ToolErrorClassifier.Category.METRICS_UNAVAILABLE, ToolErrorClassifier.categorize(e.getMessage()));
    }

    @Test
    void shouldDescribeTheNodeRunningThePod() {
        client.nodes().resource(new NodeBuilder()
                .withNewMetadata().withName("node-a").endMetadata()
                .withNewSpec()
                .withUnschedulable(true)
                .addToTaints(new TaintBuilder().withKey("dedicated").withValue("db").withEffect("NoSchedule").build())
                .endSpec()
                .build()).create();

        DiagnosticResult result = provider.nodeInfo(WEB_1);

        assertEquals("kubectl describe node node-a", result.commandEquivalent());
        assertTrue(result.text().startsWith("Node/node-a"));
        assertTrue(result.text().contains("Taints: dedicated=db:NoSchedule"));
        assertTrue(result.text().contains("Unschedulable: true (cordoned)"));
    }

    @Test
    void shouldReportMissingNode() {
        DiagnosticException e = assertThrows(DiagnosticException.class, () -> provider.nodeInfo(WEB_1));

        assertEquals("nodes \"node-a\" not found", e.getMessage());
    }

    @Test
    void shouldDescribeAnyResourceWithItsEvents() {
        client.v1().events().inNamespace("shop").resource(event("ev-3", "web-2", "OOMKilling", "Memory cgroup out of memory")).create();

        DiagnosticResult result = provider.describe(WEB_1, "po", "web-2");

        assertEquals("kubectl describe pod web-2 -n shop", result.commandEquivalent());
        assertTrue(result.text().contains("name: web-2"));
        int events = result.text().indexOf("\nEvents:\n");
        assertTrue(events > 0);
        assertTrue(result.text().substring(events).contains("OOMKilling"));
    }

    @Test
    void shouldReportBoundClaimsForStorage() {
        client.persistentVolumeClaims().inNamespace("shop").resource(new PersistentVolumeClaimBuilder()
                .withNewMetadata().withName("data").withNamespace("shop").endMetadata()
                .withNewSpec().withStorageClassName("standard").withAccessModes("ReadWriteOnce").endSpec()
                .build()).create();
        client.pods().inNamespace("shop").resource(new PodBuilder()
                .withNewMetadata().withName("db-0").withNamespace("shop").endMetadata()
                .withNewSpec()
                .addNewVolume().withName("data").withNewPersistentVolumeClaim().withClaimName("data").endPersistentVolumeClaim().endVolume()
                .addNewVolume().withName("cache").withNewPersistentVolumeClaim().withClaimName("cache").endPersistentVolumeClaim().endVolume()
                .endSpec()
                .build()).create();

        String text = provider.storageCheck(new TargetResource("Pod", "shop", "db-0")).text();

        assertTrue(text.contains("PVC/data"));
        assertTrue(text.contains("storageClass=standard"));
        assertTrue(text.contains("PVC/cache NOT FOUND (referenced by pod db-0)"));
    }

    @Test
    void shouldResolveContainerNamesLeniently() {
        Pod pod = pod("web-1", "web", "istio-proxy");

        assertEquals("web", KubernetesDiagnosticProvider.resolveContainer(pod, Optional.empty(), "cmd"));
        assertEquals("istio-proxy", KubernetesDiagnosticProvider.resolveContainer(pod, Optional.of("ISTIO-PROXY"), "cmd"));
        assertEquals("istio-proxy", KubernetesDiagnosticProvider.resolveContainer(pod, Optional.of("istio"), "cmd"));

        DiagnosticException e = assertThrows(DiagnosticException.class,
                () -> KubernetesDiagnosticProvider.resolveContainer(pod, Optional.of("sidecar"), "kubectl logs web-1"));
        assertEquals("container sidecar is not valid for pod web-1, valid containers: [web, istio-proxy]", e.getMessage());
        assertEquals("kubectl logs web-1", e.commandEquivalent());
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    private static Pod pod(String name, String... containers) {
        PodBuilder builder = new PodBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace("shop")
                .withLabels(Map.of("app", "web"))
                .endMetadata()
                .withNewSpec()
                .withNodeName("node-a")
                .endSpec();
        for (String container : containers) {
            builder.editSpec().addToContainers(new ContainerBuilder().withName(container).withImage("nginx").build()).endSpec();
        }
        return builder.build();
    }

    private static OwnerReference owner(String apiVersion, String kind, String name, String uid) {
        return new OwnerReferenceBuilder()
                .withApiVersion(apiVersion)
                .withKind(kind)
                .withName(name)
                .withUid(uid)
                .withController(true)
                .build();
    }

    private static Event event(String name, String involvedName, String reason, String message) {
        return new EventBuilder()
                .withNewMetadata().withName(name).withNamespace("shop").endMetadata()
                .withNewInvolvedObject().withKind("Pod").withName(involvedName).withNamespace("shop").endInvolvedObject()
                .withReason(reason)
                .withMessage(message)
                .withType("Warning")
                .withCount(3)
                .withLastTimestamp("2024-05-01T10:00:00Z")
                .build();
    }
}
