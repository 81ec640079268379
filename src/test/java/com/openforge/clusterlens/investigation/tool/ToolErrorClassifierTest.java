package com.openforge.clusterlens.investigation.tool;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolErrorClassifierTest {

    @Test
    void shouldRecognizeWrongContainerAndListChoices() {
        String message = "container api-server is not valid for pod web-1, valid containers: [web, istio-proxy]";

        assertEquals(ToolErrorClassifier.Category.WRONG_CONTAINER, ToolErrorClassifier.categorize(message));
        String summary = ToolErrorClassifier.summarize("LOGS", message);
        assertTrue(summary.startsWith(ToolErrorClassifier.TOOL_ERROR_LABEL));
        assertTrue(summary.contains("Valid containers: web, istio-proxy."));
    }

    @Test
    void shouldRecognizeApiServerContainerWording() {
        assertEquals(ToolErrorClassifier.Category.WRONG_CONTAINER, ToolErrorClassifier.categorize(
                "a container name must be specified for pod web-1, choose one of: [web sidecar]"));
        assertEquals("web sidecar", ToolErrorClassifier.containerChoices(
                "a container name must be specified for pod web-1, choose one of: [web sidecar]"));
    }

    @Test
    void shouldPreferMetricsOverNotFound() {
        assertEquals(ToolErrorClassifier.Category.METRICS_UNAVAILABLE, ToolErrorClassifier.categorize(
                "404 page not found: the server could not find the requested resource (metrics.k8s.io)"));
    }

    @Test
    void shouldNotMistakeMissingPreviousContainerForWrongName() {
        assertEquals(ToolErrorClassifier.Category.NOT_FOUND, ToolErrorClassifier.categorize(
                "HTTP 400: previous terminated container \"app\" in pod \"web-1\" not found"));
    }

    @Test
    void shouldIgnoreKeywordsInsideResourceNames() {
        assertEquals(ToolErrorClassifier.Category.NOT_FOUND, ToolErrorClassifier.categorize(
                "deployments \"metrics-server\" not found in namespace kube-system"));
        assertEquals(ToolErrorClassifier.Category.NOT_FOUND, ToolErrorClassifier.categorize(
                "pods \"sidecar-container-7d9f\" not found in namespace shop"));
    }

    @Test
    void shouldRecognizeQuotedContainerWording() {
        assertEquals(ToolErrorClassifier.Category.WRONG_CONTAINER, ToolErrorClassifier.categorize(
                "HTTP 400: container \"sidecar\" in pod \"web-1\" is not valid"));
    }

    @Test
    void shouldRecognizeMetricsApiFailuresFromResourceUsage() {
        assertEquals(ToolErrorClassifier.Category.METRICS_UNAVAILABLE, ToolErrorClassifier.categorize(
                "metrics API (metrics.k8s.io) unavailable: HTTP 404: the server could not find the requested resource"));
        assertEquals(ToolErrorClassifier.Category.METRICS_UNAVAILABLE, ToolErrorClassifier.categorize(
                "metrics API (metrics.k8s.io) returned no data for pod web-1"));
    }

    @Test
    void shouldRecognizeForbiddenAndNotFound() {
        assertEquals(ToolErrorClassifier.Category.FORBIDDEN, ToolErrorClassifier.categorize(
                "403: pods is forbidden: User \"system:serviceaccount:default:lens\" cannot list resource"));
        assertEquals(ToolErrorClassifier.Category.NOT_FOUND, ToolErrorClassifier.categorize(
                "deployments.apps \"web\" not found"));
        assertEquals(ToolErrorClassifier.Category.GENERIC, ToolErrorClassifier.categorize("connection reset"));
        assertEquals(ToolErrorClassifier.Category.GENERIC, ToolErrorClassifier.categorize(null));
    }

    @Test
    void shouldLabelEverySummaryAsToolProblem() {
        for (String message : new String[]{"forbidden", "not found", "boom", "", "metrics unavailable"}) {
            assertTrue(ToolErrorClassifier.summarize("EVENTS", message)
                    .startsWith(ToolErrorClassifier.TOOL_ERROR_LABEL), message);
        }
    }
}
