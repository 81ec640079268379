package com.openforge.clusterlens.investigation.diagnostic;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceKindsTest {

    @Test
    void shouldResolveKindPluralAndShortName() {
        for (String alias : new String[]{"Ingress", "ingress", "ingresses", "ing"}) {
            assertEquals("Ingress", ResourceKinds.resolve(alias).map(ResourceDefinitionContext::getKind).orElse(null), alias);
        }
        assertEquals("NetworkPolicy", ResourceKinds.resolve("networkpolicy").orElseThrow().getKind());
        assertEquals("Endpoints", ResourceKinds.resolve("ep").orElseThrow().getKind());
        assertEquals("apps", ResourceKinds.resolve(" Deploy ").orElseThrow().getGroup());
    }

    @Test
    void shouldNotInventSingularsByDroppingTrailingS() {
        assertFalse(ResourceKinds.resolve("ingresse").isPresent());
        assertFalse(ResourceKinds.resolve("networkpolicie").isPresent());
        assertFalse(ResourceKinds.resolve("endpoint").isPresent());
    }

    @Test
    void shouldKnowWhichKindsAreNamespaced() {
        assertTrue(ResourceKinds.resolve("pvc").orElseThrow().isNamespaceScoped());
        assertFalse(ResourceKinds.resolve("node").orElseThrow().isNamespaceScoped());
    }

    @Test
    void shouldListSupportedKindsWhenRequiredKindIsUnknown() {
        DiagnosticException e = assertThrows(DiagnosticException.class,
                () -> ResourceKinds.require("widgets", "kubectl get widgets"));

        assertTrue(e.getMessage().contains("supported kinds: "));
        assertTrue(e.getMessage().contains("StatefulSet"));
        assertEquals("kubectl get widgets", e.commandEquivalent());
    }
}
