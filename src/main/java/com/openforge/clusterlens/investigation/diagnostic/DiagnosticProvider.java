package com.openforge.clusterlens.investigation.diagnostic;

import java.util.Optional;

/**
 * Read-only access to the cluster, one method per diagnostic tool.
 *
 * Every method either returns the text result or throws
 * {@link DiagnosticException}; none of them mutates cluster state.
 */
public interface DiagnosticProvider {

    DiagnosticResult yaml(TargetResource target);

    DiagnosticResult events(TargetResource target);

    /** @param container empty to use the first container of the pod */
    DiagnosticResult logs(TargetResource target, Optional<String> container, int tailLines);

    DiagnosticResult previousLogs(TargetResource target, Optional<String> container, int tailLines);

    DiagnosticResult relatedPods(TargetResource target);

    DiagnosticResult parentDetails(TargetResource target);

    DiagnosticResult networkCheck(TargetResource target);

    DiagnosticResult resourceUsage(TargetResource target);

    DiagnosticResult listResources(TargetResource target, String kind);

    DiagnosticResult describe(TargetResource target, String kind, String name);

    DiagnosticResult nodeInfo(TargetResource target);

    DiagnosticResult storageCheck(TargetResource target);
}
