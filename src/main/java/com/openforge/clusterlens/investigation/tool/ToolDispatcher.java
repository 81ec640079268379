package com.openforge.clusterlens.investigation.tool;

import com.openforge.clusterlens.config.InvestigationProperties;
import com.openforge.clusterlens.investigation.diagnostic.DiagnosticException;
import com.openforge.clusterlens.investigation.diagnostic.DiagnosticProvider;
import com.openforge.clusterlens.investigation.diagnostic.DiagnosticResult;
import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Validates one tool request and runs it against the {@link DiagnosticProvider}.
 *
 * Pipeline per request:
 *
 *   name lookup      → unknown name      → INVALID, no call
 *   sanitize args    → bad argument text → ERROR/syntax, no call
 *   provider call    → failure           → ERROR/execution with remediation
 *   truncate output  → SUCCESS
 *
 * Failures never escape as exceptions: the investigation loop shows every
 * outcome to the model and carries on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolDispatcher {

    private final DiagnosticProvider      provider;
    private final InvestigationProperties properties;

    public ToolOutcome execute(ToolInvocation invocation, TargetResource target) {
        String name = invocation.name();

        Optional<ToolCatalog> lookup = ToolCatalog.lookup(name);
        if (lookup.isEmpty()) {
            log.warn("[ToolDispatcher] Unknown tool '{}' requested for {}", name, target.display());
            return ToolOutcome.invalid(name);
        }
        ToolCatalog tool = lookup.get();

        SanitizedArguments args = ArgumentSanitizer.sanitize(tool, invocation.rawArgs());
        if (!args.valid()) {
            log.info("[ToolDispatcher] Rejected arguments for {}: '{}'", name, invocation.rawArgs());
            return ToolOutcome.syntaxError(name, args.syntaxError());
        }

        try {
            DiagnosticResult result = invoke(tool, args, target);
            Truncated output = truncate(result.text(), properties.outputLimit());
            log.debug("[ToolDispatcher] {} → {} chars{}", invocation.display(),
                    result.text().length(), output.truncated() ? " (truncated)" : "");
            return ToolOutcome.success(name, summarize(output), output.text(),
                    result.commandEquivalent(), output.truncated());
        } catch (DiagnosticException e) {
            log.info("[ToolDispatcher] {} failed: {}", invocation.display(), e.getMessage());
            return ToolOutcome.executionError(name,
                    ToolErrorClassifier.summarize(name, e.getMessage()), e.commandEquivalent());
        } catch (RuntimeException e) {
            log.warn("[ToolDispatcher] {} failed unexpectedly", invocation.display(), e);
            return ToolOutcome.executionError(name,
                    ToolErrorClassifier.summarize(name, e.getMessage()), null);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private DiagnosticResult invoke(ToolCatalog tool, SanitizedArguments args, TargetResource target) {
        int tail = properties.logTailLines();
        return switch (tool) {
            case YAML           -> provider.yaml(target);
            case EVENTS         -> provider.events(target);
            case LOGS           -> provider.logs(target, args.token(0), tail);
            case LOGS_PREVIOUS  -> provider.previousLogs(target, args.token(0), tail);
            case RELATED_PODS   -> provider.relatedPods(target);
            case PARENT_DETAILS -> provider.parentDetails(target);
            case NETWORK_CHECK  -> provider.networkCheck(target);
            case RESOURCE_USAGE -> provider.resourceUsage(target);
            case LIST_RESOURCES -> provider.listResources(target, args.tokens().get(0));
            case DESCRIBE_ANY   -> provider.describe(target, args.tokens().get(0), args.tokens().get(1));
            case NODE_INFO      -> provider.nodeInfo(target);
            case STORAGE_CHECK  -> provider.storageCheck(target);
        };
    }

    static Truncated truncate(String text, int limit) {
        if (text == null) {
            return new Truncated("", false);
        }
        if (limit <= 0 || text.length() <= limit) {
            return new Truncated(text, false);
        }
        int dropped = text.length() - limit;
        return new Truncated(text.substring(0, limit) + "\n… [truncated " + dropped + " chars]", true);
    }

    private static String summarize(Truncated output) {
        long lines = output.text().isEmpty() ? 0 : output.text().lines().count();
        return output.truncated()
                ? "%d lines (output truncated)".formatted(lines)
                : "%d lines".formatted(lines);
    }

    record Truncated(String text, boolean truncated) {
    }
}
