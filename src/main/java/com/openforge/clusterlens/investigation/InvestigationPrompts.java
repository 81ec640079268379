package com.openforge.clusterlens.investigation;

import com.openforge.clusterlens.investigation.diagnostic.TargetResource;
import com.openforge.clusterlens.investigation.tool.ToolCatalog;
import com.openforge.clusterlens.investigation.tool.ToolGrammar;

/**
 * Prompt text for the investigation loop.
 *
 * The first round gets the target context and the tool catalog; follow-up
 * rounds get the combined tool results of the previous round.
 */
public final class InvestigationPrompts {

    public static final String RESULT_SEPARATOR = "\n\n---\n\n";

    private InvestigationPrompts() {
    }

    public static String systemPrompt() {
        return """
                You are a Kubernetes troubleshooting assistant investigating ONE resource.
                You can run read-only diagnostic tools. To run a tool, write it on its own line:

                %s

                Rules:
                - One %s line per tool. Several lines run in order.
                - Arguments are plain names: no brackets, quotes or placeholders.
                - Results marked TOOL ERROR or TOOL SYNTAX ERROR describe a problem with the tool call,
                  not with the resource. Fix the call or try another tool.
                - When you have enough evidence, answer WITHOUT any %s line:
                  state the root cause, the evidence, and the fix.
                """.formatted(ToolCatalog.describe(), ToolGrammar.TOKEN, ToolGrammar.TOKEN);
    }

    public static String iterativeSystemPrompt() {
        return """
                You are continuing a Kubernetes investigation of ONE resource. Review the tool results and act.
                - If the evidence is conclusive, give the final answer with root cause, evidence and fix,
                  and no %s lines.
                - Otherwise request more data, one %s line per tool:

                %s
                """.formatted(ToolGrammar.TOKEN, ToolGrammar.TOKEN, ToolCatalog.describe());
    }

    public static String firstPrompt(TargetResource target, String question) {
        return """
                === CURRENT RESOURCE (YOU ARE INVESTIGATING THIS) ===
                Kind: %s
                Name: %s
                Namespace: %s
                === END RESOURCE ===

                User Request: %s""".formatted(
                target.kind(),
                target.name(),
                target.isNamespaced() ? target.namespace() : "(cluster-scoped)",
                question);
    }

    public static String analysisPrompt(String combinedResults, String question) {
        return "Tool results:\n%s\n\nAnalyze these results for: \"%s\". If you need more data, use %s commands."
                .formatted(combinedResults, question, ToolGrammar.TOKEN);
    }

    public static String continuePrompt(String combinedResults) {
        return "New tool results:\n%s\n\nContinue your investigation.".formatted(combinedResults);
    }

    public static String resultBlock(String toolName, String content) {
        return "## " + toolName + "\n" + content;
    }
}
