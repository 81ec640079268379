package com.openforge.clusterlens.investigation.tool;

import java.util.regex.Pattern;

/**
 * The line grammar the model uses to request a diagnostic tool.
 *
 * <pre>
 *   tool-line  = *any "TOOL:" *WSP identifier [ 1*WSP raw-args ] *WSP EOL
 *   identifier = 1*( ALPHA / DIGIT / "_" )
 *   raw-args   = rest of the line, trimmed
 *   arg-token  = 1*( ALPHA / DIGIT / "." / "_" / ":" / "/" / "-" )
 * </pre>
 *
 * The parser, the sanitizer and the catalog all read from these constants, so
 * the recognised tool names and the accepted argument text share one source.
 */
public final class ToolGrammar {

    /** Case-sensitive marker that opens a tool request. */
    public static final String TOKEN = "TOOL:";

    public static final String IDENTIFIER_CHARS = "[A-Za-z0-9_]";

    public static final String ARGUMENT_CHARS = "[A-Za-z0-9._:/-]";

    /** Exact-match pattern for a tool name. */
    public static final Pattern IDENTIFIER = Pattern.compile(IDENTIFIER_CHARS + "+");

    /** Exact-match pattern for one sanitized argument token. */
    public static final Pattern ARGUMENT_TOKEN = Pattern.compile(ARGUMENT_CHARS + "+");

    /**
     * One request per line; group 1 is the identifier, group 2 the optional raw
     * argument text. Applied in MULTILINE mode so {@code $} anchors at each line end.
     */
    public static final Pattern TOOL_LINE = Pattern.compile(
            Pattern.quote(TOKEN) + "[ \\t]*(" + IDENTIFIER_CHARS + "+)(?:[ \\t]+([^\\r\\n]*?))?[ \\t]*\\r?$",
            Pattern.MULTILINE);

    /** Characters the model tends to wrap arguments in; removed before validation. */
    public static final String STRIPPED_CHARS = "[]\"'`*";

    private ToolGrammar() {
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    public static boolean isArgumentToken(String token) {
        return token != null && ARGUMENT_TOKEN.matcher(token).matches();
    }
}
