package com.openforge.clusterlens.investigation.tool;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link ArgumentSanitizer}: either the clean argument tokens or a
 * syntax error message that is returned to the model instead of running the tool.
 */
public record SanitizedArguments(List<String> tokens, String syntaxError) {

    public SanitizedArguments {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static SanitizedArguments of(List<String> tokens) {
        return new SanitizedArguments(tokens, null);
    }

    public static SanitizedArguments none() {
        return new SanitizedArguments(List.of(), null);
    }

    public static SanitizedArguments error(String message) {
        return new SanitizedArguments(List.of(), message);
    }

    public boolean valid() {
        return syntaxError == null;
    }

    public Optional<String> token(int index) {
        return index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }
}
