package org.javai.runner.capability;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named analysis the runner can execute: a prompt template plus the limits it runs under.
 *
 * @param name capability name, for example {@code code-review}
 * @param prompt prompt template with {@code {{input}}} placeholders
 * @param allowedTools tools the subprocess may use; empty allows none explicitly
 * @param maxTokens token limit, zero for the binary's default
 * @param timeoutSeconds per-capability time limit passed to the binary, zero for none
 */
public record Capability(String name, String prompt, List<String> allowedTools, int maxTokens, int timeoutSeconds) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    public Capability {
        Objects.requireNonNull(name, "name must not be null");
        prompt = prompt == null ? "" : prompt;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
    }

    public static Capability of(String name, String prompt) {
        return new Capability(name, prompt, List.of(), 0, 0);
    }

    /**
     * Substitutes {@code {{name}}} placeholders with matching inputs. Placeholders without
     * a matching input are left untouched.
     */
    public String render(Map<String, String> inputs) {
        Matcher matcher = PLACEHOLDER.matcher(prompt);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = inputs.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
