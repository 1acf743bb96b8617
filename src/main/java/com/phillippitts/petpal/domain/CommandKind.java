package com.phillippitts.petpal.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed whitelist of commands the orchestrator accepts.
 *
 * <p>Each kind is addressed by the natural-language prompt the UI sends. Exactly one kind
 * ({@link #GO_HOME}) is preemptive: it is accepted regardless of what is executing and
 * interrupts the active command.
 *
 * @since 1.0
 */
public enum CommandKind {

    PICK_UP_BALL("pick up the ball", false),
    GET_TREAT("get the treat", false),
    GO_HOME("go home", true);

    private final String prompt;
    private final boolean preemptive;

    CommandKind(String prompt, boolean preemptive) {
        this.prompt = prompt;
        this.preemptive = preemptive;
    }

    public String prompt() {
        return prompt;
    }

    public boolean isPreemptive() {
        return preemptive;
    }

    /**
     * Resolves a prompt to a command kind. Matching is case-insensitive and ignores
     * surrounding whitespace; anything outside the whitelist yields empty.
     *
     * @param prompt prompt text from the caller (nullable)
     * @return matching kind, or empty if the prompt is not whitelisted
     */
    public static Optional<CommandKind> fromPrompt(String prompt) {
        if (prompt == null) {
            return Optional.empty();
        }
        String normalized = prompt.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(k -> k.prompt.equals(normalized))
                .findFirst();
    }

    /** Prompts in declaration order, for error messages. */
    public static List<String> allowedPrompts() {
        return Arrays.stream(values()).map(CommandKind::prompt).toList();
    }
}
