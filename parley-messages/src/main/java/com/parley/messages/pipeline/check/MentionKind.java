package com.parley.messages.pipeline.check;

import com.parley.messages.pipeline.VetoKind;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Collective mentions that notify many users at once.
 * <p>
 * {@code @all} and {@code @everyone} share the {@code mention-all} permission,
 * sometimes called "mention everyone". {@code @here} needs {@code mention-here}.
 */
public enum MentionKind {

    EVERYONE(Set.of("all", "everyone"), "mention-all", VetoKind.MENTION_EVERYONE, "Notify all in this room"),
    HERE(Set.of("here"), "mention-here", VetoKind.MENTION_HERE, "Notify active users in this room");

    private final Set<String> tokens;
    private final String permission;
    private final VetoKind vetoKind;
    private final String action;
    private final Pattern rawPattern;

    MentionKind(Set<String> tokens, String permission, VetoKind vetoKind, String action) {
        this.tokens = tokens;
        this.permission = permission;
        this.vetoKind = vetoKind;
        this.action = action;
        this.rawPattern = Pattern.compile(
                "(?<![\\w@])@(?:" + tokens.stream().sorted().collect(Collectors.joining("|")) + ")(?![\\w\\-]|\\.\\w)",
                Pattern.CASE_INSENSITIVE);
    }

    /** Mention names without the leading {@code @}. */
    public Set<String> tokens() {
        return tokens;
    }

    public String permission() {
        return permission;
    }

    public VetoKind vetoKind() {
        return vetoKind;
    }

    public String action() {
        return action;
    }

    /**
     * Whether raw text contains one of this kind's mentions.
     */
    public boolean isMentionedIn(String text) {
        return text != null && rawPattern.matcher(text).find();
    }
}
