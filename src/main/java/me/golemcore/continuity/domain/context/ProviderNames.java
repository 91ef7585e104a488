package me.golemcore.continuity.domain.context;

/**
 * Names of the built-in context providers.
 */
public final class ProviderNames {

    public static final String VISION = "vision";
    public static final String METACOGNITIVE = "metacognitive";
    public static final String RECENT_CHANGES = "recent_changes";
    public static final String SESSION = "session";
    public static final String ADAPTIVE = "adaptive";

    private ProviderNames() {
    }
}
