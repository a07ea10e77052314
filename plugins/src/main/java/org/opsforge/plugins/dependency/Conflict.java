package org.opsforge.plugins.dependency;

/**
 * Two roots requiring different versions of the same plugin.
 *
 * @param plugin        name of the plugin both roots require
 * @param firstOrigin   {@code name:version} of the first root
 * @param firstVersion  version required by the first root
 * @param secondOrigin  {@code name:version} of the second root
 * @param secondVersion version required by the second root
 */
public record Conflict(String plugin,
                       String firstOrigin,
                       String firstVersion,
                       String secondOrigin,
                       String secondVersion) {

    static Conflict conflict(String plugin, Requirement first, Requirement second) {
        return new Conflict(plugin, first.origin(), first.version(), second.origin(), second.version());
    }

    public String asMessage() {
        return String.format(MESSAGE_TEMPLATE, firstOrigin, firstVersion, secondOrigin, secondVersion, plugin);
    }

    @Override
    public String toString() {
        return asMessage();
    }

    private static final String MESSAGE_TEMPLATE =
            "Plugin '%s' requires version '%s' but plugin '%s' requires '%s' for plugin '%s'";
}
