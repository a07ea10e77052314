package org.opsforge.plugins.dependency;

import org.opsforge.plugins.Plugin;

/**
 * Version requirement on a plugin name, attributed to the root plugin that declared it.
 *
 * @param version required version
 * @param origin  {@code name:version} of the declaring root
 */
record Requirement(String version, String origin) {
    static Requirement requirement(Plugin required, Plugin root) {
        return new Requirement(required.version(), root.toString());
    }
}
