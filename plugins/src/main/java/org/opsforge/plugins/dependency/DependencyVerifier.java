package org.opsforge.plugins.dependency;

import org.opsforge.plugins.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects plugins required at different versions by different roots.
 * <p>
 * Each input map associates a root plugin with the plugins it requires. Every root is also recorded as a
 * requirement on its own name, so a root declared with two versions across maps is reported as well.
 * <p>
 * For every plugin name all recorded requirements are compared with each other (full cross product), so a
 * pair of differing requirements is reported once in each direction. Output order follows the iteration
 * order of the supplied maps and should be treated as unordered.
 * <p>
 * Conflicts are normal input. The verifier never fails and never modifies its arguments. {@code null} maps,
 * roots, dependency lists and list elements are skipped.
 */
public final class DependencyVerifier {
    private static final Logger log = LoggerFactory.getLogger(DependencyVerifier.class);

    private DependencyVerifier() {}

    /**
     * Check that all plugins are required with compatible versions.
     *
     * @param values maps from root plugin to the plugins it requires
     * @return conflict descriptions, empty when all versions agree
     */
    @SafeVarargs
    public static List<String> verifyDependencies(Map<Plugin, List<Plugin>>... values) {
        var conflicts = findConflicts(values);
        var messages = new ArrayList<String>(conflicts.size());

        for (var conflict : conflicts) {
            messages.add(conflict.asMessage());
        }
        return messages;
    }

    /**
     * Same as {@link #verifyDependencies(Map[])} with messages sorted lexicographically.
     */
    @SafeVarargs
    public static List<String> sortedMessages(Map<Plugin, List<Plugin>>... values) {
        var messages = verifyDependencies(values);
        messages.sort(null);
        return messages;
    }

    @SafeVarargs
    public static List<Conflict> findConflicts(Map<Plugin, List<Plugin>>... values) {
        var requirements = collectRequirements(values);
        var conflicts = new ArrayList<Conflict>();

        for (var entry : requirements.entrySet()) {
            var records = entry.getValue();

            if (records.size() == 1) {
                continue;
            }

            var before = conflicts.size();

            for (var first : records) {
                for (var second : records) {
                    if (!first.version().equals(second.version())) {
                        conflicts.add(Conflict.conflict(entry.getKey(), first, second));
                    }
                }
            }

            if (conflicts.size() > before) {
                log.warn("Plugin {} is required with conflicting versions ({} conflicting pairs)",
                         entry.getKey(), conflicts.size() - before);
            }
        }
        return conflicts;
    }

    private static Map<String, List<Requirement>> collectRequirements(Map<Plugin, List<Plugin>>[] values) {
        var requirements = new LinkedHashMap<String, List<Requirement>>();
        var count = 0;

        if (values == null) {
            return requirements;
        }

        for (var value : values) {
            if (value == null) {
                continue;
            }

            for (var entry : value.entrySet()) {
                var root = entry.getKey();

                if (root == null) {
                    continue;
                }

                addRequirement(requirements, root.name(), Requirement.requirement(root, root));
                count++;

                if (entry.getValue() == null) {
                    continue;
                }

                for (var plugin : entry.getValue()) {
                    if (plugin == null) {
                        continue;
                    }
                    addRequirement(requirements, plugin.name(), Requirement.requirement(plugin, root));
                    count++;
                }
            }
        }

        log.debug("Collected {} requirements for {} plugins", count, requirements.size());
        return requirements;
    }

    private static void addRequirement(Map<String, List<Requirement>> requirements, String name, Requirement requirement) {
        requirements.computeIfAbsent(name, key -> new ArrayList<>())
                    .add(requirement);
    }
}
