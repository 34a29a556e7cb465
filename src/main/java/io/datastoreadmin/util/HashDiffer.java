package io.datastoreadmin.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Produces a human-readable, line-oriented diff of two nested maps, for reporting
 * configuration changes to operators.
 */
public final class HashDiffer {

    private HashDiffer() {
        // Utility class
    }

    /**
     * Returns the diff between {@code oldMap} and {@code newMap}, or {@code null} if they are equal.
     * Lines are prefixed with {@code +} (added), {@code -} (removed) or {@code ~} (changed).
     */
    public static String diff(Map<String, ?> oldMap, Map<String, ?> newMap) {
        Map<String, Object> flatOld = HashUtil.flattenAndStringifyKeys(oldMap == null ? Map.of() : oldMap);
        Map<String, Object> flatNew = HashUtil.flattenAndStringifyKeys(newMap == null ? Map.of() : newMap);

        TreeSet<String> allKeys = new TreeSet<>(flatOld.keySet());
        allKeys.addAll(flatNew.keySet());

        List<String> lines = new ArrayList<>();
        for (String key : allKeys) {
            boolean inOld = flatOld.containsKey(key);
            boolean inNew = flatNew.containsKey(key);
            if (inOld && !inNew) {
                lines.add("- " + key + ": " + flatOld.get(key));
            } else if (!inOld && inNew) {
                lines.add("+ " + key + ": " + flatNew.get(key));
            } else if (!Objects.equals(flatOld.get(key), flatNew.get(key))) {
                lines.add("~ " + key + ": " + flatOld.get(key) + " => " + flatNew.get(key));
            }
        }

        return lines.isEmpty() ? null : String.join("\n", lines);
    }
}
