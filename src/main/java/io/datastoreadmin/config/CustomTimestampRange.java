package io.datastoreadmin.config;

import io.datastoreadmin.errors.ConfigException;
import io.datastoreadmin.errors.ConfigSettingNotSetException;
import io.datastoreadmin.util.TimeSet;
import io.datastoreadmin.util.TimeUtil;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An operator-configured time range whose records go to an index with a fixed suffix
 * (e.g. {@code widgets_rollover__before_2019}) instead of the frequency-derived one.
 */
@Getter
@ToString
@EqualsAndHashCode
public class CustomTimestampRange {

    private static final Set<String> PREDICATE_KEYS = Set.of("gt", "gte", "lt", "lte");

    private final String indexNameSuffix;
    private final Map<String, Object> settingOverrides;
    private final TimeSet timeSet;

    public CustomTimestampRange(String indexNameSuffix, Map<String, Object> settingOverrides, TimeSet timeSet) {
        if (timeSet.isEmpty()) {
            throw new ConfigException("Custom timestamp range with suffix `" + indexNameSuffix
                + "` is invalid: no timestamps exist in it.");
        }
        this.indexNameSuffix = indexNameSuffix;
        this.settingOverrides = settingOverrides == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(settingOverrides));
        this.timeSet = timeSet;
    }

    public static List<CustomTimestampRange> rangesFrom(List<Map<String, Object>> rangeMaps) {
        List<CustomTimestampRange> ranges = new ArrayList<>();
        if (rangeMaps != null) {
            for (Map<String, Object> rangeMap : rangeMaps) {
                ranges.add(from(rangeMap));
            }
        }
        return ranges;
    }

    @SuppressWarnings("unchecked")
    static CustomTimestampRange from(Map<String, Object> rangeMap) {
        Map<String, Object> remaining = new LinkedHashMap<>(rangeMap);
        String suffix = (String) remaining.remove("index_name_suffix");
        Map<String, Object> settingOverrides = (Map<String, Object>) remaining.remove("setting_overrides");

        if (suffix == null) {
            throw new ConfigSettingNotSetException("Custom timestamp range lacks an `index_name_suffix`.");
        }

        if (remaining.isEmpty()) {
            throw new ConfigSettingNotSetException("Custom timestamp range with suffix `" + suffix
                + "` lacks boundary definitions.");
        }

        Map<String, Instant> bounds = new HashMap<>();
        remaining.forEach((key, value) -> {
            if (!PREDICATE_KEYS.contains(key)) {
                throw new ConfigException("Custom timestamp range with suffix `" + suffix
                    + "` has an unknown setting: `" + key + "`.");
            }
            bounds.put(key, parseBound(suffix, key, value));
        });

        TimeSet timeSet;
        try {
            timeSet = TimeSet.ofBounds(bounds.get("gt"), bounds.get("gte"), bounds.get("lt"), bounds.get("lte"));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Custom timestamp range with suffix `" + suffix + "` is invalid: "
                + e.getMessage(), e);
        }

        return new CustomTimestampRange(suffix, settingOverrides, timeSet);
    }

    private static Instant parseBound(String suffix, String key, Object value) {
        // SnakeYAML resolves unquoted timestamps to dates
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        try {
            return TimeUtil.parseIso8601(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Custom timestamp range with suffix `" + suffix + "` has an invalid `"
                + key + "` value: " + value, e);
        }
    }
}
