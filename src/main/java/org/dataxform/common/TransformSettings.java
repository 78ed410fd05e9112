/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.common;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.math.NumberUtils;
import org.dataxform.tools.utils.ToolHelper;

/**
 * Settings for the transformation utilities. Defaults come from {@value #DEFAULTS_RESOURCE} next to this class
 * and can be overridden per key.
 */
public final class TransformSettings {

    public static final String DEFAULTS_RESOURCE = "transform-settings.json";

    /**
     * Number of shards a nearest neighbour scan is split into while building a dendrogram; 1 keeps it serial
     */
    public static final String CLUSTERING_PARALLELISM = "plugins.transforms.clustering.parallelism";

    /**
     * Smallest number of live clusters whose scan is worth sharding
     */
    public static final String CLUSTERING_PARALLEL_MIN_CLUSTERS = "plugins.transforms.clustering.parallel_min_clusters";

    /**
     * Number of hex characters kept from the hash of a pseudonym
     */
    public static final String ANONYMIZATION_HASH_LENGTH = "plugins.transforms.anonymization.hash_length";

    /**
     * How many times a colliding pseudonym is regenerated before giving up
     */
    public static final String ANONYMIZATION_MAX_RETRIES = "plugins.transforms.anonymization.max_retries";

    private static final Set<String> KEYS = Set
        .of(CLUSTERING_PARALLELISM, CLUSTERING_PARALLEL_MIN_CLUSTERS, ANONYMIZATION_HASH_LENGTH, ANONYMIZATION_MAX_RETRIES);

    private final Map<String, Object> values;

    private TransformSettings(Map<String, Object> values) {
        this.values = values;
    }

    /**
     * @return settings holding the packaged defaults
     */
    public static TransformSettings defaults() {
        Map<String, Object> loaded = ToolHelper.loadJsonResource(TransformSettings.class, DEFAULTS_RESOURCE);
        if (!loaded.keySet().containsAll(KEYS)) {
            throw new IllegalStateException("Default settings resource " + DEFAULTS_RESOURCE + " must define " + KEYS);
        }
        return new TransformSettings(new HashMap<>(loaded));
    }

    /**
     * @return a copy of these settings with one value replaced
     */
    public TransformSettings with(String key, Object value) {
        if (!KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting: " + key);
        }
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new TransformSettings(copy);
    }

    public int getInt(String key) {
        if (!KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting: " + key);
        }
        Object value = values.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String && NumberUtils.isCreatable((String) value)) {
            return NumberUtils.createNumber((String) value).intValue();
        }
        throw new IllegalArgumentException("Setting " + key + " must be a number, got: " + value);
    }
}
