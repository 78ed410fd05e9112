/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TransformSettingsTests {

    @Test
    public void testDefaults() {
        TransformSettings settings = TransformSettings.defaults();

        assertEquals(1, settings.getInt(TransformSettings.CLUSTERING_PARALLELISM));
        assertEquals(2048, settings.getInt(TransformSettings.CLUSTERING_PARALLEL_MIN_CLUSTERS));
        assertEquals(16, settings.getInt(TransformSettings.ANONYMIZATION_HASH_LENGTH));
        assertEquals(10, settings.getInt(TransformSettings.ANONYMIZATION_MAX_RETRIES));
    }

    @Test
    public void testOverride() {
        TransformSettings defaults = TransformSettings.defaults();
        TransformSettings settings = defaults.with(TransformSettings.CLUSTERING_PARALLELISM, "4");

        assertEquals(4, settings.getInt(TransformSettings.CLUSTERING_PARALLELISM));
        assertEquals(1, defaults.getInt(TransformSettings.CLUSTERING_PARALLELISM));
    }

    @Test
    public void testUnknownKey() {
        TransformSettings settings = TransformSettings.defaults();
        assertThrows(IllegalArgumentException.class, () -> settings.with("plugins.transforms.unknown", 1));
        assertThrows(IllegalArgumentException.class, () -> settings.getInt("plugins.transforms.unknown"));
    }

    @Test
    public void testNonNumericValue() {
        TransformSettings settings = TransformSettings.defaults().with(TransformSettings.ANONYMIZATION_MAX_RETRIES, "many");
        assertThrows(IllegalArgumentException.class, () -> settings.getInt(TransformSettings.ANONYMIZATION_MAX_RETRIES));
    }
}
