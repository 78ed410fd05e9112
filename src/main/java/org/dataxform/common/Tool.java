/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.common;

import java.util.Map;

import org.opensearch.core.action.ActionListener;

/**
 * A data-transformation utility invoked by the hosting data platform with a flat parameter map.
 */
public interface Tool {

    /**
     * Run the tool. The outcome, a JSON summary on success, is always reported through the listener.
     * @param parameters invocation parameters
     * @param listener receives the summary or the failure
     * @param <T> response type expected by the caller
     */
    <T> void run(Map<String, String> parameters, ActionListener<T> listener);

    String getType();

    String getVersion();

    String getName();

    void setName(String name);

    String getDescription();

    void setDescription(String description);

    Map<String, Object> getAttributes();

    void setAttributes(Map<String, Object> attributes);

    /**
     * Check the parameters without running the tool.
     * @param parameters invocation parameters
     * @return true if the tool can run with them
     */
    boolean validate(Map<String, String> parameters);

    interface Factory<T extends Tool> {
        T create(Map<String, Object> params);

        String getDefaultDescription();

        String getDefaultType();

        String getDefaultVersion();

        default Map<String, Object> getDefaultAttributes() {
            return Map.of();
        }
    }
}
