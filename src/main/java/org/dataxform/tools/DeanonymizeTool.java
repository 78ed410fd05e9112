/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools;

import static org.dataxform.tools.utils.ToolHelper.gson;

import java.util.LinkedHashMap;
import java.util.Map;

import org.dataxform.common.Tool;
import org.dataxform.storage.Relation;
import org.dataxform.storage.RelationStore;
import org.dataxform.tools.utils.ToolConstants;
import org.dataxform.tools.utils.ToolHelper;
import org.dataxform.tools.utils.anonymization.PseudonymMapping;
import org.opensearch.core.action.ActionListener;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Restores the original values of columns written by {@link AnonymizeTool}.
 *
 * Usage:
 * {
 *   "source": "customers_anonymized",
 *   "columns": "email,referrer_email",
 *   "mapping": "customer_pseudonyms",
 *   "output": "customers_restored"
 * }
 * Result: {"output": "customers_restored", "mapping": "customer_pseudonyms", "rows": 120}
 */
@Log4j2
@Setter
@Getter
public class DeanonymizeTool implements Tool {
    public static final String TYPE = "DeanonymizeTool";

    private static final String DEFAULT_DESCRIPTION =
        "This tool replaces pseudonyms in the given columns with the original values recorded in a mapping relation.";

    public static final String DEFAULT_INPUT_SCHEMA = """
        {
            "type": "object",
            "properties": {
                "source": {
                    "type": "string",
                    "description": "Relation holding pseudonyms"
                },
                "columns": {
                    "type": "string",
                    "description": "Columns to restore, as a JSON array or a comma separated list"
                },
                "mapping": {
                    "type": "string",
                    "description": "Mapping relation written by AnonymizeTool"
                },
                "output": {
                    "type": "string",
                    "description": "Relation receiving the restored rows"
                }
            },
            "required": ["source", "columns", "mapping", "output"],
            "additionalProperties": false
        }
        """;

    public static final Map<String, Object> DEFAULT_ATTRIBUTES = Map
        .of(ToolConstants.TOOL_INPUT_SCHEMA_FIELD, DEFAULT_INPUT_SCHEMA, ToolConstants.STRICT_FIELD, false);

    private String name = TYPE;
    private String description = DEFAULT_DESCRIPTION;
    private String version;
    private RelationStore store;

    public DeanonymizeTool(RelationStore store) {
        this.store = store;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return DEFAULT_ATTRIBUTES;
    }

    @Override
    public void setAttributes(Map<String, Object> map) {}

    @Override
    public boolean validate(Map<String, String> parameters) {
        try {
            new AnonymizeTool.MappingParameters(ToolHelper.extractInputParameters(parameters, DEFAULT_ATTRIBUTES)).validate();
        } catch (Exception e) {
            log.error("Failed to validate the deanonymization parameters: {}", e.getMessage());
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void run(Map<String, String> originalParameters, ActionListener<T> listener) {
        try {
            Map<String, String> parameters = ToolHelper.extractInputParameters(originalParameters, DEFAULT_ATTRIBUTES);
            AnonymizeTool.MappingParameters params = new AnonymizeTool.MappingParameters(parameters);
            params.validate();

            store.getRelation(params.source, ActionListener.wrap(relation -> {
                params.checkColumns(relation);
                store.getRelation(params.mapping, ActionListener.wrap(mappingRelation -> {
                    PseudonymMapping mapping = AnonymizeTool.fromMappingRelation(mappingRelation);
                    Relation output = params.rewrite(relation, value -> restore(mapping, value));
                    store.putRelation(output, ActionListener.wrap(stored -> {
                        Map<String, Object> summary = new LinkedHashMap<>();
                        summary.put("output", stored.getName());
                        summary.put("mapping", mappingRelation.getName());
                        summary.put("rows", stored.size());
                        log.info("Restored {} rows of {} into {}", stored.size(), params.source, stored.getName());
                        listener.onResponse((T) gson.toJson(summary));
                    }, e -> fail(listener, e)));
                }, e -> fail(listener, e)));
            }, e -> fail(listener, e)));
        } catch (IllegalArgumentException e) {
            log.error("Invalid parameters for DeanonymizeTool: {}", e.getMessage());
            listener.onFailure(e);
        } catch (Exception e) {
            log.error("Unexpected error in DeanonymizeTool", e);
            listener.onFailure(e);
        }
    }

    private static Object restore(PseudonymMapping mapping, Object value) {
        if (!(value instanceof String)) {
            throw new IllegalArgumentException("Value " + value + " is not a pseudonym");
        }
        return mapping
            .original((String) value)
            .orElseThrow(() -> new IllegalArgumentException("Pseudonym " + value + " is not in the mapping"));
    }

    private static <T> void fail(ActionListener<T> listener, Exception e) {
        log.error("Deanonymization failed: {}", e.getMessage());
        listener.onFailure(e);
    }

    public static class Factory implements Tool.Factory<DeanonymizeTool> {
        private RelationStore store;

        private static Factory INSTANCE;

        /**
         * Create or return the singleton factory instance
         */
        public static Factory getInstance() {
            if (INSTANCE != null) {
                return INSTANCE;
            }
            synchronized (DeanonymizeTool.class) {
                if (INSTANCE != null) {
                    return INSTANCE;
                }
                INSTANCE = new Factory();
                return INSTANCE;
            }
        }

        public void init(RelationStore store) {
            this.store = store;
        }

        @Override
        public DeanonymizeTool create(Map<String, Object> map) {
            return new DeanonymizeTool(store);
        }

        @Override
        public String getDefaultDescription() {
            return DEFAULT_DESCRIPTION;
        }

        @Override
        public String getDefaultType() {
            return TYPE;
        }

        @Override
        public String getDefaultVersion() {
            return null;
        }

        @Override
        public Map<String, Object> getDefaultAttributes() {
            return DEFAULT_ATTRIBUTES;
        }
    }
}
