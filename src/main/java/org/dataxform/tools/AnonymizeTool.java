/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools;

import static org.dataxform.tools.utils.ToolConstants.MAPPING_COLUMNS;
import static org.dataxform.tools.utils.ToolConstants.PARAM_COLUMNS;
import static org.dataxform.tools.utils.ToolConstants.PARAM_MAPPING;
import static org.dataxform.tools.utils.ToolConstants.PARAM_OUTPUT;
import static org.dataxform.tools.utils.ToolConstants.PARAM_PREFIX;
import static org.dataxform.tools.utils.ToolConstants.PARAM_SOURCE;
import static org.dataxform.tools.utils.ToolHelper.gson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.apache.commons.lang3.StringUtils;
import org.dataxform.common.Tool;
import org.dataxform.common.TransformSettings;
import org.dataxform.storage.Relation;
import org.dataxform.storage.RelationNotFoundException;
import org.dataxform.storage.RelationStore;
import org.dataxform.tools.utils.ToolConstants;
import org.dataxform.tools.utils.ToolHelper;
import org.dataxform.tools.utils.anonymization.PseudonymGenerator;
import org.dataxform.tools.utils.anonymization.PseudonymMapping;
import org.opensearch.core.action.ActionListener;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Replaces the values of some columns with hashed pseudonyms and records the pairs in a mapping relation.
 *
 * Usage:
 * {
 *   "source": "customers",
 *   "columns": "[\"email\", \"referrer_email\"]",
 *   "mapping": "customer_pseudonyms",
 *   "prefix": "anon_",
 *   "output": "customers_anonymized"
 * }
 * Result: {"output": "customers_anonymized", "mapping": "customer_pseudonyms", "rows": 120, "pseudonyms": 97, "added": 12}
 *
 * One mapping serves every listed column, so a value gets the same pseudonym wherever it appears. An existing mapping
 * relation is extended, never rewritten. Null cells stay null.
 */
@Log4j2
@Setter
@Getter
public class AnonymizeTool implements Tool {
    public static final String TYPE = "AnonymizeTool";

    private static final String DEFAULT_DESCRIPTION =
        "This tool replaces the values of the given columns with consistent hashed pseudonyms and stores the mapping.";

    public static final String DEFAULT_INPUT_SCHEMA = """
        {
            "type": "object",
            "properties": {
                "source": {
                    "type": "string",
                    "description": "Relation to anonymize"
                },
                "columns": {
                    "type": "string",
                    "description": "Columns to replace, as a JSON array or a comma separated list"
                },
                "mapping": {
                    "type": "string",
                    "description": "Mapping relation of original values and pseudonyms, created if missing"
                },
                "prefix": {
                    "type": "string",
                    "description": "Optional prefix of every new pseudonym"
                },
                "output": {
                    "type": "string",
                    "description": "Relation receiving the anonymized rows"
                }
            },
            "required": ["source", "columns", "mapping", "output"],
            "additionalProperties": false
        }
        """;

    public static final Map<String, Object> DEFAULT_ATTRIBUTES = Map
        .of(ToolConstants.TOOL_INPUT_SCHEMA_FIELD, DEFAULT_INPUT_SCHEMA, ToolConstants.STRICT_FIELD, false);

    /**
     * Parameters shared by the anonymization tools
     */
    static class MappingParameters {
        final String source;
        final List<String> columns;
        final String mapping;
        final String output;

        MappingParameters(Map<String, String> parameters) {
            this.source = parameters.getOrDefault(PARAM_SOURCE, "");
            this.columns = ToolHelper.parseStringList(parameters.get(PARAM_COLUMNS));
            this.mapping = parameters.getOrDefault(PARAM_MAPPING, "");
            this.output = parameters.getOrDefault(PARAM_OUTPUT, "");
        }

        void validate() {
            List<String> missingParams = new ArrayList<>();
            if (StringUtils.isBlank(source))
                missingParams.add(PARAM_SOURCE);
            if (columns.isEmpty())
                missingParams.add(PARAM_COLUMNS);
            if (StringUtils.isBlank(mapping))
                missingParams.add(PARAM_MAPPING);
            if (StringUtils.isBlank(output))
                missingParams.add(PARAM_OUTPUT);
            if (!missingParams.isEmpty()) {
                throw new IllegalArgumentException("Missing required parameters: " + String.join(", ", missingParams));
            }
        }

        void checkColumns(Relation relation) {
            for (String column : columns) {
                if (!relation.hasColumn(column)) {
                    throw new IllegalArgumentException("Relation " + relation.getName() + " has no column " + column);
                }
            }
        }

        /**
         * Copy of the relation under the output name with the listed columns rewritten; nulls are kept
         */
        Relation rewrite(Relation relation, Function<Object, Object> replacement) {
            List<Map<String, Object>> rows = new ArrayList<>(relation.size());
            for (Map<String, Object> row : relation.getRows()) {
                Map<String, Object> rewritten = new LinkedHashMap<>(row);
                for (String column : columns) {
                    Object value = row.get(column);
                    if (value != null) {
                        rewritten.put(column, replacement.apply(value));
                    }
                }
                rows.add(rewritten);
            }
            return new Relation(output, relation.getColumns(), rows);
        }
    }

    static Relation toMappingRelation(String name, PseudonymMapping mapping) {
        return new Relation(name, MAPPING_COLUMNS, mapping.toRows());
    }

    static PseudonymMapping fromMappingRelation(Relation relation) {
        for (String column : MAPPING_COLUMNS) {
            if (!relation.hasColumn(column)) {
                throw new IllegalArgumentException("Relation " + relation.getName() + " has no column " + column);
            }
        }
        return PseudonymMapping.fromRows(relation.getRows());
    }

    private String name = TYPE;
    private String description = DEFAULT_DESCRIPTION;
    private String version;
    private RelationStore store;
    private int hashLength;
    private int maxRetries;

    public AnonymizeTool(RelationStore store, int hashLength, int maxRetries) {
        this.store = store;
        this.hashLength = hashLength;
        this.maxRetries = maxRetries;
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
            new MappingParameters(ToolHelper.extractInputParameters(parameters, DEFAULT_ATTRIBUTES)).validate();
        } catch (Exception e) {
            log.error("Failed to validate the anonymization parameters: {}", e.getMessage());
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void run(Map<String, String> originalParameters, ActionListener<T> listener) {
        try {
            Map<String, String> parameters = ToolHelper.extractInputParameters(originalParameters, DEFAULT_ATTRIBUTES);
            MappingParameters params = new MappingParameters(parameters);
            params.validate();
            PseudonymGenerator generator = new PseudonymGenerator(hashLength, maxRetries, parameters.get(PARAM_PREFIX));

            store.getRelation(params.source, ActionListener.wrap(relation -> {
                params.checkColumns(relation);
                loadMapping(params.mapping, ActionListener.wrap(mapping -> {
                    int known = mapping.size();
                    Relation output = params.rewrite(relation, value -> mapping.pseudonymize(value, generator));
                    int added = mapping.size() - known;
                    store.putRelation(toMappingRelation(params.mapping, mapping), ActionListener.wrap(storedMapping -> {
                        store.putRelation(output, ActionListener.wrap(stored -> {
                            Map<String, Object> summary = new LinkedHashMap<>();
                            summary.put("output", stored.getName());
                            summary.put("mapping", storedMapping.getName());
                            summary.put("rows", stored.size());
                            summary.put("pseudonyms", mapping.size());
                            summary.put("added", added);
                            log.info("Anonymized {} rows of {} into {}, {} new pseudonyms", stored.size(), params.source, stored.getName(), added);
                            listener.onResponse((T) gson.toJson(summary));
                        }, e -> fail(listener, e)));
                    }, e -> fail(listener, e)));
                }, e -> fail(listener, e)));
            }, e -> fail(listener, e)));
        } catch (IllegalArgumentException e) {
            log.error("Invalid parameters for AnonymizeTool: {}", e.getMessage());
            listener.onFailure(e);
        } catch (Exception e) {
            log.error("Unexpected error in AnonymizeTool", e);
            listener.onFailure(e);
        }
    }

    /**
     * A missing mapping relation starts an empty mapping
     */
    private void loadMapping(String mappingName, ActionListener<PseudonymMapping> listener) {
        store.getRelation(mappingName, ActionListener.wrap(relation -> listener.onResponse(fromMappingRelation(relation)), e -> {
            if (e instanceof RelationNotFoundException) {
                log.debug("Mapping relation {} does not exist yet, starting an empty one", mappingName);
                listener.onResponse(new PseudonymMapping());
            } else {
                listener.onFailure(e);
            }
        }));
    }

    private static <T> void fail(ActionListener<T> listener, Exception e) {
        log.error("Anonymization failed: {}", e.getMessage());
        listener.onFailure(e);
    }

    public static class Factory implements Tool.Factory<AnonymizeTool> {
        private RelationStore store;
        private int hashLength = 16;
        private int maxRetries = 10;

        private static Factory INSTANCE;

        /**
         * Create or return the singleton factory instance
         */
        public static Factory getInstance() {
            if (INSTANCE != null) {
                return INSTANCE;
            }
            synchronized (AnonymizeTool.class) {
                if (INSTANCE != null) {
                    return INSTANCE;
                }
                INSTANCE = new Factory();
                return INSTANCE;
            }
        }

        public void init(RelationStore store, TransformSettings settings) {
            this.store = store;
            this.hashLength = settings.getInt(TransformSettings.ANONYMIZATION_HASH_LENGTH);
            this.maxRetries = settings.getInt(TransformSettings.ANONYMIZATION_MAX_RETRIES);
        }

        @Override
        public AnonymizeTool create(Map<String, Object> map) {
            return new AnonymizeTool(store, hashLength, maxRetries);
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
