/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools;

import static org.dataxform.tools.utils.ToolConstants.PARAM_DENDROGRAM;
import static org.dataxform.tools.utils.ToolConstants.PARAM_EXEMPLAR;
import static org.dataxform.tools.utils.ToolConstants.PARAM_HEIGHT;
import static org.dataxform.tools.utils.ToolConstants.PARAM_OUTPUT;
import static org.dataxform.tools.utils.ToolHelper.gson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.dataxform.common.Tool;
import org.dataxform.storage.Relation;
import org.dataxform.storage.RelationStore;
import org.dataxform.tools.utils.ClusteringRelations;
import org.dataxform.tools.utils.ToolConstants;
import org.dataxform.tools.utils.ToolHelper;
import org.dataxform.tools.utils.clustering.Dendrogram;
import org.dataxform.tools.utils.clustering.DistanceSet;
import org.dataxform.tools.utils.clustering.ExemplarPolicy;
import org.dataxform.tools.utils.clustering.FlatCluster;
import org.dataxform.tools.utils.clustering.InvalidThresholdException;
import org.dataxform.tools.utils.clustering.TreeCutter;
import org.opensearch.core.action.ActionListener;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Cuts a stored dendrogram at a height threshold and stores the flat clusters.
 *
 * Usage:
 * {
 *   "source": "page_distances",
 *   "idColumn1": "page_a",
 *   "idColumn2": "page_b",
 *   "distanceColumn": "dist",
 *   "dendrogram": "page_dendrogram",
 *   "height": "2",
 *   "exemplar": "min_id",
 *   "output": "page_clusters"
 * }
 * Result: {"output": "page_clusters", "height": 2.0, "clusters": 2}
 * Output rows: cluster_id, member, height, exemplar.
 *
 * The distance relation supplies the item universe the dendrogram's leaf ids refer to, and the distances for
 * medoid exemplars. Without a height the whole tree becomes a single cluster.
 */
@Log4j2
@Setter
@Getter
public class TreeCutTool implements Tool {
    public static final String TYPE = "TreeCutTool";

    private static final String DEFAULT_DESCRIPTION =
        "This tool cuts a complete-linkage dendrogram at a height threshold into flat clusters with one exemplar each.";

    public static final String DEFAULT_INPUT_SCHEMA = """
        {
            "type": "object",
            "properties": {
                "source": {
                    "type": "string",
                    "description": "Relation of pairwise distances the dendrogram was built from"
                },
                "idColumn1": {
                    "type": "string",
                    "description": "Column holding the first item id of a pair"
                },
                "idColumn2": {
                    "type": "string",
                    "description": "Column holding the second item id of a pair"
                },
                "distanceColumn": {
                    "type": "string",
                    "description": "Column holding the non-negative distance"
                },
                "dendrogram": {
                    "type": "string",
                    "description": "Relation written by HierarchicalClusteringTool"
                },
                "height": {
                    "type": "number",
                    "description": "Height threshold (optional, defaults to the root height)"
                },
                "exemplar": {
                    "type": "string",
                    "description": "Exemplar policy: 'min_id' or 'medoid' (default: 'min_id')"
                },
                "output": {
                    "type": "string",
                    "description": "Relation receiving one row per flat cluster"
                }
            },
            "required": ["source", "idColumn1", "idColumn2", "distanceColumn", "dendrogram", "output"],
            "additionalProperties": false
        }
        """;

    public static final Map<String, Object> DEFAULT_ATTRIBUTES = Map
        .of(ToolConstants.TOOL_INPUT_SCHEMA_FIELD, DEFAULT_INPUT_SCHEMA, ToolConstants.STRICT_FIELD, false);

    private static class CutParameters extends HierarchicalClusteringTool.DistanceRelationParameters {
        final String dendrogram;
        final String output;
        final Double height;
        final ExemplarPolicy exemplarPolicy;

        CutParameters(Map<String, String> parameters) {
            super(parameters);
            this.dendrogram = parameters.getOrDefault(PARAM_DENDROGRAM, "");
            this.output = parameters.getOrDefault(PARAM_OUTPUT, "");

            String heightParam = parameters.get(PARAM_HEIGHT);
            if (StringUtils.isBlank(heightParam)) {
                this.height = null;
            } else if (NumberUtils.isCreatable(heightParam.trim())) {
                this.height = NumberUtils.createNumber(heightParam.trim()).doubleValue();
                if (this.height < 0) {
                    throw new InvalidThresholdException("Height threshold must be non-negative, got: " + heightParam);
                }
            } else {
                throw new InvalidThresholdException("Invalid 'height' parameter: must be a number, got '" + heightParam + "'");
            }

            String exemplarParam = parameters.get(PARAM_EXEMPLAR);
            this.exemplarPolicy = StringUtils.isBlank(exemplarParam) ? ExemplarPolicy.MIN_ID : ExemplarPolicy.from(exemplarParam);
        }

        void validate() {
            List<String> missingParams = missing();
            if (StringUtils.isBlank(dendrogram))
                missingParams.add(PARAM_DENDROGRAM);
            if (StringUtils.isBlank(output))
                missingParams.add(PARAM_OUTPUT);
            if (!missingParams.isEmpty()) {
                throw new IllegalArgumentException("Missing required parameters: " + String.join(", ", missingParams));
            }
        }
    }

    private String name = TYPE;
    private String description = DEFAULT_DESCRIPTION;
    private String version;
    private RelationStore store;

    public TreeCutTool(RelationStore store) {
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
            new CutParameters(ToolHelper.extractInputParameters(parameters, DEFAULT_ATTRIBUTES)).validate();
        } catch (Exception e) {
            log.error("Failed to validate the tree cut parameters: {}", e.getMessage());
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void run(Map<String, String> originalParameters, ActionListener<T> listener) {
        try {
            Map<String, String> parameters = ToolHelper.extractInputParameters(originalParameters, DEFAULT_ATTRIBUTES);
            CutParameters params = new CutParameters(parameters);
            params.validate();
            log.debug("Cutting dendrogram {} at height {}", params.dendrogram, params.height);

            store.getRelation(params.source, ActionListener.wrap(distanceRelation -> {
                DistanceSet distances = params.read(distanceRelation);
                store.getRelation(params.dendrogram, ActionListener.wrap(dendrogramRelation -> {
                    Dendrogram dendrogram = ClusteringRelations.fromDendrogramRelation(dendrogramRelation, distances);
                    TreeCutter cutter = new TreeCutter(params.exemplarPolicy, distances);
                    List<FlatCluster> clusters = cutter.cut(dendrogram, params.height);
                    Relation output = ClusteringRelations.toFlatClusterRelation(params.output, clusters);
                    store.putRelation(output, ActionListener.wrap(stored -> {
                        Map<String, Object> summary = new LinkedHashMap<>();
                        summary.put("output", stored.getName());
                        summary.put("height", params.height == null ? dendrogram.getRootHeight() : params.height);
                        summary.put("clusters", clusters.size());
                        log.info("Stored {} flat clusters of dendrogram {} into {}", clusters.size(), params.dendrogram, stored.getName());
                        listener.onResponse((T) gson.toJson(summary));
                    }, e -> fail(listener, e)));
                }, e -> fail(listener, e)));
            }, e -> fail(listener, e)));
        } catch (IllegalArgumentException e) {
            log.error("Invalid parameters for TreeCutTool: {}", e.getMessage());
            listener.onFailure(e);
        } catch (Exception e) {
            log.error("Unexpected error in TreeCutTool", e);
            listener.onFailure(e);
        }
    }

    private static <T> void fail(ActionListener<T> listener, Exception e) {
        log.error("Tree cut failed: {}", e.getMessage());
        listener.onFailure(e);
    }

    public static class Factory implements Tool.Factory<TreeCutTool> {
        private RelationStore store;

        private static Factory INSTANCE;

        /**
         * Create or return the singleton factory instance
         */
        public static Factory getInstance() {
            if (INSTANCE != null) {
                return INSTANCE;
            }
            synchronized (TreeCutTool.class) {
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
        public TreeCutTool create(Map<String, Object> map) {
            return new TreeCutTool(store);
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
