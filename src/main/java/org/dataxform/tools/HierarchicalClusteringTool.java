/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools;

import static org.dataxform.tools.utils.ToolConstants.PARAM_DISTANCE_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.PARAM_ID_COLUMN_1;
import static org.dataxform.tools.utils.ToolConstants.PARAM_ID_COLUMN_2;
import static org.dataxform.tools.utils.ToolConstants.PARAM_OUTPUT;
import static org.dataxform.tools.utils.ToolConstants.PARAM_SOURCE;
import static org.dataxform.tools.utils.ToolHelper.gson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.apache.commons.lang3.StringUtils;
import org.dataxform.common.Tool;
import org.dataxform.common.TransformSettings;
import org.dataxform.storage.Relation;
import org.dataxform.storage.RelationStore;
import org.dataxform.tools.utils.ClusteringRelations;
import org.dataxform.tools.utils.ToolConstants;
import org.dataxform.tools.utils.ToolHelper;
import org.dataxform.tools.utils.clustering.CompleteLinkageClustering;
import org.dataxform.tools.utils.clustering.Dendrogram;
import org.dataxform.tools.utils.clustering.DistanceSet;
import org.opensearch.core.action.ActionListener;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Builds the complete-linkage dendrogram of a pairwise distance relation and stores it as a relation of merges.
 *
 * Usage:
 * {
 *   "source": "page_distances",
 *   "idColumn1": "page_a",
 *   "idColumn2": "page_b",
 *   "distanceColumn": "dist",
 *   "output": "page_dendrogram"
 * }
 * Result: {"output": "page_dendrogram", "items": 4, "merges": 3, "rootHeight": 5.0}
 * Output rows: node_id, left_child, right_child, height, size, members.
 */
@Log4j2
@Setter
@Getter
public class HierarchicalClusteringTool implements Tool {
    public static final String TYPE = "HierarchicalClusteringTool";

    private static final String DEFAULT_DESCRIPTION =
        "This tool builds a complete-linkage hierarchical clustering tree from a relation of pairwise distances.";

    public static final String DEFAULT_INPUT_SCHEMA = """
        {
            "type": "object",
            "properties": {
                "source": {
                    "type": "string",
                    "description": "Relation of pairwise distances"
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
                "output": {
                    "type": "string",
                    "description": "Relation receiving one row per merge"
                }
            },
            "required": ["source", "idColumn1", "idColumn2", "distanceColumn", "output"],
            "additionalProperties": false
        }
        """;

    public static final Map<String, Object> DEFAULT_ATTRIBUTES = Map
        .of(ToolConstants.TOOL_INPUT_SCHEMA_FIELD, DEFAULT_INPUT_SCHEMA, ToolConstants.STRICT_FIELD, false);

    /**
     * Parameters naming the distance relation and its columns
     */
    static class DistanceRelationParameters {
        final String source;
        final String idColumn1;
        final String idColumn2;
        final String distanceColumn;

        DistanceRelationParameters(Map<String, String> parameters) {
            this.source = parameters.getOrDefault(PARAM_SOURCE, "");
            this.idColumn1 = parameters.getOrDefault(PARAM_ID_COLUMN_1, "");
            this.idColumn2 = parameters.getOrDefault(PARAM_ID_COLUMN_2, "");
            this.distanceColumn = parameters.getOrDefault(PARAM_DISTANCE_COLUMN, "");
        }

        List<String> missing() {
            List<String> missingParams = new ArrayList<>();
            if (StringUtils.isBlank(source))
                missingParams.add(PARAM_SOURCE);
            if (StringUtils.isBlank(idColumn1))
                missingParams.add(PARAM_ID_COLUMN_1);
            if (StringUtils.isBlank(idColumn2))
                missingParams.add(PARAM_ID_COLUMN_2);
            if (StringUtils.isBlank(distanceColumn))
                missingParams.add(PARAM_DISTANCE_COLUMN);
            return missingParams;
        }

        DistanceSet read(Relation relation) {
            return ClusteringRelations.toDistanceSet(relation, idColumn1, idColumn2, distanceColumn);
        }
    }

    private static class ClusteringParameters extends DistanceRelationParameters {
        final String output;

        ClusteringParameters(Map<String, String> parameters) {
            super(parameters);
            this.output = parameters.getOrDefault(PARAM_OUTPUT, "");
        }

        void validate() {
            List<String> missingParams = missing();
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
    private CompleteLinkageClustering clustering;

    public HierarchicalClusteringTool(RelationStore store, CompleteLinkageClustering clustering) {
        this.store = store;
        this.clustering = clustering;
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
            new ClusteringParameters(ToolHelper.extractInputParameters(parameters, DEFAULT_ATTRIBUTES)).validate();
        } catch (Exception e) {
            log.error("Failed to validate the hierarchical clustering parameters: {}", e.getMessage());
            return false;
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> void run(Map<String, String> originalParameters, ActionListener<T> listener) {
        try {
            Map<String, String> parameters = ToolHelper.extractInputParameters(originalParameters, DEFAULT_ATTRIBUTES);
            ClusteringParameters params = new ClusteringParameters(parameters);
            params.validate();
            log.debug("Starting hierarchical clustering of relation {}", params.source);

            store.getRelation(params.source, ActionListener.wrap(relation -> {
                DistanceSet distances = params.read(relation);
                Dendrogram dendrogram = clustering.build(distances);
                Relation output = ClusteringRelations.toDendrogramRelation(params.output, dendrogram);
                store.putRelation(output, ActionListener.wrap(stored -> {
                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("output", stored.getName());
                    summary.put("items", dendrogram.getLeafCount());
                    summary.put("merges", dendrogram.getMerges().size());
                    summary.put("rootHeight", dendrogram.getRootHeight());
                    log.info("Stored dendrogram of {} items from {} into {}", dendrogram.getLeafCount(), params.source, stored.getName());
                    listener.onResponse((T) gson.toJson(summary));
                }, e -> fail(listener, e)));
            }, e -> fail(listener, e)));
        } catch (IllegalArgumentException e) {
            log.error("Invalid parameters for HierarchicalClusteringTool: {}", e.getMessage());
            listener.onFailure(e);
        } catch (Exception e) {
            log.error("Unexpected error in HierarchicalClusteringTool", e);
            listener.onFailure(e);
        }
    }

    private static <T> void fail(ActionListener<T> listener, Exception e) {
        log.error("Hierarchical clustering failed: {}", e.getMessage());
        listener.onFailure(e);
    }

    public static class Factory implements Tool.Factory<HierarchicalClusteringTool> {
        private RelationStore store;
        private CompleteLinkageClustering clustering = new CompleteLinkageClustering();

        private static Factory INSTANCE;

        /**
         * Create or return the singleton factory instance
         */
        public static Factory getInstance() {
            if (INSTANCE != null) {
                return INSTANCE;
            }
            synchronized (HierarchicalClusteringTool.class) {
                if (INSTANCE != null) {
                    return INSTANCE;
                }
                INSTANCE = new Factory();
                return INSTANCE;
            }
        }

        /**
         * Initialize this factory
         *
         * @param store storage collaborator holding the input and output relations
         * @param settings clustering settings
         * @param executor pool for sharded neighbour scans, or null to stay serial
         */
        public void init(RelationStore store, TransformSettings settings, ExecutorService executor) {
            this.store = store;
            this.clustering = new CompleteLinkageClustering(
                executor,
                settings.getInt(TransformSettings.CLUSTERING_PARALLELISM),
                settings.getInt(TransformSettings.CLUSTERING_PARALLEL_MIN_CLUSTERS)
            );
        }

        @Override
        public HierarchicalClusteringTool create(Map<String, Object> map) {
            return new HierarchicalClusteringTool(store, clustering);
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
