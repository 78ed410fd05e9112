/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils;

import java.util.List;

public class ToolConstants {
    public static final String TOOL_REQUIRED_PARAMS = "required_parameters";
    public static final String INPUT_PARAM = "input";
    public static final String TOOL_INPUT_SCHEMA_FIELD = "input_schema";
    public static final String STRICT_FIELD = "strict";

    // Invocation parameters shared by the tools
    public static final String PARAM_SOURCE = "source";
    public static final String PARAM_OUTPUT = "output";
    public static final String PARAM_ID_COLUMN_1 = "idColumn1";
    public static final String PARAM_ID_COLUMN_2 = "idColumn2";
    public static final String PARAM_DISTANCE_COLUMN = "distanceColumn";
    public static final String PARAM_DENDROGRAM = "dendrogram";
    public static final String PARAM_HEIGHT = "height";
    public static final String PARAM_EXEMPLAR = "exemplar";
    public static final String PARAM_COLUMNS = "columns";
    public static final String PARAM_MAPPING = "mapping";
    public static final String PARAM_PREFIX = "prefix";

    // Dendrogram relation, one row per merge
    public static final String NODE_ID_COLUMN = "node_id";
    public static final String LEFT_CHILD_COLUMN = "left_child";
    public static final String RIGHT_CHILD_COLUMN = "right_child";
    public static final String HEIGHT_COLUMN = "height";
    public static final String SIZE_COLUMN = "size";
    public static final String MEMBERS_COLUMN = "members";
    public static final List<String> DENDROGRAM_COLUMNS = List
        .of(NODE_ID_COLUMN, LEFT_CHILD_COLUMN, RIGHT_CHILD_COLUMN, HEIGHT_COLUMN, SIZE_COLUMN, MEMBERS_COLUMN);

    // Flat cluster relation, one row per cluster
    public static final String CLUSTER_ID_COLUMN = "cluster_id";
    public static final String MEMBER_COLUMN = "member";
    public static final String EXEMPLAR_COLUMN = "exemplar";
    public static final List<String> FLAT_CLUSTER_COLUMNS = List.of(CLUSTER_ID_COLUMN, MEMBER_COLUMN, HEIGHT_COLUMN, EXEMPLAR_COLUMN);

    // Pseudonym mapping relation
    public static final String ORIGINAL_COLUMN = "original";
    public static final String PSEUDONYM_COLUMN = "pseudonym";
    public static final List<String> MAPPING_COLUMNS = List.of(ORIGINAL_COLUMN, PSEUDONYM_COLUMN);
}
