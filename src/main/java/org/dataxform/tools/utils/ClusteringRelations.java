/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils;

import static org.dataxform.tools.utils.ToolConstants.CLUSTER_ID_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.DENDROGRAM_COLUMNS;
import static org.dataxform.tools.utils.ToolConstants.EXEMPLAR_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.FLAT_CLUSTER_COLUMNS;
import static org.dataxform.tools.utils.ToolConstants.HEIGHT_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.LEFT_CHILD_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.MEMBERS_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.MEMBER_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.NODE_ID_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.RIGHT_CHILD_COLUMN;
import static org.dataxform.tools.utils.ToolConstants.SIZE_COLUMN;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.math.NumberUtils;
import org.dataxform.storage.Relation;
import org.dataxform.tools.utils.clustering.Dendrogram;
import org.dataxform.tools.utils.clustering.DistanceSet;
import org.dataxform.tools.utils.clustering.FlatCluster;
import org.dataxform.tools.utils.clustering.ItemId;
import org.dataxform.tools.utils.clustering.MalformedInputException;
import org.dataxform.tools.utils.clustering.MergeEvent;

/**
 * Conversions between relations and the clustering model.
 */
public class ClusteringRelations {

    private ClusteringRelations() {}

    /**
     * Reads a pairwise distance relation.
     *
     * @param relation rows of (item id, item id, distance)
     * @param idColumn1 column holding the first item id
     * @param idColumn2 column holding the second item id
     * @param distanceColumn column holding the distance, a number or a numeric string
     * @return the distance set over every item the rows mention
     * @throws IllegalArgumentException if a column is missing
     * @throws MalformedInputException if a row breaks a distance record invariant
     */
    public static DistanceSet toDistanceSet(Relation relation, String idColumn1, String idColumn2, String distanceColumn) {
        for (String column : List.of(idColumn1, idColumn2, distanceColumn)) {
            if (!relation.hasColumn(column)) {
                throw new IllegalArgumentException("Relation " + relation.getName() + " has no column " + column);
            }
        }
        DistanceSet.Builder builder = DistanceSet.builder();
        int rowNumber = 0;
        for (Map<String, Object> row : relation.getRows()) {
            try {
                builder
                    .add(
                        ItemId.fromValue(row.get(idColumn1)),
                        ItemId.fromValue(row.get(idColumn2)),
                        toDouble(row.get(distanceColumn), distanceColumn)
                    );
            } catch (MalformedInputException e) {
                throw new MalformedInputException("Row " + rowNumber + " of relation " + relation.getName() + ": " + e.getMessage(), e);
            }
            rowNumber++;
        }
        return builder.build();
    }

    /**
     * One row per merge, in merge order.
     */
    public static Relation toDendrogramRelation(String name, Dendrogram dendrogram) {
        List<Map<String, Object>> rows = new ArrayList<>(dendrogram.getMerges().size());
        for (MergeEvent merge : dendrogram.getMerges()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(NODE_ID_COLUMN, (long) merge.nodeId());
            row.put(LEFT_CHILD_COLUMN, (long) merge.left());
            row.put(RIGHT_CHILD_COLUMN, (long) merge.right());
            row.put(HEIGHT_COLUMN, merge.height());
            row.put(SIZE_COLUMN, (long) merge.size());
            row.put(MEMBERS_COLUMN, toValues(dendrogram.getMembers(merge.nodeId())));
            rows.add(row);
        }
        return new Relation(name, DENDROGRAM_COLUMNS, rows);
    }

    /**
     * Rebuilds a dendrogram written by {@link #toDendrogramRelation}. Leaf ids refer to the items of the distance
     * set in ascending order; every row's member list must match the leaves below its node.
     *
     * @throws MalformedInputException if the rows do not describe a dendrogram over the distance set's items
     */
    public static Dendrogram fromDendrogramRelation(Relation relation, DistanceSet distances) {
        for (String column : DENDROGRAM_COLUMNS) {
            if (!relation.hasColumn(column)) {
                throw new IllegalArgumentException("Relation " + relation.getName() + " has no column " + column);
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>(relation.getRows());
        rows.sort(Comparator.comparingLong(row -> toLong(row.get(NODE_ID_COLUMN), NODE_ID_COLUMN)));
        List<MergeEvent> merges = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            merges
                .add(
                    new MergeEvent(
                        toInt(row.get(NODE_ID_COLUMN), NODE_ID_COLUMN),
                        toInt(row.get(LEFT_CHILD_COLUMN), LEFT_CHILD_COLUMN),
                        toInt(row.get(RIGHT_CHILD_COLUMN), RIGHT_CHILD_COLUMN),
                        toDouble(row.get(HEIGHT_COLUMN), HEIGHT_COLUMN),
                        toInt(row.get(SIZE_COLUMN), SIZE_COLUMN)
                    )
                );
        }
        Dendrogram dendrogram = Dendrogram.of(distances.getItems(), merges);
        for (int k = 0; k < rows.size(); k++) {
            Object members = rows.get(k).get(MEMBERS_COLUMN);
            if (!(members instanceof Collection)) {
                throw new MalformedInputException("Column " + MEMBERS_COLUMN + " of node " + merges.get(k).nodeId() + " must be a list");
            }
            List<ItemId> stored = new ArrayList<>();
            for (Object member : (Collection<?>) members) {
                stored.add(ItemId.fromValue(member));
            }
            stored.sort(Comparator.naturalOrder());
            if (!stored.equals(dendrogram.getMembers(merges.get(k).nodeId()))) {
                throw new MalformedInputException(
                    "Members of node " + merges.get(k).nodeId() + " do not match the distance relation, stored " + stored
                );
            }
        }
        return dendrogram;
    }

    /**
     * One row per flat cluster, ordered by cluster id.
     */
    public static Relation toFlatClusterRelation(String name, List<FlatCluster> clusters) {
        List<Map<String, Object>> rows = new ArrayList<>(clusters.size());
        for (FlatCluster cluster : clusters) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(CLUSTER_ID_COLUMN, (long) cluster.clusterId());
            row.put(MEMBER_COLUMN, toValues(cluster.members()));
            row.put(HEIGHT_COLUMN, cluster.height());
            row.put(EXEMPLAR_COLUMN, cluster.exemplar().toValue());
            rows.add(row);
        }
        return new Relation(name, FLAT_CLUSTER_COLUMNS, rows);
    }

    private static List<Object> toValues(List<ItemId> items) {
        List<Object> values = new ArrayList<>(items.size());
        for (ItemId item : items) {
            values.add(item.toValue());
        }
        return values;
    }

    static double toDouble(Object value, String column) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && NumberUtils.isCreatable(((String) value).trim())) {
            return NumberUtils.createNumber(((String) value).trim()).doubleValue();
        }
        throw new MalformedInputException("Column " + column + " must hold a number, got " + value);
    }

    static long toLong(Object value, String column) {
        double d = toDouble(value, column);
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw new MalformedInputException("Column " + column + " must hold an integer, got " + value);
        }
        return (long) d;
    }

    private static int toInt(Object value, String column) {
        long l = toLong(value, column);
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new MalformedInputException("Column " + column + " is out of range: " + value);
        }
        return (int) l;
    }
}
