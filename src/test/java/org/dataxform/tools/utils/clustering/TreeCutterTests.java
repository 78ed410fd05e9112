/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.clustering;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Before;
import org.junit.Test;

public class TreeCutterTests {

    private DistanceSet distances;
    private Dendrogram dendrogram;
    private final TreeCutter cutter = new TreeCutter();

    @Before
    public void setup() {
        distances = CompleteLinkageClusteringTests.fourItems();
        dendrogram = new CompleteLinkageClustering().build(distances);
    }

    private static List<ItemId> ids(long... values) {
        List<ItemId> ids = new ArrayList<>(values.length);
        for (long value : values) {
            ids.add(ItemId.of(value));
        }
        return ids;
    }

    @Test
    public void testCutBetweenMerges() {
        List<FlatCluster> clusters = cutter.cut(dendrogram, 2.0);

        assertEquals(List.of(new FlatCluster(0, ids(1, 2, 3), 2.0, ItemId.of(1)), new FlatCluster(1, ids(4), 0.0, ItemId.of(4))), clusters);
    }

    @Test
    public void testCutAtZeroKeepsZeroDistancePairs() {
        List<FlatCluster> clusters = cutter.cut(dendrogram, 0.0);

        assertEquals(3, clusters.size());
        assertEquals(ids(1, 2), clusters.get(0).members());
        assertEquals(ids(3), clusters.get(1).members());
        assertEquals(ids(4), clusters.get(2).members());
    }

    @Test
    public void testCutAtZeroWithPositiveDistancesGivesSingletons() {
        Dendrogram positive = new CompleteLinkageClustering().build(strictlyPositive(10));
        List<FlatCluster> clusters = cutter.cut(positive, 0.0);

        assertEquals(10, clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            assertEquals(i, clusters.get(i).clusterId());
            assertEquals(List.of(ItemId.of(i)), clusters.get(i).members());
            assertEquals(0.0, clusters.get(i).height(), 0.0);
            assertEquals(ItemId.of(i), clusters.get(i).exemplar());
        }
    }

    private static DistanceSet strictlyPositive(int n) {
        DistanceSet.Builder builder = DistanceSet.builder();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                builder.add(ItemId.of(i), ItemId.of(j), 1.0 + i + j);
            }
        }
        return builder.build();
    }

    @Test
    public void testCutAtOrAboveRootGivesOneCluster() {
        for (Double threshold : new Double[] { 5.0, 100.0, null }) {
            List<FlatCluster> clusters = cutter.cut(dendrogram, threshold);
            assertEquals(List.of(new FlatCluster(0, ids(1, 2, 3, 4), 5.0, ItemId.of(1))), clusters);
        }
    }

    @Test
    public void testInvalidThreshold() {
        InvalidThresholdException e = assertThrows(InvalidThresholdException.class, () -> cutter.cut(dendrogram, -0.1));
        assertThat(e.getMessage(), containsString("non-negative"));
        assertThrows(InvalidThresholdException.class, () -> cutter.cut(dendrogram, Double.NaN));
    }

    @Test
    public void testSingleItemDendrogram() {
        Dendrogram single = Dendrogram.of(List.of(ItemId.of("x")), List.of());

        assertEquals(List.of(new FlatCluster(0, List.of(ItemId.of("x")), 0.0, ItemId.of("x"))), cutter.cut(single, 3.0));
        assertEquals(1, cutter.cut(single, null).size());
    }

    @Test
    public void testCutIsAPartition() {
        DistanceSet random = CompleteLinkageClusteringTests.randomDistances(new Random(17), 30, 50);
        Dendrogram tree = new CompleteLinkageClustering().build(random);
        for (double threshold : new double[] { 0.0, 10.0, 25.0, 40.0, 50.0 }) {
            List<FlatCluster> clusters = cutter.cut(tree, threshold);
            Set<ItemId> seen = new HashSet<>();
            ItemId previousFirst = null;
            for (FlatCluster cluster : clusters) {
                assertTrue(cluster.height() <= threshold);
                assertThat(cluster.members(), hasItem(cluster.exemplar()));
                for (ItemId member : cluster.members()) {
                    assertTrue(seen.add(member));
                }
                if (previousFirst != null) {
                    assertTrue(previousFirst.compareTo(cluster.members().get(0)) < 0);
                }
                previousFirst = cluster.members().get(0);
                for (ItemId a : cluster.members()) {
                    for (ItemId b : cluster.members()) {
                        assertTrue(random.distance(a, b) <= threshold);
                    }
                }
            }
            assertEquals(30, seen.size());
        }
    }

    @Test
    public void testCutIsIdempotent() {
        assertEquals(cutter.cut(dendrogram, 1.0), cutter.cut(dendrogram, 1.0));
    }

    @Test
    public void testHigherCutCoarsensLowerCut() {
        DistanceSet random = CompleteLinkageClusteringTests.randomDistances(new Random(23), 25, 30);
        Dendrogram tree = new CompleteLinkageClustering().build(random);
        List<FlatCluster> fine = cutter.cut(tree, 8.0);
        List<FlatCluster> coarse = cutter.cut(tree, 20.0);

        assertTrue(coarse.size() <= fine.size());
        for (FlatCluster small : fine) {
            long containing = coarse.stream().filter(big -> big.members().containsAll(small.members())).count();
            assertEquals(1, containing);
        }
    }

    @Test
    public void testMedoidExemplar() {
        TreeCutter medoidCutter = new TreeCutter(ExemplarPolicy.MEDOID, distances);
        List<FlatCluster> clusters = medoidCutter.cut(dendrogram, 2.0);

        assertEquals(ItemId.of(2), clusters.get(0).exemplar());
        assertEquals(ItemId.of(4), clusters.get(1).exemplar());
        assertEquals(ExemplarPolicy.MEDOID, medoidCutter.getExemplarPolicy());
    }

    @Test
    public void testMedoidTieKeepsSmallerId() {
        DistanceSet equal = DistanceSet
            .builder()
            .add(ItemId.of(1), ItemId.of(2), 1.0)
            .add(ItemId.of(1), ItemId.of(3), 1.0)
            .add(ItemId.of(2), ItemId.of(3), 1.0)
            .build();
        Dendrogram tree = new CompleteLinkageClustering().build(equal);

        assertEquals(ItemId.of(1), new TreeCutter(ExemplarPolicy.MEDOID, equal).cut(tree, null).get(0).exemplar());
    }

    @Test
    public void testMedoidNeedsDistances() {
        assertThrows(IllegalArgumentException.class, () -> new TreeCutter(ExemplarPolicy.MEDOID, null));
    }

    @Test
    public void testExemplarPolicyFromString() {
        assertEquals(ExemplarPolicy.MIN_ID, ExemplarPolicy.from("min_id"));
        assertEquals(ExemplarPolicy.MEDOID, ExemplarPolicy.from(" Medoid "));
        assertThrows(IllegalArgumentException.class, () -> ExemplarPolicy.from("centroid"));
    }
}
