/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.dataxform.common.Tool;
import org.dataxform.common.TransformSettings;
import org.dataxform.storage.RelationStore;
import org.dataxform.tools.AnonymizeTool;
import org.dataxform.tools.DeanonymizeTool;
import org.dataxform.tools.HierarchicalClusteringTool;
import org.dataxform.tools.TreeCutTool;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Entry point wiring every tool factory to a relation store and the transform settings.
 */
@Log4j2
public class TransformPlugin implements Closeable {

    public static final String CLUSTERING_THREAD_POOL_PREFIX = "dataxform-clustering";

    @Getter
    private final TransformSettings settings;
    private final RelationStore store;
    private final ExecutorService clusteringExecutor;

    public TransformPlugin(RelationStore store) {
        this(store, TransformSettings.defaults());
    }

    public TransformPlugin(RelationStore store, TransformSettings settings) {
        this.settings = settings;
        this.store = store;
        int parallelism = settings.getInt(TransformSettings.CLUSTERING_PARALLELISM);
        if (parallelism > 1) {
            this.clusteringExecutor = Executors
                .newFixedThreadPool(
                    parallelism,
                    new ThreadFactoryBuilder().setNameFormat(CLUSTERING_THREAD_POOL_PREFIX + "-%d").setDaemon(true).build()
                );
        } else {
            this.clusteringExecutor = null;
        }
        HierarchicalClusteringTool.Factory.getInstance().init(store, settings, clusteringExecutor);
        TreeCutTool.Factory.getInstance().init(store);
        AnonymizeTool.Factory.getInstance().init(store, settings);
        DeanonymizeTool.Factory.getInstance().init(store);
        log.info("Initialized transform tools, clustering parallelism {}", parallelism);
    }

    public List<Tool.Factory<? extends Tool>> getToolFactories() {
        return List
            .of(
                HierarchicalClusteringTool.Factory.getInstance(),
                TreeCutTool.Factory.getInstance(),
                AnonymizeTool.Factory.getInstance(),
                DeanonymizeTool.Factory.getInstance()
            );
    }

    /**
     * Create a tool by type
     * @param type tool type, e.g. {@value HierarchicalClusteringTool#TYPE}
     * @param params creation parameters handed to the factory
     * @return the tool, empty for an unknown type
     */
    public Optional<Tool> createTool(String type, Map<String, Object> params) {
        for (Tool.Factory<? extends Tool> factory : getToolFactories()) {
            if (factory.getDefaultType().equals(type)) {
                return Optional.of(factory.create(params));
            }
        }
        return Optional.empty();
    }

    /**
     * Shuts the clustering pool down. Clustering tools created afterwards build serially; tools created before keep
     * the closed pool and must not be run again.
     */
    @Override
    public void close() {
        if (clusteringExecutor != null) {
            HierarchicalClusteringTool.Factory.getInstance().init(store, settings, null);
            clusteringExecutor.shutdown();
            log.info("Closed the clustering pool, later clustering tools build serially");
        }
    }
}
