package com.docgraph.core.store;

import com.docgraph.core.api.IGraphStore;
import com.docgraph.core.model.KnowledgeGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** 프로세스 메모리 저장소(저장 비활성/테스트용). 프레임워크당 최신 그래프 1개. */
public final class InMemoryGraphStore implements IGraphStore {

    private final Map<String, KnowledgeGraph> graphs = new TreeMap<>();

    @Override
    public synchronized void save(KnowledgeGraph graph) {
        Objects.requireNonNull(graph, "graph");
        graphs.put(graph.framework(), graph);
    }

    @Override
    public synchronized Optional<KnowledgeGraph> load(String framework) {
        return Optional.ofNullable(graphs.get(framework));
    }

    @Override
    public synchronized Optional<KnowledgeGraph> latest() {
        return graphs.values().stream().max(Comparator.comparing(KnowledgeGraph::createdAt));
    }

    @Override
    public synchronized List<String> frameworks() {
        return new ArrayList<>(graphs.keySet());
    }
}
