package com.docgraph.core.crawler;

import com.docgraph.core.model.GraphEdge;
import com.docgraph.core.model.GraphNode;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.PageResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PageResult 흐름 → KnowledgeGraph.
 * 수명은 탐색 1회. finalizeGraph() 이후에는 어떤 변경도 허용하지 않는다.
 */
public final class GraphAssembler {

    private final String framework;
    private final String baseUrl;
    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private KnowledgeGraph finalized;

    public GraphAssembler(String framework, String baseUrl) {
        this.framework = Objects.requireNonNull(framework, "framework");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    /**
     * 성공한 fetch 결과로 노드 생성. 실패 결과는 no-op(false).
     * 같은 URL로 두 번 부르면 IllegalStateException(방문 집합 불변식 위반).
     */
    public synchronized boolean recordNode(String url, int depth, PageResult result) {
        ensureOpen();
        Objects.requireNonNull(url, "url");
        if (result == null || !result.isSucceeded()) return false;
        if (nodes.containsKey(url)) {
            throw new IllegalStateException("node already recorded: " + url);
        }
        nodes.put(url, GraphNode.of(url, depth, result.getTitle(), result.getStructured()));
        return true;
    }

    /** append-only. 같은 (from, to) 쌍의 중복 허용. */
    public synchronized void recordEdge(String fromUrl, String toUrl) {
        ensureOpen();
        edges.add(GraphEdge.references(fromUrl, toUrl));
    }

    /** 불변 스냅샷을 돌려주고 닫는다. 두 번째 호출은 같은 스냅샷. */
    public synchronized KnowledgeGraph finalizeGraph() {
        if (finalized == null) {
            finalized = new KnowledgeGraph(framework, baseUrl, nodes, edges, Instant.now());
        }
        return finalized;
    }

    public synchronized boolean isFinalized() { return finalized != null; }
    public synchronized int nodeCount() { return nodes.size(); }
    public synchronized int edgeCount() { return edges.size(); }

    private void ensureOpen() {
        if (finalized != null) throw new IllegalStateException("graph already finalized");
    }
}
