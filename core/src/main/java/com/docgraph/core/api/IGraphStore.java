package com.docgraph.core.api;

import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.store.GraphStoreException;

import java.util.List;
import java.util.Optional;

/**
 * 지식 그래프 영속 저장소.
 * 저장은 그래프 단위 통째 교체만 허용(필드 단위 부분 쓰기가 독자에게 보이면 안 됨).
 */
public interface IGraphStore {
    void save(KnowledgeGraph graph) throws GraphStoreException;

    Optional<KnowledgeGraph> load(String framework) throws GraphStoreException;

    /** 가장 최근 저장된 그래프 */
    Optional<KnowledgeGraph> latest() throws GraphStoreException;

    List<String> frameworks() throws GraphStoreException;
}
