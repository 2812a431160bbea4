package com.docgraph.core.api;

import com.docgraph.core.model.DocumentResponse;
import com.docgraph.core.model.GraphCatalog;
import com.docgraph.core.model.GraphResponse;

import java.util.List;

/** 호출 계층(전송/CLI 배선)이 코어로 들어오는 입구. 예외 대신 success 플래그로 응답한다. */
public interface IKnowledgeGraphTools {

    DocumentResponse crawlDocumentation(String url, String extractType);

    GraphResponse extendKnowledgeGraph(String framework, String baseUrl, int depth, List<String> patterns);

    default GraphResponse extendKnowledgeGraph(String framework, String baseUrl) {
        return extendKnowledgeGraph(framework, baseUrl, 2, null);
    }

    GraphResponse getKnowledgeGraph();

    GraphResponse getKnowledgeGraph(String framework);

    GraphCatalog catalog();
}
