package com.docgraph.core.crawler;

import com.docgraph.core.model.CrawlStats;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.model.PageFailure;

import java.util.List;

/**
 * 탐색 1회의 결과.
 * @param frontierLeft 소비되지 못하고 남은 frontier 항목 수(bound/취소로 끝났을 때 > 0 가능)
 */
public record TraversalOutcome(
        KnowledgeGraph graph,
        List<PageFailure> failures,
        CrawlStats.Snapshot stats,
        boolean cancelled,
        int frontierLeft
) {
    public TraversalOutcome {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
