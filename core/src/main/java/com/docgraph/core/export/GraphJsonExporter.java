package com.docgraph.core.export;

import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 지식 그래프 → JSON 파일({@code <slug>-graph.json}).
 * 출력 형식은 저장소 파일과 같아서 그대로 다시 읽을 수 있다.
 */
public class GraphJsonExporter {

    private static final Logger LOG = LoggerFactory.getLogger(GraphJsonExporter.class);

    private final ObjectMapper om = Jsons.mapper();

    public String toJson(KnowledgeGraph graph) {
        Objects.requireNonNull(graph, "graph");
        try {
            return om.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("graph serialization failed", e);
        }
    }

    public Path export(Path baseDir, KnowledgeGraph graph) throws IOException {
        Objects.requireNonNull(graph, "graph");
        Path dir = (baseDir == null ? Path.of("out") : baseDir);
        Files.createDirectories(dir);
        Path out = dir.resolve(GraphNaming.fileName(graph.framework()));
        Files.writeString(out, toJson(graph), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        LOG.info("Graph exported: {} ({} nodes, {} edges)", out, graph.nodeCount(), graph.edgeCount());
        return out;
    }
}
