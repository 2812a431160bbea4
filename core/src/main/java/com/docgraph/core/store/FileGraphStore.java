package com.docgraph.core.store;

import com.docgraph.core.api.IGraphStore;
import com.docgraph.core.export.GraphNaming;
import com.docgraph.core.model.KnowledgeGraph;
import com.docgraph.core.util.Jsons;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 디렉터리 기반 그래프 저장소: 프레임워크당 {@code <slug>-graph.json} 한 파일.
 * 쓰기는 임시 파일에 다 쓴 뒤 원자적 이동으로 교체한다 → 읽는 쪽은 이전 것 아니면 새 것만 본다.
 * 서로 다른 이름이 같은 slug가 될 수 있으므로("My Lib", "my-lib") load는 파일 안의 framework 이름까지 맞아야 돌려준다.
 */
public final class FileGraphStore implements IGraphStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileGraphStore.class);

    private final Path dir;
    private final ObjectMapper om = Jsons.mapper();

    public FileGraphStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public Path dir() { return dir; }

    Path fileFor(String framework) {
        return dir.resolve(GraphNaming.fileName(framework));
    }

    @Override
    public synchronized void save(KnowledgeGraph graph) throws GraphStoreException {
        Objects.requireNonNull(graph, "graph");
        Path target = fileFor(graph.framework());
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, GraphNaming.slug(graph.framework()) + "-", ".tmp");
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                om.writeValue(w, graph);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("atomic move not supported in {}, falling back to replace", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.info("Graph saved: {} ({} nodes, {} edges)", target, graph.nodeCount(), graph.edgeCount());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new GraphStoreException("failed to save graph '" + graph.framework() + "' to " + target, e);
        }
    }

    @Override
    public synchronized Optional<KnowledgeGraph> load(String framework) throws GraphStoreException {
        Objects.requireNonNull(framework, "framework");
        Path f = fileFor(framework);
        if (!Files.isRegularFile(f)) {
            LOG.debug("no stored graph for '{}' at {}", framework, f);
            return Optional.empty();
        }
        KnowledgeGraph g = read(f);
        if (!framework.equals(g.framework())) {
            LOG.warn("graph file {} belongs to '{}', not '{}'", f, g.framework(), framework);
            return Optional.empty();
        }
        return Optional.of(g);
    }

    @Override
    public synchronized Optional<KnowledgeGraph> latest() throws GraphStoreException {
        return all().stream().max(Comparator.comparing(KnowledgeGraph::createdAt));
    }

    @Override
    public synchronized List<String> frameworks() throws GraphStoreException {
        List<String> out = new ArrayList<>();
        for (KnowledgeGraph g : all()) out.add(g.framework());
        out.sort(Comparator.naturalOrder());
        return out;
    }

    private List<KnowledgeGraph> all() throws GraphStoreException {
        List<KnowledgeGraph> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + GraphNaming.GRAPH_SUFFIX)) {
            for (Path p : ds) out.add(read(p));
        } catch (IOException e) {
            throw new GraphStoreException("failed to list graphs in " + dir, e);
        }
        return out;
    }

    private KnowledgeGraph read(Path f) throws GraphStoreException {
        try {
            return om.readValue(f.toFile(), KnowledgeGraph.class);
        } catch (IOException e) {
            throw new GraphStoreException("failed to read graph file " + f, e);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.warn("could not delete temp file {}: {}", p, e.toString());
        }
    }
}
