package io.flowc.core;

import io.flowc.core.project.ProjectFile;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.project.RawEdge;
import io.flowc.core.project.RawNode;
import io.flowc.core.project.RegionFlow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Fluent builder for in-memory projects used across the core tests.
///
/// Nodes are laid out top to bottom in declaration order (`y = 100 * index`, `x = 0`) unless
/// placed explicitly with {@link #at}. Edge ids are generated.
public final class TestProjects {

    private final String name;
    private final List<Region> regions = new ArrayList<>();
    private final List<ProjectFile> prompts = new ArrayList<>();
    private final List<ProjectFile> tools = new ArrayList<>();
    private Region current;
    private int edgeCounter;

    private TestProjects(String name) {
        this.name = name;
    }

    /// Starts a project whose first region is `main`.
    public static TestProjects project() {
        return project("test-project").region("main");
    }

    public static TestProjects project(String name) {
        return new TestProjects(name);
    }

    public TestProjects region(String id) {
        current = new Region(id, regions.size());
        regions.add(current);
        return this;
    }

    public TestProjects node(String id, String type, Map<String, Object> data) {
        current.nodes.put(id, new double[] {0, 100 * current.nodes.size()});
        current.data.put(id, data);
        current.types.put(id, type);
        return this;
    }

    public TestProjects start(String id) {
        return node(id, "start", Map.of());
    }

    public TestProjects end(String id) {
        return node(id, "end", Map.of());
    }

    public TestProjects agent(String id) {
        return agent(id, Map.of());
    }

    public TestProjects agent(String id, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", id);
        data.putAll(extra);
        return node(id, "agent", data);
    }

    public TestProjects loop(String id) {
        return node(id, "loop", Map.of("name", id));
    }

    public TestProjects loop(String id, int maxIterations) {
        return node(id, "loop", Map.of("name", id, "max_iterations", maxIterations));
    }

    public TestProjects join(String id) {
        return node(id, "parallel-join", Map.of());
    }

    public TestProjects teleporterOut(String id, String channel) {
        return node(id, "teleporter-out", Map.of("channel", channel));
    }

    public TestProjects teleporterIn(String id, String channel) {
        return node(id, "teleporter-in", Map.of("channel", channel));
    }

    public TestProjects variable(String id, String variableName, String value) {
        return node(id, "variable", Map.of("name", variableName, "value", value));
    }

    public TestProjects userInput(String id, boolean trigger) {
        return node(id, "user-input", Map.of("name", id, "trigger", trigger));
    }

    public TestProjects custom(String id, String unit, Map<String, Object> attributes) {
        Map<String, Object> data = new LinkedHashMap<>(attributes);
        data.put("unit", unit);
        return node(id, "custom", data);
    }

    /// Moves a node of the current region.
    public TestProjects at(String id, double x, double y) {
        current.nodes.put(id, new double[] {x, y});
        return this;
    }

    public TestProjects edge(String source, String target) {
        return edge(source, null, target, null);
    }

    public TestProjects edge(String source, String sourcePort, String target, String targetPort) {
        current.edges.add(
                new RawEdge("e" + (++edgeCounter), source, target, sourcePort, targetPort));
        return this;
    }

    /// Chains control edges through the given nodes.
    public TestProjects chain(String... ids) {
        for (int i = 1; i < ids.length; i++) {
            edge(ids[i - 1], ids[i]);
        }
        return this;
    }

    public TestProjects prompt(String path, String content) {
        prompts.add(ProjectFile.of(path, content));
        return this;
    }

    public TestProjects tool(String path, String content) {
        tools.add(ProjectFile.of(path, content));
        return this;
    }

    public ProjectSnapshot build() {
        ProjectSnapshot.Builder builder = ProjectSnapshot.builder().name(name).version("1.0");
        for (Region region : regions) {
            List<RawNode> nodes = new ArrayList<>();
            region.nodes.forEach(
                    (id, position) ->
                            nodes.add(
                                    new RawNode(
                                            id,
                                            region.types.get(id),
                                            position[0],
                                            position[1],
                                            region.data.get(id))));
            builder.region(new RegionFlow(region.id, region.id, region.order, nodes, region.edges));
        }
        prompts.forEach(builder::prompt);
        tools.forEach(builder::tool);
        return builder.build();
    }

    private static final class Region {
        private final String id;
        private final int order;
        private final Map<String, double[]> nodes = new LinkedHashMap<>();
        private final Map<String, String> types = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> data = new LinkedHashMap<>();
        private final List<RawEdge> edges = new ArrayList<>();

        Region(String id, int order) {
            this.id = id;
            this.order = order;
        }
    }
}
