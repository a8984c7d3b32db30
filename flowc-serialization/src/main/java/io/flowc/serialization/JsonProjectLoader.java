package io.flowc.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.exception.PromptLoadException;
import io.flowc.core.exception.ToolLoadException;
import io.flowc.core.project.ProjectFile;
import io.flowc.core.project.ProjectLoader;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.project.RawEdge;
import io.flowc.core.project.RawNode;
import io.flowc.core.project.RegionFlow;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Reads a project directory laid out as JSON documents into a {@link ProjectSnapshot}.
///
/// ### Layout
/// ```
/// <project>/
///   manifest.json        {name?, version?, tabs: [{id, name?, order?, flow?}]}
///   flows/<tab id>.json  {nodes: [...], edges: [...]}   (default location of a tab's flow)
///   prompts/             fallback directory for prompt files
///   static/              fallback directory for context files
///   tools/               fallback directory for tool files
/// ```
///
/// A manifest that holds top-level `nodes` and `edges` is read in the single-document layout
/// instead: each node names its tab in `data.tabId`, and an edge belongs to a tab when both
/// endpoints do.
///
/// ### Records
/// Nodes are `{id, type, position: {x, y}, data: {...}}`; edges are `{id, source, target,
/// sourceHandle?, targetHandle?}`.
///
/// ### Referenced files
/// `custom` nodes with unit `prompt` or `context` and a `file` attribute are read as prompts,
/// unit `tool` with `file` as tools. A declared path is tried relative to the project first,
/// then inside the fallback directory. Each path is read once. A path that leaves the project
/// directory or cannot be read fails the load.
///
/// @implNote Thread-safe. Holds only its options and a shared `ObjectMapper`; every call
/// builds a new snapshot.
public final class JsonProjectLoader implements ProjectLoader {

    private static final Logger logger = Logger.getLogger(JsonProjectLoader.class.getName());

    static final String MANIFEST = "manifest.json";
    static final String FLOWS_DIR = "flows";
    static final String PROMPTS_DIR = "prompts";
    static final String STATIC_DIR = "static";
    static final String TOOLS_DIR = "tools";

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final boolean loadPrompts;
    private final boolean loadTools;

    /// Creates a loader that reads prompt and tool files.
    public JsonProjectLoader() {
        this(true, true);
    }

    /// @param loadPrompts whether prompt and context files are read
    /// @param loadTools whether tool files are read
    public JsonProjectLoader(boolean loadPrompts, boolean loadTools) {
        this.mapper = new ObjectMapper();
        this.loadPrompts = loadPrompts;
        this.loadTools = loadTools;
    }

    @Override
    public ProjectSnapshot load(Path projectPath) throws CompilationException {
        Path root = projectPath.toAbsolutePath().normalize();
        logger.fine(() -> "Loading project " + root);
        if (!Files.exists(root)) {
            throw new CompilationException(
                    "Project path does not exist: " + root, ErrorLocation.file(root.toString()));
        }
        if (!Files.isDirectory(root)) {
            throw new CompilationException(
                    "Project path is not a directory: " + root,
                    ErrorLocation.file(root.toString()));
        }

        Path manifestPath = root.resolve(MANIFEST);
        if (!Files.isRegularFile(manifestPath)) {
            throw new CompilationException(
                    "No " + MANIFEST + " found in project: " + root,
                    ErrorLocation.file(manifestPath.toString()));
        }
        JsonNode manifest = readJson(manifestPath);
        List<RegionFlow> regions = readRegions(root, manifest, manifestPath);

        ProjectSnapshot.Builder builder =
                ProjectSnapshot.builder()
                        .path(root)
                        .name(text(manifest, "name"))
                        .version(text(manifest, "version"))
                        .regions(regions);
        if (loadPrompts || loadTools) {
            readReferencedFiles(root, regions, builder);
        }
        ProjectSnapshot snapshot = builder.build();

        logger.info(
                "Loaded project '"
                        + snapshot.getName()
                        + "': "
                        + snapshot.getRegions().size()
                        + " tabs, "
                        + snapshot.getPrompts().size()
                        + " prompts, "
                        + snapshot.getTools().size()
                        + " tools");
        return snapshot;
    }

    // === Manifest and flows ===

    private List<RegionFlow> readRegions(Path root, JsonNode manifest, Path manifestPath)
            throws CompilationException {
        JsonNode tabs = manifest.path("tabs");
        if (!tabs.isArray() || tabs.isEmpty()) {
            throw new CompilationException(
                    "No tabs defined in " + MANIFEST, ErrorLocation.file(manifestPath.toString()));
        }
        boolean singleDocument = manifest.has("nodes");

        List<RegionFlow> regions = new ArrayList<>();
        for (JsonNode tab : tabs) {
            String id = text(tab, "id");
            if (id == null) {
                logger.warning("Skipping tab without id in " + manifestPath);
                continue;
            }
            String name = text(tab, "name");
            int order = tab.path("order").asInt(0);
            if (singleDocument) {
                regions.add(embeddedRegion(manifest, id, name, order, manifestPath));
            } else {
                String flow = text(tab, "flow");
                String declared = flow != null ? flow : FLOWS_DIR + "/" + id + ".json";
                Path flowPath = resolveInside(root, declared);
                if (flowPath == null || !Files.isRegularFile(flowPath)) {
                    throw new CompilationException(
                            "Flow document of tab '" + id + "' not found",
                            new ErrorLocation(id, null, declared, null));
                }
                JsonNode document = readJson(flowPath);
                regions.add(
                        new RegionFlow(
                                id,
                                name,
                                order,
                                nodes(document.path("nodes"), id, flowPath),
                                edges(document.path("edges"), id, flowPath, null)));
            }
        }
        return regions;
    }

    private RegionFlow embeddedRegion(
            JsonNode manifest, String tabId, String name, int order, Path manifestPath)
            throws CompilationException {
        List<JsonNode> tabNodes = new ArrayList<>();
        for (JsonNode node : manifest.path("nodes")) {
            if (tabId.equals(node.path("data").path("tabId").asText(null))) {
                tabNodes.add(node);
            }
        }
        List<RawNode> nodes = nodes(tabNodes, tabId, manifestPath);
        List<String> ids = nodes.stream().map(RawNode::id).toList();
        return new RegionFlow(
                tabId,
                name,
                order,
                nodes,
                edges(manifest.path("edges"), tabId, manifestPath, ids));
    }

    private List<RawNode> nodes(Iterable<JsonNode> array, String tabId, Path file)
            throws CompilationException {
        List<RawNode> nodes = new ArrayList<>();
        int index = 0;
        for (JsonNode node : array) {
            String id = text(node, "id");
            if (id == null) {
                throw recordError("Node #" + index + " has no id", tabId, file);
            }
            JsonNode position = node.path("position");
            Map<String, Object> data =
                    node.path("data").isObject()
                            ? mapper.convertValue(node.get("data"), OBJECT_MAP)
                            : Map.of();
            nodes.add(
                    new RawNode(
                            id,
                            text(node, "type"),
                            position.path("x").asDouble(0),
                            position.path("y").asDouble(0),
                            data));
            index++;
        }
        return nodes;
    }

    /// Reads edge records; with `nodeIds` set, keeps only edges whose endpoints are all listed.
    private List<RawEdge> edges(JsonNode array, String tabId, Path file, List<String> nodeIds)
            throws CompilationException {
        List<RawEdge> edges = new ArrayList<>();
        int index = 0;
        for (JsonNode edge : array) {
            String id = text(edge, "id");
            String source = text(edge, "source");
            String target = text(edge, "target");
            if (nodeIds != null && !(nodeIds.contains(source) && nodeIds.contains(target))) {
                index++;
                continue;
            }
            if (id == null || source == null || target == null) {
                throw recordError(
                        "Edge #" + index + " must have id, source and target", tabId, file);
            }
            edges.add(
                    new RawEdge(
                            id,
                            source,
                            target,
                            text(edge, "sourceHandle"),
                            text(edge, "targetHandle")));
            index++;
        }
        return edges;
    }

    private JsonNode readJson(Path file) throws CompilationException {
        try {
            return mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            Integer line =
                    e.getLocation() != null && e.getLocation().getLineNr() > 0
                            ? e.getLocation().getLineNr()
                            : null;
            throw new CompilationException(
                    "Invalid JSON in " + file.getFileName() + ": " + e.getOriginalMessage(),
                    ErrorLocation.file(file.toString()).withLine(line),
                    e);
        } catch (IOException e) {
            throw new CompilationException(
                    "Cannot read " + file + ": " + e.getMessage(),
                    ErrorLocation.file(file.toString()),
                    e);
        }
    }

    // === Referenced files ===

    private void readReferencedFiles(
            Path root, List<RegionFlow> regions, ProjectSnapshot.Builder builder)
            throws CompilationException {
        Map<String, ProjectFile> prompts = new LinkedHashMap<>();
        Map<String, ProjectFile> tools = new LinkedHashMap<>();
        for (RegionFlow region : regions) {
            for (RawNode node : region.nodes()) {
                if (!"custom".equals(node.type())) {
                    continue;
                }
                Object unit = node.data().get("unit");
                Object file = node.data().get("file");
                if (!(file instanceof String path) || path.isBlank()) {
                    continue;
                }
                if (loadPrompts && ("prompt".equals(unit) || "context".equals(unit))) {
                    if (!prompts.containsKey(path)) {
                        String fallback = "context".equals(unit) ? STATIC_DIR : PROMPTS_DIR;
                        prompts.put(path, readPrompt(root, path, fallback, region.id(), node));
                    }
                } else if (loadTools && "tool".equals(unit) && !tools.containsKey(path)) {
                    tools.put(path, readTool(root, path, region.id(), node));
                }
            }
        }
        prompts.values().forEach(builder::prompt);
        tools.values().forEach(builder::tool);
    }

    private ProjectFile readPrompt(
            Path root, String declared, String fallbackDir, String regionId, RawNode node)
            throws PromptLoadException {
        ErrorLocation location = new ErrorLocation(regionId, node.id(), declared, null);
        Path file = locate(root, declared, fallbackDir);
        if (file == null) {
            throw new PromptLoadException(
                    "Prompt path escapes project directory: " + declared, location);
        }
        if (!Files.isRegularFile(file)) {
            throw new PromptLoadException("Prompt file not found: " + declared, location);
        }
        try {
            return new ProjectFile(
                    declared, null, file, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PromptLoadException(
                    "Failed to read prompt file: " + e.getMessage(), location, e);
        }
    }

    private ProjectFile readTool(Path root, String declared, String regionId, RawNode node)
            throws ToolLoadException {
        ErrorLocation location = new ErrorLocation(regionId, node.id(), declared, null);
        Path file = locate(root, declared, TOOLS_DIR);
        if (file == null) {
            throw new ToolLoadException(
                    "Tool path escapes project directory: " + declared, location);
        }
        if (!Files.isRegularFile(file)) {
            throw new ToolLoadException("Tool file not found: " + declared, location);
        }
        try {
            return new ProjectFile(
                    declared, null, file, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ToolLoadException("Failed to read tool file: " + e.getMessage(), location, e);
        }
    }

    /// Resolves a declared path, trying the fallback directory when the direct path is missing.
    ///
    /// @return existing or best-guess path inside `root`, null if either candidate escapes it
    private static Path locate(Path root, String declared, String fallbackDir) {
        Path direct = resolveInside(root, declared);
        if (direct == null) {
            return null;
        }
        if (Files.exists(direct)) {
            return direct;
        }
        return resolveInside(root, fallbackDir + "/" + declared);
    }

    private static Path resolveInside(Path root, String relative) {
        Path resolved = root.resolve(relative).normalize();
        return resolved.startsWith(root) ? resolved : null;
    }

    private static CompilationException recordError(String message, String tabId, Path file) {
        return new CompilationException(
                message + " in tab '" + tabId + "'",
                new ErrorLocation(tabId, null, file.toString(), null));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
