package io.flowc.core.project;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable in-memory view of a project: manifest data, region flows and referenced files.
///
/// Built once per compile call, by a {@link ProjectLoader} or programmatically through the
/// {@link Builder}, and never mutated afterwards.
///
/// ### Usage
/// {@snippet :
/// ProjectSnapshot project = ProjectSnapshot.builder()
///     .name("demo")
///     .region(new RegionFlow("main", "Main", 0, nodes, edges))
///     .prompt(ProjectFile.of("prompts/writer.md", "Write a haiku"))
///     .build();
/// }
///
/// @implNote Thread-safe: all collections are unmodifiable copies.
public final class ProjectSnapshot {

    /// Name used when the manifest does not provide one.
    public static final String DEFAULT_NAME = "Untitled";

    /// Version used when the manifest does not provide one.
    public static final String DEFAULT_VERSION = "3.0";

    private final Path path;
    private final String name;
    private final String version;
    private final List<RegionFlow> regions;
    private final Map<String, ProjectFile> prompts;
    private final Map<String, ProjectFile> tools;

    private ProjectSnapshot(Builder builder) {
        this.path = builder.path;
        this.name = builder.name != null ? builder.name : DEFAULT_NAME;
        this.version = builder.version != null ? builder.version : DEFAULT_VERSION;
        List<RegionFlow> sorted = new ArrayList<>(builder.regions);
        sorted.sort(
                (a, b) ->
                        a.order() != b.order()
                                ? Integer.compare(a.order(), b.order())
                                : a.id().compareTo(b.id()));
        this.regions = List.copyOf(sorted);
        this.prompts = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prompts));
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tools));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return project directory, may be null for in-memory projects
    public Path getPath() {
        return path;
    }

    /// @return project name, never null
    public String getName() {
        return name;
    }

    /// @return project version, never null
    public String getVersion() {
        return version;
    }

    /// Returns the regions ordered by `order`, then id.
    ///
    /// @return unmodifiable list, never null
    public List<RegionFlow> getRegions() {
        return regions;
    }

    /// @return prompt and context files keyed by declared path, never null
    public Map<String, ProjectFile> getPrompts() {
        return prompts;
    }

    /// @return tool files keyed by declared path, never null
    public Map<String, ProjectFile> getTools() {
        return tools;
    }

    /// Looks up a prompt or context file by the path declared in node data.
    ///
    /// @param declaredPath the declared path, not null
    /// @return the file if loaded, empty otherwise
    public Optional<ProjectFile> prompt(String declaredPath) {
        return Optional.ofNullable(prompts.get(declaredPath));
    }

    /// Looks up a tool file by the path declared in node data.
    ///
    /// @param declaredPath the declared path, not null
    /// @return the file if loaded, empty otherwise
    public Optional<ProjectFile> tool(String declaredPath) {
        return Optional.ofNullable(tools.get(declaredPath));
    }

    /// Looks up a region by id.
    ///
    /// @param regionId region id, not null
    /// @return the region if present, empty otherwise
    public Optional<RegionFlow> region(String regionId) {
        return regions.stream().filter(r -> r.id().equals(regionId)).findFirst();
    }

    public static final class Builder {
        private Path path;
        private String name;
        private String version;
        private final List<RegionFlow> regions = new ArrayList<>();
        private final Map<String, ProjectFile> prompts = new LinkedHashMap<>();
        private final Map<String, ProjectFile> tools = new LinkedHashMap<>();

        private Builder() {}

        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder region(RegionFlow region) {
            regions.add(Objects.requireNonNull(region, "region must not be null"));
            return this;
        }

        public Builder regions(List<RegionFlow> regions) {
            regions.forEach(this::region);
            return this;
        }

        public Builder prompt(ProjectFile file) {
            Objects.requireNonNull(file, "file must not be null");
            prompts.put(file.declaredPath(), file);
            return this;
        }

        public Builder tool(ProjectFile file) {
            Objects.requireNonNull(file, "file must not be null");
            tools.put(file.declaredPath(), file);
            return this;
        }

        public ProjectSnapshot build() {
            return new ProjectSnapshot(this);
        }
    }
}
