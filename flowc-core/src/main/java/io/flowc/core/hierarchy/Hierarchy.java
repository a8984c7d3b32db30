package io.flowc.core.hierarchy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Output of {@link HierarchyBuilder}.
///
/// @param roots root construct per region, in region order, not null
/// @param loopBodies body node ids of each loop construct that was built from a well-formed
///     body, keyed by marker id, not null
/// @param issues structural problems in detection order, not null
public record Hierarchy(
        Map<String, HierarchyNode> roots,
        Map<String, Set<String>> loopBodies,
        List<StructuralIssue> issues) {

    public Hierarchy {
        roots = Collections.unmodifiableMap(new LinkedHashMap<>(roots));
        loopBodies = Collections.unmodifiableMap(new LinkedHashMap<>(loopBodies));
        issues = List.copyOf(issues);
    }

    /// @return agent node ids of every leaf across all roots, in region then tree order
    public List<String> leafIds() {
        List<String> ids = new ArrayList<>();
        roots.values().forEach(r -> ids.addAll(r.leafIds()));
        return ids;
    }
}
