package com.example.prr.service;

import com.example.prr.model.ComponentKind;
import com.example.prr.model.Dependency;
import com.example.prr.model.SinglePointOfFailure;
import com.example.prr.model.SystemComponent;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic graph algorithms over extracted architectures. No model involvement:
 * results depend only on the components and dependencies, in declaration order.
 */
@Service
public class GraphAnalyzer {

    /**
     * Result of critical-path enumeration.
     *
     * @param paths     paths found, in discovery order
     * @param truncated true if enumeration stopped at the configured cap
     */
    public record CriticalPaths(List<List<String>> paths, boolean truncated) {}

    // ── Single points of failure ────────────────────────────────────────────────

    /**
     * Finds the articulation points of the dependency graph treated as undirected (Tarjan),
     * i.e. components whose removal disconnects at least one other component.
     *
     * @return SPOFs in component declaration order, each with a description of what is cut off
     */
    public List<SinglePointOfFailure> findSinglePointsOfFailure(List<SystemComponent> components,
                                                                List<Dependency> dependencies) {
        int n = components.size();
        if (n < 3) {
            return List.of();
        }
        Map<String, Integer> index = indexOf(components);
        List<Set<Integer>> adjacency = undirectedAdjacency(n, index, dependencies);

        int[] discovery = new int[n];
        int[] low = new int[n];
        boolean[] articulation = new boolean[n];
        Arrays.fill(discovery, -1);
        int[] clock = {0};
        for (int root = 0; root < n; root++) {
            if (discovery[root] == -1) {
                tarjan(root, -1, adjacency, discovery, low, articulation, clock);
            }
        }

        List<SinglePointOfFailure> spofs = new ArrayList<>();
        for (int v = 0; v < n; v++) {
            if (articulation[v]) {
                spofs.add(new SinglePointOfFailure(components.get(v).name(),
                        describeImpact(v, components, adjacency)));
            }
        }
        return spofs;
    }

    private void tarjan(int u, int parent, List<Set<Integer>> adjacency, int[] discovery, int[] low,
                        boolean[] articulation, int[] clock) {
        discovery[u] = low[u] = clock[0]++;
        int children = 0;
        for (int v : adjacency.get(u)) {
            if (discovery[v] == -1) {
                children++;
                tarjan(v, u, adjacency, discovery, low, articulation, clock);
                low[u] = Math.min(low[u], low[v]);
                if (parent != -1 && low[v] >= discovery[u]) {
                    articulation[u] = true;
                }
            } else if (v != parent) {
                low[u] = Math.min(low[u], discovery[v]);
            }
        }
        if (parent == -1 && children > 1) {
            articulation[u] = true;
        }
    }

    /**
     * Describes what becomes unreachable when {@code removed} fails. The piece that keeps a
     * user-facing component (or, failing that, an external one, or else the largest piece)
     * is the reference side; everything in the other pieces is reported as cut off.
     */
    private String describeImpact(int removed, List<SystemComponent> components, List<Set<Integer>> adjacency) {
        List<List<Integer>> pieces = new ArrayList<>();
        boolean[] seen = new boolean[components.size()];
        seen[removed] = true;
        for (int start : adjacency.get(removed)) {
            if (seen[start]) {
                continue;
            }
            List<Integer> piece = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen[start] = true;
            while (!queue.isEmpty()) {
                int u = queue.poll();
                piece.add(u);
                for (int v : adjacency.get(u)) {
                    if (!seen[v]) {
                        seen[v] = true;
                        queue.add(v);
                    }
                }
            }
            piece.sort(Integer::compare);
            pieces.add(piece);
        }

        String name = components.get(removed).name();
        if (components.get(removed).kind() == ComponentKind.UI) {
            List<String> cutOff = pieces.stream().flatMap(List::stream).sorted().map(i -> components.get(i).name()).toList();
            return "Users lose their entry point; %d component(s) become unreachable through %s: %s"
                    .formatted(cutOff.size(), name, String.join(", ", cutOff));
        }

        List<Integer> anchor = pieces.stream()
                .filter(p -> containsKind(p, components, ComponentKind.UI))
                .findFirst()
                .or(() -> pieces.stream().filter(p -> containsKind(p, components, ComponentKind.EXTERNAL)).findFirst())
                .orElseGet(() -> pieces.stream().max((a, b) -> Integer.compare(a.size(), b.size())).orElseThrow());
        List<String> cutOff = pieces.stream()
                .filter(p -> p != anchor)
                .flatMap(List::stream)
                .sorted()
                .map(i -> components.get(i).name())
                .toList();
        List<String> anchorNames = anchor.stream()
                .filter(i -> components.get(i).kind() == ComponentKind.UI)
                .map(i -> components.get(i).name())
                .toList();
        String reference = anchorNames.isEmpty() ? "the rest of the system" : String.join(", ", anchorNames);
        return "Failure of %s cuts off %d component(s) from %s: %s"
                .formatted(name, cutOff.size(), reference, String.join(", ", cutOff));
    }

    // ── Critical paths ──────────────────────────────────────────────────────────

    /**
     * Enumerates simple directed paths from every ui component to every database component.
     * Paths are bounded by the component count (they are simple) and their number by {@code maxPaths}.
     */
    public CriticalPaths findCriticalPaths(List<SystemComponent> components, List<Dependency> dependencies,
                                           int maxPaths) {
        Map<String, Integer> index = indexOf(components);
        List<List<Integer>> outgoing = directedAdjacency(components.size(), index, dependencies);
        List<List<String>> paths = new ArrayList<>();
        boolean[] truncated = {false};

        for (int start = 0; start < components.size() && !truncated[0]; start++) {
            if (components.get(start).kind() != ComponentKind.UI) {
                continue;
            }
            Deque<Integer> path = new ArrayDeque<>();
            boolean[] onPath = new boolean[components.size()];
            path.addLast(start);
            onPath[start] = true;
            walk(start, outgoing, components, path, onPath, paths, maxPaths, truncated);
        }
        return new CriticalPaths(paths, truncated[0]);
    }

    private void walk(int u, List<List<Integer>> outgoing, List<SystemComponent> components, Deque<Integer> path,
                      boolean[] onPath, List<List<String>> paths, int maxPaths, boolean[] truncated) {
        for (int v : outgoing.get(u)) {
            if (truncated[0]) {
                return;
            }
            if (onPath[v] || path.size() >= components.size()) {
                continue;
            }
            path.addLast(v);
            onPath[v] = true;
            if (components.get(v).kind() == ComponentKind.DATABASE) {
                if (paths.size() >= maxPaths) {
                    truncated[0] = true;
                } else {
                    paths.add(path.stream().map(i -> components.get(i).name()).toList());
                }
            }
            walk(v, outgoing, components, path, onPath, paths, maxPaths, truncated);
            path.removeLast();
            onPath[v] = false;
        }
    }

    // ── Degree and reachability ─────────────────────────────────────────────────

    /** Number of incoming dependencies per component, in declaration order. */
    public Map<String, Integer> fanIn(List<SystemComponent> components, List<Dependency> dependencies) {
        Map<String, Integer> fanIn = new LinkedHashMap<>();
        components.forEach(c -> fanIn.put(c.name(), 0));
        for (Dependency d : dependencies) {
            fanIn.computeIfPresent(d.target(), (k, v) -> v + 1);
        }
        return fanIn;
    }

    /** Components that depend directly on {@code name}. */
    public List<String> directDependents(String name, List<Dependency> dependencies) {
        return dependencies.stream()
                .filter(d -> d.target().equals(name))
                .map(Dependency::source)
                .distinct()
                .toList();
    }

    /** Components that depend on {@code name} only through other components. */
    public List<String> transitiveDependents(String name, List<Dependency> dependencies) {
        Map<String, List<String>> incoming = dependencies.stream()
                .collect(Collectors.groupingBy(Dependency::target, LinkedHashMap::new,
                        Collectors.mapping(Dependency::source, Collectors.toList())));
        Set<String> direct = new LinkedHashSet<>(directDependents(name, dependencies));
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(direct);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String source : incoming.getOrDefault(current, List.of())) {
                if (!source.equals(name) && !direct.contains(source) && reached.add(source)) {
                    queue.add(source);
                }
            }
        }
        return List.copyOf(reached);
    }

    private static Map<String, Integer> indexOf(List<SystemComponent> components) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            index.putIfAbsent(components.get(i).name(), i);
        }
        return index;
    }

    private static List<Set<Integer>> undirectedAdjacency(int n, Map<String, Integer> index, List<Dependency> deps) {
        List<Set<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new LinkedHashSet<>());
        }
        for (Dependency d : deps) {
            Integer s = index.get(d.source());
            Integer t = index.get(d.target());
            if (s != null && t != null && !s.equals(t)) {
                adjacency.get(s).add(t);
                adjacency.get(t).add(s);
            }
        }
        return adjacency;
    }

    private static List<List<Integer>> directedAdjacency(int n, Map<String, Integer> index, List<Dependency> deps) {
        List<List<Integer>> outgoing = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            outgoing.add(new ArrayList<>());
        }
        for (Dependency d : deps) {
            Integer s = index.get(d.source());
            Integer t = index.get(d.target());
            if (s != null && t != null && !s.equals(t) && !outgoing.get(s).contains(t)) {
                outgoing.get(s).add(t);
            }
        }
        return outgoing;
    }

    private static boolean containsKind(List<Integer> piece, List<SystemComponent> components, ComponentKind kind) {
        return piece.stream().anyMatch(i -> components.get(i).kind() == kind);
    }
}
