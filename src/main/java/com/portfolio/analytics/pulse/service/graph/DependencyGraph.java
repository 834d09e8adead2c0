package com.portfolio.analytics.pulse.service.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Directed dependency graph between projects, keyed by project name.
 * An edge A -> B means "A depends on B": if B slips, A is affected.
 *
 * Built once per portfolio snapshot by {@link DependencyGraphBuilder} and read-only afterwards.
 * Iteration order is sorted everywhere so traversals and cycle reports are reproducible.
 */
public final class DependencyGraph {

    private final SortedSet<String> allProjects;
    private final Map<String, SortedSet<String>> edges;

    private DependencyGraph(SortedSet<String> allProjects, Map<String, SortedSet<String>> edges) {
        this.allProjects = Collections.unmodifiableSortedSet(allProjects);
        Map<String, SortedSet<String>> frozen = new TreeMap<>();
        edges.forEach((project, deps) -> frozen.put(project, Collections.unmodifiableSortedSet(deps)));
        this.edges = Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> getAllProjects() {
        return allProjects;
    }

    public Map<String, SortedSet<String>> getEdges() {
        return edges;
    }

    public int edgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Projects {@code project} depends on directly.
     */
    public SortedSet<String> dependencies(String project) {
        return edges.getOrDefault(project, Collections.emptySortedSet());
    }

    /**
     * Projects that depend directly on {@code project}.
     */
    public SortedSet<String> dependents(String project) {
        SortedSet<String> dependents = new TreeSet<>();
        edges.forEach((source, targets) -> {
            if (targets.contains(project)) {
                dependents.add(source);
            }
        });
        return dependents;
    }

    /**
     * Everything downstream of {@code project}: the projects affected if it slips.
     */
    public SortedSet<String> allDependents(String project) {
        return breadthFirst(project, this::dependents);
    }

    /**
     * Everything upstream of {@code project}.
     */
    public SortedSet<String> allDependencies(String project) {
        return breadthFirst(project, this::dependencies);
    }

    private SortedSet<String> breadthFirst(String start, Function<String, Set<String>> next) {
        SortedSet<String> visited = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String neighbour : next.apply(current)) {
                if (!neighbour.equals(start) && visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }

    /**
     * Three-colour DFS over all known projects in sorted order.
     *
     * @return the first cycle found, closed by repeating its first project
     *         (e.g. [A, B, C, A]), or empty when the graph is acyclic
     */
    public Optional<List<String>> detectCycle() {
        Map<String, Colour> colour = new TreeMap<>();
        allProjects.forEach(p -> colour.put(p, Colour.WHITE));
        List<String> path = new ArrayList<>();

        for (String project : allProjects) {
            if (colour.get(project) == Colour.WHITE) {
                List<String> cycle = visit(project, colour, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String node, Map<String, Colour> colour, List<String> path) {
        colour.put(node, Colour.GREY);
        path.add(node);

        for (String dep : dependencies(node)) {
            Colour state = colour.get(dep);
            if (state == null) {
                continue; // edge to a name outside the portfolio
            }
            if (state == Colour.GREY) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                return cycle;
            }
            if (state == Colour.WHITE) {
                List<String> cycle = visit(dep, colour, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.remove(path.size() - 1);
        colour.put(node, Colour.BLACK);
        return null;
    }

    /**
     * Plain nested structure for the reporting layer.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("projects", new ArrayList<>(allProjects));
        Map<String, List<String>> edgeMap = new LinkedHashMap<>();
        edges.forEach((source, targets) -> edgeMap.put(source, new ArrayList<>(targets)));
        map.put("edges", edgeMap);
        return map;
    }

    @Override
    public String toString() {
        return "DependencyGraph{projects=" + allProjects.size() + ", edges=" + edges + "}";
    }

    private enum Colour {
        WHITE, GREY, BLACK
    }

    public static final class Builder {

        private final SortedSet<String> allProjects = new TreeSet<>();
        private final Map<String, SortedSet<String>> edges = new TreeMap<>();

        private Builder() {
        }

        public Builder project(String name) {
            allProjects.add(name);
            return this;
        }

        public Builder projects(Iterable<String> names) {
            names.forEach(allProjects::add);
            return this;
        }

        /**
         * Records that {@code project} depends on {@code dependsOn}.
         */
        public Builder dependency(String project, String dependsOn) {
            edges.computeIfAbsent(project, k -> new TreeSet<>()).add(dependsOn);
            return this;
        }

        public DependencyGraph build() {
            Map<String, SortedSet<String>> copy = new TreeMap<>();
            edges.forEach((k, v) -> copy.put(k, new TreeSet<>(v)));
            return new DependencyGraph(new TreeSet<>(allProjects), copy);
        }
    }
}
