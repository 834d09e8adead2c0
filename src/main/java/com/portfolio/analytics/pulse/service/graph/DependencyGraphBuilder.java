package com.portfolio.analytics.pulse.service.graph;

import com.portfolio.analytics.pulse.model.Project;
import com.portfolio.analytics.pulse.model.Task;
import com.portfolio.analytics.pulse.util.CommentScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the project dependency graph from task comments.
 *
 * For every occurrence of a dependency keyword, the text that follows it is searched for
 * the name of another project in the portfolio; a hit within the first
 * {@link CommentScanner#CONTEXT_LIMIT} characters adds an edge from the owning project to the
 * mentioned one.
 */
@Service
@Slf4j
public class DependencyGraphBuilder {

    static final List<String> CROSS_PROJECT_KEYWORDS = List.of(
            "depends on",
            "dependent on",
            "blocked by",
            "waiting for",
            "waiting on",
            "requires",
            "contingent on",
            "prerequisite"
    );

    public DependencyGraph build(List<Project> projects) {
        DependencyGraph.Builder graph = DependencyGraph.builder();

        // lowercase name -> original name, sorted for reproducible matching
        Map<String, String> nameLookup = new LinkedHashMap<>();
        projects.stream()
                .map(Project::getName)
                .sorted()
                .forEach(name -> {
                    graph.project(name);
                    nameLookup.put(name.toLowerCase(Locale.ROOT), name);
                });

        for (Project project : projects) {
            for (Task task : project.getTasks()) {
                if (!task.hasComments()) {
                    continue;
                }
                for (String mentioned : findProjectMentions(task.getComments(), nameLookup, project.getName())) {
                    graph.dependency(project.getName(), mentioned);
                    log.debug("Dependency edge {} -> {} from task '{}'", project.getName(), mentioned, task.getName());
                }
            }
        }

        DependencyGraph built = graph.build();
        log.info("Built dependency graph: {} project(s), {} edge(s)",
                built.getAllProjects().size(), built.edgeCount());
        return built;
    }

    /**
     * Names of other projects mentioned shortly after a dependency keyword.
     */
    static Set<String> findProjectMentions(String comments, Map<String, String> nameLookup, String currentProject) {
        Set<String> mentioned = new TreeSet<>();
        String lower = comments.toLowerCase(Locale.ROOT);

        for (String keyword : CROSS_PROJECT_KEYWORDS) {
            int pos = lower.indexOf(keyword);
            while (pos != -1) {
                String windowLower = CommentScanner.stripLeadingNoise(lower.substring(pos + keyword.length()));
                for (Map.Entry<String, String> entry : nameLookup.entrySet()) {
                    if (entry.getValue().equals(currentProject)) {
                        continue;
                    }
                    int namePos = windowLower.indexOf(entry.getKey());
                    if (namePos != -1 && namePos < CommentScanner.CONTEXT_LIMIT) {
                        mentioned.add(entry.getValue());
                    }
                }
                pos = lower.indexOf(keyword, pos + keyword.length());
            }
        }
        return mentioned;
    }
}
