package com.questrail.junction.internal.topology;

import com.questrail.junction.api.TopologyException;
import com.questrail.junction.api.Transition;
import com.questrail.junction.internal.classify.StageClassifier;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TopologyGraph
 * -----------------------------------------------------------------------------
 * Read-only adjacency view over a junction's transitions.
 *
 * <h2>Structure</h2>
 * Each from-stage maps to its targets in first-seen order, without duplicates.
 * Stages that only ever appear as targets have no entry and therefore no
 * successors.
 *
 * <h2>Lifecycle</h2>
 * A graph is built fresh for every compile call and never mutated afterwards.
 * {@link #validate(List, String)} is a whole-graph precondition and runs before
 * the graph is used to produce any row.
 */
public final class TopologyGraph
{
    private final Map<String, List<String>> adjacency;
    private final StageClassifier classifier;

    private TopologyGraph(Map<String, List<String>> adjacency, StageClassifier classifier) {
        this.adjacency = adjacency;
        this.classifier = classifier;
    }

    /**
     * Builds the adjacency map from transitions in input order.
     */
    public static TopologyGraph build(List<Transition> transitions, StageClassifier classifier) {
        Objects.requireNonNull(transitions, "transitions");
        Objects.requireNonNull(classifier, "classifier");

        Map<String, List<String>> tmp = new LinkedHashMap<>();
        for (Transition t : transitions) {
            List<String> targets = tmp.computeIfAbsent(t.from(), k -> new ArrayList<>());
            if (!targets.contains(t.to())) {
                targets.add(t.to());
            }
        }

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        tmp.forEach((from, targets) -> frozen.put(from, List.copyOf(targets)));
        return new TopologyGraph(Collections.unmodifiableMap(frozen), classifier);
    }

    /**
     * Checks that every target stage, except the vehicle anchor, also appears
     * as a from-stage.
     *
     * @throws TopologyException naming the first dead-end stage in input order
     */
    public static void validate(List<Transition> transitions, String vehicleAnchor) {
        Objects.requireNonNull(transitions, "transitions");
        Objects.requireNonNull(vehicleAnchor, "vehicleAnchor");

        Set<String> fromStages = new HashSet<>();
        for (Transition t : transitions) {
            fromStages.add(t.from());
        }
        for (Transition t : transitions) {
            if (t.to().equals(vehicleAnchor)) {
                continue;
            }
            if (!fromStages.contains(t.to())) {
                throw new TopologyException(t.to(),
                        "Topology dead end: stage '" + t.to() + "' appears as a target "
                                + "but has no outgoing transitions");
            }
        }
    }

    /**
     * @return the targets of {@code stage} in first-seen order, empty if none
     */
    public List<String> successors(String stage) {
        return adjacency.getOrDefault(stage, List.of());
    }

    /**
     * @return every from-stage, in first-seen order
     */
    public Set<String> stages() {
        return adjacency.keySet();
    }

    /**
     * @return one-hop LRT neighbours of {@code stage}, in adjacency order
     */
    public List<String> outgoingLrts(String stage) {
        List<String> lrts = new ArrayList<>();
        for (String next : successors(stage)) {
            if (classifier.isLrt(next)) {
                lrts.add(next);
            }
        }
        return lrts;
    }

    /**
     * Breadth-first search for the LRT stage closest to {@code stage}.
     * <p>
     * The start stage itself never counts, even if it is an LRT stage reached
     * again through a cycle. Among LRT stages at the same minimal depth the
     * first one discovered wins, which follows adjacency insertion order.
     * LRT stages are not expanded further.
     *
     * @return the nearest LRT stage, or empty if none is reachable
     */
    public Optional<String> nearestLrt(String stage) {
        Objects.requireNonNull(stage, "stage");

        Set<String> visited = new HashSet<>();
        visited.add(stage);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(stage);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : successors(current)) {
                if (!visited.add(next)) {
                    continue;
                }
                // Discovery order is non-decreasing in depth, so the first hit is nearest.
                if (classifier.isLrt(next)) {
                    return Optional.of(next);
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }
}
