package com.questrail.junction.compiler;

import com.questrail.junction.api.FragmentAssemblyException;
import com.questrail.junction.api.JunctionConfig;
import com.questrail.junction.api.SkeletonText;
import com.questrail.junction.api.StageCategory;
import com.questrail.junction.api.TemplateCode;
import com.questrail.junction.api.Transition;
import com.questrail.junction.internal.classify.StageClassifier;
import com.questrail.junction.internal.demand.DemandBuilder;
import com.questrail.junction.internal.path.SuffixEngine;
import com.questrail.junction.internal.template.TemplateCatalog;
import com.questrail.junction.internal.topology.TopologyGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.junction.internal.path.SuffixEngine.DEQUEUE_MARKER;
import static com.questrail.junction.internal.template.TemplateCatalog.jMarker;

/**
 * TransitionLogicAssembler
 * =============================================================================
 * Builds the path fragments a template needs for one transition and invokes
 * the template.
 *
 * <h2>Tail convention</h2>
 * The rest-of-skeleton of a transition starts with the transition's own
 * target. The <em>tail</em> used throughout this class is everything after
 * that first element, i.e. the stages from just after the target up to an
 * anchor.
 *
 * <h2>Failures</h2>
 * Anything that prevents a fragment from being built is raised as a
 * {@link FragmentAssemblyException}. The caller decides how to report it.
 */
final class TransitionLogicAssembler
{
    private final JunctionConfig config;
    private final TopologyGraph graph;
    private final StageClassifier classifier;
    private final SuffixEngine suffixes;
    private final DemandBuilder demands;

    TransitionLogicAssembler(JunctionConfig config,
                             TopologyGraph graph,
                             StageClassifier classifier) {
        this.config = Objects.requireNonNull(config, "config");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.suffixes = new SuffixEngine(config.stages());
        this.demands = new DemandBuilder(config.stages());
    }

    /**
     * @return the single-line logic code of {@code transition} under {@code template}
     * @throws FragmentAssemblyException if a required fragment cannot be built
     */
    String assemble(TemplateCode template, Transition transition) {
        List<String> tail = tailOf(transition);

        return switch (template) {
            case A -> vehicleToVehicle(transition, tail);
            case B -> vehicleToLrtEntry(transition, tail);
            case C -> vehicleToLrtAnchor(transition);
            case D -> lrtToVehicle(transition, tail);
            case E -> lrtToLig(transition, tail);
            case F -> TemplateCatalog.ligToVehicle(demands.build(transition.to(), transition.from()));
            case G -> lrtToLrt(transition);
        };
    }

    // ---------------------------------------------------------------------
    // Templates
    // ---------------------------------------------------------------------

    private String vehicleToVehicle(Transition t, List<String> tail) {
        String current = t.from();
        String target = t.to();

        Optional<String> nearest = graph.nearestLrt(target);
        boolean targetHasOutgoingLrt = !graph.outgoingLrts(target).isEmpty();
        if (nearest.isEmpty()) {
            nearest = graph.nearestLrt(current);
            targetHasOutgoingLrt = false;
        }
        String nearestLrt = nearest.orElseThrow(() -> new FragmentAssemblyException(
                "No LRT stage reachable from '" + target + "' or '" + current + "'"));

        String bypassLrt = preferredOutgoingLrt(current).orElse(nearestLrt);

        return TemplateCatalog.vehicleToVehicle(new TemplateCatalog.VehicleToVehicle(
                current,
                suffixes.greenTimeFunction(current),
                demands.build(target, current),
                suffixes.applySuffix(target),
                jMarker(nearestLrt),
                bypassPath(current, bypassLrt),
                pathThroughTarget(target, tail),
                targetHasOutgoingLrt));
    }

    private String vehicleToLrtEntry(Transition t, List<String> tail) {
        String current = t.from();
        String nextVehicle = nextVehicleOf(tail);
        String renderedTail = suffixes.renderTail(tail);
        String wtgRest = DEQUEUE_MARKER + "_" + (renderedTail.isEmpty() ? config.vehicleAnchor() : renderedTail);

        return TemplateCatalog.vehicleToLrtEntry(new TemplateCatalog.VehicleToLrtEntry(
                current,
                t.to(),
                suffixes.greenTimeFunction(current),
                wtgRest,
                suffixes.applySuffix(nextVehicle) + "_" + threateningLrtMarker(nextVehicle)));
    }

    private String vehicleToLrtAnchor(Transition t) {
        return TemplateCatalog.vehicleToLrtAnchor(new TemplateCatalog.VehicleToLrtAnchor(
                t.from(),
                config.lrtAnchor(),
                suffixes.greenTimeFunction(t.from())));
    }

    private String lrtToVehicle(Transition t, List<String> tail) {
        String target = t.to();
        String nearestLrt = graph.nearestLrt(target).orElse(config.lrtAnchor());

        return TemplateCatalog.lrtToVehicle(new TemplateCatalog.LrtToVehicle(
                t.from(),
                target,
                suffixes.applySuffix(target) + "_" + jMarker(nearestLrt),
                pathThroughTarget(target, tail),
                demands.build(target, t.from())));
    }

    private String lrtToLig(Transition t, List<String> tail) {
        String lig = t.to();
        String nextVehicle = nextVehicleOf(tail);
        String renderedTail = suffixes.renderTail(tail);

        return TemplateCatalog.lrtToLig(new TemplateCatalog.LrtToLig(
                t.from(),
                lig,
                suffixes.greenTimeFunction(t.from()),
                lig + "_" + suffixes.applySuffix(nextVehicle) + "_" + threateningLrtMarker(nextVehicle),
                lig + "_" + (renderedTail.isEmpty() ? config.vehicleAnchor() : renderedTail)));
    }

    private String lrtToLrt(Transition t) {
        String nextVehicle = nextVehicleInSkeleton(t.from());

        return TemplateCatalog.lrtToLrt(new TemplateCatalog.LrtToLrt(
                t.from(),
                t.to(),
                suffixes.applySuffix(nextVehicle) + "_" + jMarker(t.to())));
    }

    // ---------------------------------------------------------------------
    // Fragments
    // ---------------------------------------------------------------------

    private List<String> tailOf(Transition t) {
        List<String> rest;
        try {
            rest = SkeletonText.parseRestOfSkeleton(t.restOfSkeleton());
        } catch (IllegalArgumentException e) {
            throw new FragmentAssemblyException(e.getMessage(), e);
        }
        return rest.isEmpty() ? List.of() : rest.subList(1, rest.size());
    }

    /**
     * Target with suffix followed by the tail, or the bare target when it is
     * the last stage of the path.
     */
    private String pathThroughTarget(String target, List<String> tail) {
        if (tail.isEmpty()) {
            return target;
        }
        return suffixes.applySuffix(target) + "_" + suffixes.renderTail(tail);
    }

    /**
     * One-hop LRT of {@code stage}, preferring entries over the anchor.
     */
    private Optional<String> preferredOutgoingLrt(String stage) {
        List<String> lrts = graph.outgoingLrts(stage);
        for (String lrt : lrts) {
            if (!lrt.equals(config.lrtAnchor())) {
                return Optional.of(lrt);
            }
        }
        return lrts.stream().findFirst();
    }

    /**
     * Wait path followed when the LRT arrives before the target can be served.
     * <ol>
     *   <li>the LRT anchor is used bare</li>
     *   <li>otherwise the tail recorded on the {@code current -> lrt} transition</li>
     *   <li>otherwise a path through the LRT's first vehicle neighbour</li>
     *   <li>otherwise straight back to the vehicle anchor</li>
     * </ol>
     */
    private String bypassPath(String current, String lrt) {
        if (lrt.equals(config.lrtAnchor())) {
            return lrt;
        }
        String prefix = lrt + "_" + DEQUEUE_MARKER + "_";

        Optional<Transition> direct = findTransition(current, lrt);
        if (direct.isPresent()) {
            String tail = suffixes.renderTail(tailOf(direct.get()));
            return prefix + (tail.isEmpty() ? config.vehicleAnchor() : tail);
        }

        Optional<String> firstVehicle = graph.successors(lrt).stream()
                .filter(s -> classifier.classify(s) == StageCategory.VEHICLE)
                .findFirst();
        if (firstVehicle.isPresent()) {
            String vehicle = firstVehicle.get();
            Optional<Transition> onward = findTransition(lrt, vehicle);
            if (onward.isPresent()) {
                String tail = suffixes.renderTail(tailOf(onward.get()));
                return prefix + suffixes.applySuffix(vehicle) + "_"
                        + (tail.isEmpty() ? config.vehicleAnchor() : tail);
            }
        }

        return prefix + config.vehicleAnchor();
    }

    private String nextVehicleOf(List<String> tail) {
        return tail.isEmpty() ? config.vehicleAnchor() : tail.get(0);
    }

    /**
     * j-marker of the first LRT reachable in one hop from {@code vehicle},
     * or of the LRT anchor.
     */
    private String threateningLrtMarker(String vehicle) {
        List<String> lrts = graph.outgoingLrts(vehicle);
        return jMarker(lrts.isEmpty() ? config.lrtAnchor() : lrts.get(0));
    }

    /**
     * The vehicle successor of {@code stage} that appears earliest in the
     * skeleton cycle. The vehicle anchor is not a candidate and is returned
     * when no other vehicle successor exists. Successors missing from the
     * skeleton sort last; adjacency order breaks ties.
     */
    private String nextVehicleInSkeleton(String stage) {
        List<String> skeleton = config.skeletonStages();
        List<String> candidates = new ArrayList<>();
        for (String next : graph.successors(stage)) {
            if (classifier.isVehicle(next) && !next.equals(config.vehicleAnchor())) {
                candidates.add(next);
            }
        }

        Comparator<String> bySkeletonPosition = Comparator.comparingInt(s -> {
            int pos = skeleton.indexOf(s);
            return pos < 0 ? Integer.MAX_VALUE : pos;
        });
        return candidates.stream()
                .min(bySkeletonPosition)
                .orElse(config.vehicleAnchor());
    }

    private Optional<Transition> findTransition(String from, String to) {
        return config.transitions().stream()
                .filter(t -> t.from().equals(from) && t.to().equals(to))
                .findFirst();
    }
}
