package com.questrail.junction.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JunctionConfig
 * -----------------------------------------------------------------------------
 * Normalized description of one junction's signal topology.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>the vehicle anchor and the LRT anchor</li>
 *   <li>the skeleton: the ordered cycle of vehicle stages returning to the
 *       vehicle anchor (e.g. {@code [A0, B, C, A0]})</li>
 *   <li>stage properties keyed by name, in insertion order</li>
 *   <li>transitions, in input order</li>
 * </ul>
 *
 * Instances are immutable and are typically produced by an ingestion layer
 * that reads the junction's source documents. This class makes no assumption
 * about where the data came from.
 */
public final class JunctionConfig
{
    private final String vehicleAnchor;
    private final String lrtAnchor;
    private final List<String> skeletonStages;
    private final Map<String, Stage> stages;
    private final List<Transition> transitions;

    private JunctionConfig(Builder builder) {
        this.vehicleAnchor = builder.vehicleAnchor;
        this.lrtAnchor = builder.lrtAnchor;
        this.skeletonStages = List.copyOf(builder.skeletonStages);
        this.stages = Collections.unmodifiableMap(new LinkedHashMap<>(builder.stages));
        this.transitions = List.copyOf(builder.transitions);
    }

    public String vehicleAnchor() {
        return vehicleAnchor;
    }

    public String lrtAnchor() {
        return lrtAnchor;
    }

    /**
     * @return the skeleton cycle in order, including the repeated anchor
     */
    public List<String> skeletonStages() {
        return skeletonStages;
    }

    /**
     * @return stage properties keyed by name, iterating in insertion order
     */
    public Map<String, Stage> stages() {
        return stages;
    }

    public Optional<Stage> stage(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String vehicleAnchor;
        private String lrtAnchor;
        private List<String> skeletonStages = new ArrayList<>();
        private final Map<String, Stage> stages = new LinkedHashMap<>();
        private final List<Transition> transitions = new ArrayList<>();

        public Builder withVehicleAnchor(String vehicleAnchor) {
            this.vehicleAnchor = vehicleAnchor;
            return this;
        }

        public Builder withLrtAnchor(String lrtAnchor) {
            this.lrtAnchor = lrtAnchor;
            return this;
        }

        public Builder withSkeletonStages(List<String> skeletonStages) {
            this.skeletonStages = new ArrayList<>(Objects.requireNonNull(skeletonStages, "skeletonStages"));
            return this;
        }

        /**
         * Sets the skeleton from its textual "maximum skeleton" form,
         * e.g. {@code "A0 - B - C - A0"}.
         */
        public Builder withMaxSkeleton(String maxSkeleton) {
            this.skeletonStages = SkeletonText.parseStageSequence(maxSkeleton);
            return this;
        }

        /**
         * Adds a stage. A later stage with the same name replaces the earlier
         * one but keeps its original position.
         */
        public Builder addStage(Stage stage) {
            Objects.requireNonNull(stage, "stage");
            stages.put(stage.name(), stage);
            return this;
        }

        public Builder addTransition(Transition transition) {
            transitions.add(Objects.requireNonNull(transition, "transition"));
            return this;
        }

        public Builder addTransition(String from, String to, String restOfSkeleton) {
            return addTransition(new Transition(from, to, restOfSkeleton));
        }

        public JunctionConfig build() {
            requireStageName(vehicleAnchor, "vehicleAnchor");
            requireStageName(lrtAnchor, "lrtAnchor");
            return new JunctionConfig(this);
        }

        private static void requireStageName(String value, String field) {
            Objects.requireNonNull(value, field);
            if (!Stage.isValidName(value)) {
                throw new IllegalStateException(field + " must be a stage name (was '" + value + "')");
            }
        }
    }
}
