package com.questrail.junction.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JunctionConfigTest
{
    @Test
    void builderParsesMaxSkeletonAndKeepsOrder()
    {
        JunctionConfig config = JunctionConfig.builder()
                .withVehicleAnchor("A0")
                .withLrtAnchor("L39")
                .withMaxSkeleton("A0 - B - C - A0")
                .addStage(Stage.of("C", MinType.CPN))
                .addStage(Stage.of("B", MinType.CPN))
                .addTransition("A0", "B", "B-C-A0")
                .addTransition(Transition.toEnd("C", "A0"))
                .build();

        assertEquals(List.of("A0", "B", "C", "A0"), config.skeletonStages());
        assertEquals(List.of("C", "B"), List.copyOf(config.stages().keySet()));
        assertEquals(2, config.transitions().size());
        assertEquals(Transition.END_OF_SKELETON, config.transitions().get(1).restOfSkeleton());
        assertTrue(config.stage("B").isPresent());
        assertTrue(config.stage("X").isEmpty());
    }

    @Test
    void configIsImmutable()
    {
        JunctionConfig config = JunctionConfig.builder()
                .withVehicleAnchor("A0")
                .withLrtAnchor("L39")
                .addTransition("A0", "B", "B-A0")
                .build();

        assertThrows(UnsupportedOperationException.class,
                () -> config.transitions().add(Transition.toEnd("B", "A0")));
        assertThrows(UnsupportedOperationException.class,
                () -> config.stages().put("B", Stage.of("B", MinType.MIN)));
    }

    @Test
    void anchorsAreRequired()
    {
        assertThrows(NullPointerException.class,
                () -> JunctionConfig.builder().withLrtAnchor("L39").build());
        assertThrows(IllegalStateException.class,
                () -> JunctionConfig.builder().withVehicleAnchor(" ").withLrtAnchor("L39").build());
    }

    @Test
    void laterStageReplacesEarlier()
    {
        JunctionConfig config = JunctionConfig.builder()
                .withVehicleAnchor("A0")
                .withLrtAnchor("L39")
                .addStage(Stage.of("B", MinType.MIN))
                .addStage(Stage.of("B", MinType.CPN))
                .build();

        assertEquals(MinType.CPN, config.stage("B").orElseThrow().minType());
    }
}
