package com.questrail.junction.compiler;

import com.questrail.junction.api.JunctionConfig;
import com.questrail.junction.api.MinType;
import com.questrail.junction.api.Stage;

/**
 * Shared junction used by the compiler tests.
 *
 * <pre>
 *   skeleton      A0 - B - C - A0
 *   anchors       vehicle A0, LRT L39
 *   LRT entry     L30 with Lig stage A30
 * </pre>
 */
final class JunctionFixtures
{
    private JunctionFixtures() {}

    static JunctionConfig.Builder standardJunction() {
        return JunctionConfig.builder()
                .withVehicleAnchor("A0")
                .withLrtAnchor("L39")
                .withMaxSkeleton("A0 - B - C - A0")
                .addStage(new Stage("A0", MinType.MIN, "", 0, 1))
                .addStage(new Stage("B", MinType.CPN, "Pb", 1, 1))
                .addStage(new Stage("C", MinType.CPN, "Pc", 1, 2))
                .addStage(Stage.of("L30", MinType.MIN))
                .addStage(Stage.of("L39", MinType.MIN))
                .addStage(Stage.of("A30", MinType.MIN))
                .addTransition("A0", "B", "B-C-A0")
                .addTransition("B", "C", "C-A0")
                .addTransition("C", "A0", "end of skeleton")
                .addTransition("A0", "L30", "L30-B-C-A0")
                .addTransition("B", "L39", "L39-C-A0")
                .addTransition("L30", "A30", "A30-B-C-A0")
                .addTransition("A30", "B", "B-C-A0")
                .addTransition("L30", "L39", "L39-C-A0")
                .addTransition("L39", "C", "C-A0");
    }
}
