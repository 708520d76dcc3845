package com.crossmatch.pairing;

import com.crossmatch.pairing.api.PairingInputs;
import com.crossmatch.pairing.batch.IslandMembership;
import com.crossmatch.pairing.core.model.ArraySourceCatalogue;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Island;
import com.crossmatch.pairing.core.model.ModelReference;
import com.crossmatch.pairing.grid.PriorDensityGrids;

import java.util.List;

/**
 * Shared test scenario: seven catalogue a and four catalogue b sources in five islands.
 *
 * <pre>
 * island 0: a0, a3 | b1   (a0-b1 expected)
 * island 1: a1, a4 | b0   (a1-b0 expected)
 * island 2: a2, a5 | b3   (a5-b3 expected)
 * island 3: a6     | -    (lonely)
 * island 4: -      | b2   (lonely)
 * </pre>
 */
public final class PairingTestData {

    public static final double ARCSEC = 1.0 / 3600.0;
    public static final double SIGMA_A = 0.1 * ARCSEC;
    public static final double SIGMA_B = 0.08 * ARCSEC;
    public static final double NC = 150.0;
    public static final double NFA = 550.0;
    public static final double NFB = 150.0;
    public static final ModelReference REF = ModelReference.of(0, 0, 0);

    private PairingTestData() {
    }

    public static ArraySourceCatalogue catalogueA() {
        return ArraySourceCatalogue.builder(Catalogue.A)
                .add(10.0, 0.0, SIGMA_A, new double[]{15.0}, 0, REF)
                .add(20.0, 0.0, SIGMA_A, new double[]{16.0}, 0, REF)
                .add(30.0, 0.0, SIGMA_A, new double[]{17.0}, 0, REF)
                .add(10.0 + 0.3 * ARCSEC, 0.0, SIGMA_A, new double[]{18.0}, 0, REF)
                .add(20.0, 0.4 * ARCSEC, SIGMA_A, new double[]{15.5}, 0, REF)
                .add(30.0 + 0.35 * ARCSEC, 0.0, SIGMA_A, new double[]{16.5}, 0, REF)
                .add(40.0, 0.0, SIGMA_A, new double[]{17.5}, 0, REF)
                .build();
    }

    public static ArraySourceCatalogue catalogueB() {
        return ArraySourceCatalogue.builder(Catalogue.B)
                .add(20.0, 0.06 * ARCSEC, SIGMA_B, new double[]{15.2}, 0, REF)
                .add(10.0 + 0.05 * ARCSEC, 0.0, SIGMA_B, new double[]{15.1}, 0, REF)
                .add(50.0, 0.0, SIGMA_B, new double[]{14.0}, 0, REF)
                .add(30.0 + 0.32 * ARCSEC, 0.0, SIGMA_B, new double[]{16.4}, 0, REF)
                .build();
    }

    public static IslandMembership islands() {
        return IslandMembership.of(List.of(
                new Island(0, new int[]{0, 3}, new int[]{1}),
                new Island(1, new int[]{1, 4}, new int[]{0}),
                new Island(2, new int[]{2, 5}, new int[]{3}),
                new Island(3, new int[]{6}, new int[0]),
                new Island(4, new int[0], new int[]{2})));
    }

    /**
     * The same scenario with island 2 removed upstream: its sources go to the reject lists
     * and the island stays in place, empty.
     */
    public static IslandMembership islandsWithIslandTwoRejected() {
        return IslandMembership.of(List.of(
                new Island(0, new int[]{0, 3}, new int[]{1}),
                new Island(1, new int[]{1, 4}, new int[]{0}),
                new Island(2, new int[0], new int[0]),
                new Island(3, new int[]{6}, new int[0]),
                new Island(4, new int[0], new int[]{2})));
    }

    public static PriorDensityGrids priors() {
        return PriorDensityGrids.uniform(NC, NFA, NFB);
    }

    public static PairingInputs.Builder inputs() {
        return PairingInputs.builder()
                .catalogues(catalogueA(), catalogueB())
                .islands(islands())
                .priors(priors());
    }
}
