package com.crossmatch.pairing.likelihood;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Contamination likelihood Tests")
class ContaminationLikelihoodTest {

    private static final FrequencyGrid GRID = FrequencyGrid.linear(100.0, 10_000);

    private static double[] filled(double value) {
        double[] kernel = new double[GRID.size()];
        Arrays.fill(kernel, value);
        return kernel;
    }

    @Nested
    @DisplayName("FrequencyGrid")
    class GridTests {

        @Test
        @DisplayName("Samples sit at bin midpoints")
        void midpoints() {
            FrequencyGrid grid = FrequencyGrid.fromEdges(0.0, 1.0, 3.0);
            assertEquals(2, grid.size());
            assertEquals(0.5, grid.rho(0));
            assertEquals(2.0, grid.rho(1));
            assertEquals(2.0, grid.drho(1));
        }

        @Test
        @DisplayName("Edges must be non-negative and ascending")
        void invalidEdges() {
            assertThrows(IllegalArgumentException.class, () -> FrequencyGrid.fromEdges(0.0));
            assertThrows(IllegalArgumentException.class, () -> FrequencyGrid.fromEdges(0.0, 2.0, 1.0));
            assertThrows(IllegalArgumentException.class, () -> FrequencyGrid.fromEdges(-1.0, 1.0));
        }
    }

    @Nested
    @DisplayName("HankelTransform")
    class HankelTests {

        @ParameterizedTest(name = "sigma={0}\" r={1}\"")
        @CsvSource({
                "0.1, 0.0",
                "0.1, 0.15",
                "0.2, 0.3",
                "0.3, 0.5",
                "0.4, 1.0"
        })
        @DisplayName("Inverting a Gaussian's transform should recover the Gaussian")
        void recoversGaussian(double sigma, double r) {
            double s2 = sigma * sigma;
            double[] fourier = new double[GRID.size()];
            for (int i = 0; i < fourier.length; i++) {
                double rho = GRID.rho(i);
                fourier[i] = Math.exp(-2 * Math.PI * Math.PI * rho * rho * s2);
            }
            double expected = Math.exp(-r * r / (2 * s2)) / (2 * Math.PI * s2);

            double actual = HankelTransform.inverse(fourier, GRID, r);

            assertEquals(expected, actual, 1e-4 + 1e-3 * Math.abs(expected));
        }

        @Test
        @DisplayName("Transforming several functions at once matches transforming each alone")
        void severalAtOnce() {
            double[] first = filled(1.0);
            double[] second = new double[GRID.size()];
            for (int i = 0; i < second.length; i++) {
                second[i] = Math.exp(-2 * Math.PI * Math.PI * GRID.rho(i) * GRID.rho(i) * 0.04);
            }

            double[] both = HankelTransform.inverse(GRID, 0.2, first, second);

            assertEquals(2, both.length);
            assertEquals(HankelTransform.inverse(first, GRID, 0.2), both[0]);
            assertEquals(HankelTransform.inverse(second, GRID, 0.2), both[1]);
        }

        @Test
        @DisplayName("Sample count must match the grid")
        void lengthMismatch() {
            assertThrows(IllegalArgumentException.class, () -> HankelTransform.inverse(new double[3], GRID, 0.0));
        }
    }

    @Nested
    @DisplayName("ContaminationLikelihood")
    class LikelihoodTests {

        private final ContaminationLikelihood likelihood = new ContaminationLikelihood(GRID);

        @Test
        @DisplayName("Unit kernels reduce all four terms to the unperturbed Gaussian")
        void unitKernels() {
            double sepArcsec = 0.1;
            ContaminatedMatchLikelihoods g = likelihood.compute(sepArcsec, 0.1, 0.08, filled(1.0), filled(1.0));

            double degrees = 1.0 / 3600.0;
            double expected = AstrometricLikelihood.gaussian(sepArcsec * degrees, 0.1 * degrees, 0.08 * degrees);
            assertEquals(expected, g.gcc(), expected * 1e-3);
            assertEquals(g.gcc(), g.gcn(), 1e-9 * expected);
            assertEquals(g.gcc(), g.gnc(), 1e-9 * expected);
            assertEquals(g.gcc(), g.gnn(), 1e-9 * expected);
        }

        @Test
        @DisplayName("Each scenario should be the inverse transform of its kernel product")
        void scenariosAreTransforms() {
            double[] kernelA = new double[GRID.size()];
            double[] kernelB = new double[GRID.size()];
            for (int i = 0; i < GRID.size(); i++) {
                kernelA[i] = 1.0 / (1.0 + GRID.rho(i));
                kernelB[i] = Math.exp(-0.5 * GRID.rho(i));
            }
            double s2 = 0.1 * 0.1 + 0.08 * 0.08;
            double[] product = new double[GRID.size()];
            double[] onlyA = new double[GRID.size()];
            for (int i = 0; i < GRID.size(); i++) {
                double gamma = Math.exp(-2 * Math.PI * Math.PI * GRID.rho(i) * GRID.rho(i) * s2);
                product[i] = gamma * kernelA[i] * kernelB[i];
                onlyA[i] = gamma * kernelA[i];
            }
            double toSquareDegrees = 3600.0 * 3600.0;

            ContaminatedMatchLikelihoods g = likelihood.compute(0.12, 0.1, 0.08, kernelA, kernelB);

            double gcc = HankelTransform.inverse(product, GRID, 0.12) * toSquareDegrees;
            double gcn = HankelTransform.inverse(onlyA, GRID, 0.12) * toSquareDegrees;
            assertEquals(gcc, g.gcc(), 1e-9 * gcc);
            assertEquals(gcn, g.gcn(), 1e-9 * gcn);
        }

        @Test
        @DisplayName("Zero kernels leave only the uncontaminated term")
        void zeroKernels() {
            ContaminatedMatchLikelihoods g = likelihood.compute(0.05, 0.1, 0.1, filled(0.0), filled(0.0));
            assertEquals(0.0, g.gcc());
            assertEquals(0.0, g.gcn());
            assertEquals(0.0, g.gnc());
            assertTrue(g.gnn() > 0.0);
        }

        @Test
        @DisplayName("Terms are never negative")
        void clampedTail() {
            ContaminatedMatchLikelihoods g = likelihood.compute(30.0, 0.1, 0.1, filled(1.0), filled(1.0));
            assertTrue(g.gcc() >= 0.0);
            assertTrue(g.gnn() >= 0.0);
        }

        @Test
        @DisplayName("Kernel length must match the frequency grid")
        void kernelLength() {
            assertThrows(IllegalArgumentException.class,
                    () -> likelihood.compute(0.1, 0.1, 0.1, new double[2], filled(1.0)));
        }
    }

    @Nested
    @DisplayName("ContaminatedMatchLikelihoods")
    class ProbabilityTests {

        @Test
        @DisplayName("Equal terms give back the contamination fractions")
        void unperturbedProbabilities() {
            double[][] probs = ContaminatedMatchLikelihoods.unperturbed(2.0)
                    .contaminationProbabilities(new double[]{0.3, 0.0}, new double[]{0.6, 1.0});
            assertArrayEquals(new double[]{0.3, 0.0}, probs[0], 1e-12);
            assertArrayEquals(new double[]{0.6, 1.0}, probs[1], 1e-12);
        }

        @Test
        @DisplayName("Should weight each contamination case by its likelihood")
        void weightedProbabilities() {
            ContaminatedMatchLikelihoods g = new ContaminatedMatchLikelihoods(4.0, 3.0, 2.0, 1.0);
            double pa = 0.2;
            double pb = 0.5;
            double both = 4.0 * pa * pb;
            double onlyA = 3.0 * pa * (1 - pb);
            double onlyB = 2.0 * (1 - pa) * pb;
            double neither = 1.0 * (1 - pa) * (1 - pb);
            double total = both + onlyA + onlyB + neither;

            double[][] probs = g.contaminationProbabilities(new double[]{pa}, new double[]{pb});

            assertEquals((both + onlyA) / total, probs[0][0], 1e-12);
            assertEquals((both + onlyB) / total, probs[1][0], 1e-12);
        }

        @Test
        @DisplayName("Vanishing likelihoods give zero probabilities")
        void vanishingTotal() {
            double[][] probs = new ContaminatedMatchLikelihoods(0.0, 0.0, 0.0, 0.0)
                    .contaminationProbabilities(new double[]{0.5}, new double[]{0.5});
            assertEquals(0.0, probs[0][0]);
            assertEquals(0.0, probs[1][0]);
        }

        @Test
        @DisplayName("Level counts must agree")
        void levelMismatch() {
            assertThrows(IllegalArgumentException.class, () -> ContaminatedMatchLikelihoods.unperturbed(1.0)
                    .contaminationProbabilities(new double[2], new double[3]));
        }
    }
}
