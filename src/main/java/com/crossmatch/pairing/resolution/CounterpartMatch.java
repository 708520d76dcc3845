package com.crossmatch.pairing.resolution;

import java.util.Arrays;
import java.util.Objects;

/**
 * An accepted counterpart pair.
 *
 * @param aIndex             catalogue a source index
 * @param bIndex             catalogue b source index
 * @param probability        posterior probability of the selected hypothesis
 * @param separationArcsec   great-circle separation, arcsec
 * @param eta                photometric likelihood ratio, log10(c / (fa fb))
 * @param xi                 astrometric likelihood ratio, log10(Nc G / (Nfa Nfb))
 * @param contaminationFluxA average contaminating flux of the a source
 * @param contaminationFluxB average contaminating flux of the b source
 * @param contaminationProbA per flux-cut level contamination probability of the a source
 * @param contaminationProbB per flux-cut level contamination probability of the b source
 */
public record CounterpartMatch(
        int aIndex,
        int bIndex,
        double probability,
        double separationArcsec,
        double eta,
        double xi,
        double contaminationFluxA,
        double contaminationFluxB,
        double[] contaminationProbA,
        double[] contaminationProbB
) {
    public CounterpartMatch {
        contaminationProbA = contaminationProbA != null ? contaminationProbA.clone() : new double[0];
        contaminationProbB = contaminationProbB != null ? contaminationProbB.clone() : new double[0];
    }

    @Override
    public double[] contaminationProbA() {
        return contaminationProbA.clone();
    }

    @Override
    public double[] contaminationProbB() {
        return contaminationProbB.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterpartMatch other)) return false;
        return aIndex == other.aIndex
                && bIndex == other.bIndex
                && Double.compare(probability, other.probability) == 0
                && Double.compare(separationArcsec, other.separationArcsec) == 0
                && Double.compare(eta, other.eta) == 0
                && Double.compare(xi, other.xi) == 0
                && Double.compare(contaminationFluxA, other.contaminationFluxA) == 0
                && Double.compare(contaminationFluxB, other.contaminationFluxB) == 0
                && Arrays.equals(contaminationProbA, other.contaminationProbA)
                && Arrays.equals(contaminationProbB, other.contaminationProbB);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(aIndex, bIndex, probability, separationArcsec, eta, xi,
                contaminationFluxA, contaminationFluxB);
        result = 31 * result + Arrays.hashCode(contaminationProbA);
        return 31 * result + Arrays.hashCode(contaminationProbB);
    }

    @Override
    public String toString() {
        return "CounterpartMatch{a" + aIndex + "-b" + bIndex +
                ", p=" + probability +
                ", sep=" + separationArcsec +
                ", eta=" + eta +
                ", xi=" + xi + '}';
    }
}
