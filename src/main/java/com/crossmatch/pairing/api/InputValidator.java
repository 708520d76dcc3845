package com.crossmatch.pairing.api;

import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Island;
import com.crossmatch.pairing.core.model.Source;
import com.crossmatch.pairing.core.model.SourceCatalogue;
import com.crossmatch.pairing.grid.PerturbationGrids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Load-time checks run before any island is resolved.
 * Every problem found is collected and reported in one {@link PairingConfigurationException}.
 */
final class InputValidator {
    private static final Logger log = LoggerFactory.getLogger(InputValidator.class);
    private static final int MAX_REPORTED = 5;

    private final List<String> problems = new ArrayList<>();

    private InputValidator() {
    }

    static void validate(PairingInputs inputs, PairingOptions options) {
        InputValidator validator = new InputValidator();
        validator.check(inputs, options);
        validator.raiseIfInvalid();
    }

    private void check(PairingInputs inputs, PairingOptions options) {
        if (inputs == null) {
            problems.add("inputs are required");
            return;
        }
        if (inputs.catalogueA() == null || inputs.catalogueB() == null) {
            problems.add("both catalogues are required");
        } else {
            if (inputs.catalogueA().catalogue() != Catalogue.A) {
                problems.add("first catalogue is labelled " + inputs.catalogueA().catalogue());
            }
            if (inputs.catalogueB().catalogue() != Catalogue.B) {
                problems.add("second catalogue is labelled " + inputs.catalogueB().catalogue());
            }
        }
        if (inputs.islands() == null) {
            problems.add("island membership is required");
        }
        if (inputs.priors() == null) {
            problems.add("prior density grids are required");
        }
        if (options.isPhotometryEnabled() && inputs.photometry() == null) {
            problems.add("photometry is enabled but no photometric likelihood cubes were supplied");
        }
        if (options.isPerturbationEnabled()) {
            checkPerturbation(inputs);
        }
        if (!problems.isEmpty()) {
            return;
        }
        checkSources(inputs.catalogueA(), inputs, options);
        checkSources(inputs.catalogueB(), inputs, options);
        checkIslands(inputs);
        checkRejects(inputs.rejectA(), inputs.catalogueA());
        checkRejects(inputs.rejectB(), inputs.catalogueB());
    }

    private void checkPerturbation(PairingInputs inputs) {
        PerturbationGrids a = inputs.perturbationA();
        PerturbationGrids b = inputs.perturbationB();
        if (a == null || b == null || inputs.frequencies() == null) {
            problems.add("perturbation is enabled but perturbation grids or the frequency grid are missing");
            return;
        }
        if (a.fluxLevelCount() != b.fluxLevelCount()) {
            problems.add("perturbation grids disagree on flux-cut levels: " + a.fluxLevelCount()
                    + " vs " + b.fluxLevelCount());
        }
        int rho = inputs.frequencies().size();
        if (a.kernelLength() != rho || b.kernelLength() != rho) {
            problems.add("fourier kernels hold " + a.kernelLength() + " and " + b.kernelLength()
                    + " samples but the frequency grid has " + rho);
        }
    }

    private void checkSources(SourceCatalogue catalogue, PairingInputs inputs, PairingOptions options) {
        for (int i = 0; i < catalogue.size(); i++) {
            Source source = catalogue.get(i);
            if (source.index() != i) {
                problems.add("catalogue " + catalogue.catalogue().label() + " position " + i
                        + " holds source index " + source.index());
                continue;
            }
            if (!inputs.priors().covers(source)) {
                problems.add(describe(source) + " references prior cell " + source.modelReference()
                        + " outside the prior grids");
            }
            if (options.isPhotometryEnabled()) {
                if (!inputs.photometry().covers(source)) {
                    problems.add(describe(source) + " lies outside the photometric likelihood cubes");
                } else if (Double.isNaN(source.bestMagnitude())) {
                    problems.add(describe(source) + " has no magnitude in its best filter");
                }
            }
            if (options.isPerturbationEnabled()) {
                PerturbationGrids grids = catalogue.catalogue() == Catalogue.A
                        ? inputs.perturbationA() : inputs.perturbationB();
                if (!grids.contains(source.modelReference())) {
                    problems.add(describe(source) + " references perturbation cell " + source.modelReference()
                            + " outside its grids");
                }
            }
        }
    }

    private void checkIslands(PairingInputs inputs) {
        int sizeA = inputs.catalogueA().size();
        int sizeB = inputs.catalogueB().size();
        for (Island island : inputs.islands().islands()) {
            for (int a : island.aIndices()) {
                if (a >= sizeA) {
                    problems.add("island " + island.index() + " references catalogue a index " + a
                            + " beyond " + sizeA + " sources");
                }
            }
            for (int b : island.bIndices()) {
                if (b >= sizeB) {
                    problems.add("island " + island.index() + " references catalogue b index " + b
                            + " beyond " + sizeB + " sources");
                }
            }
        }
    }

    private void checkRejects(int[] rejects, SourceCatalogue catalogue) {
        for (int index : rejects) {
            if (index < 0 || index >= catalogue.size()) {
                problems.add("rejected catalogue " + catalogue.catalogue().label() + " index " + index
                        + " outside the catalogue");
            }
        }
    }

    private void raiseIfInvalid() {
        if (problems.isEmpty()) {
            return;
        }
        log.error("inputs.invalid problems={}", problems.size());
        StringBuilder message = new StringBuilder("Invalid pairing inputs (")
                .append(problems.size()).append(problems.size() == 1 ? " problem): " : " problems): ");
        message.append(String.join("; ", problems.subList(0, Math.min(MAX_REPORTED, problems.size()))));
        if (problems.size() > MAX_REPORTED) {
            message.append("; ...");
        }
        throw new PairingConfigurationException(message.toString());
    }

    private static String describe(Source source) {
        return "catalogue " + source.catalogue().label() + " source " + source.index();
    }
}
