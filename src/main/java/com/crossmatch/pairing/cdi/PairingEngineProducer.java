package com.crossmatch.pairing.cdi;

import com.crossmatch.pairing.api.CounterpartPairingEngine;
import com.crossmatch.pairing.api.PairingConfigurationException;
import com.crossmatch.pairing.api.PairingOptions;
import com.crossmatch.pairing.hypothesis.OversizedIslandPolicy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the pairing engine from MicroProfile Config properties.
 *
 * <pre>
 * crossmatch.pairing.photometry.enabled=true
 * crossmatch.pairing.perturbation.enabled=false
 * crossmatch.pairing.max-island-size=14
 * crossmatch.pairing.oversized-island-policy=FAIL
 * crossmatch.pairing.chunk-count=20
 * crossmatch.pairing.pool-size=8
 * </pre>
 *
 * <p>{@code pool-size} defaults to the number of available processors.</p>
 */
@ApplicationScoped
public class PairingEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(PairingEngineProducer.class);

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.photometry.enabled", defaultValue = "false")
    boolean photometryEnabled;

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.perturbation.enabled", defaultValue = "false")
    boolean perturbationEnabled;

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.max-island-size", defaultValue = "14")
    int maxIslandSize;

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.oversized-island-policy", defaultValue = "FAIL")
    String oversizedIslandPolicy;

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.chunk-count", defaultValue = "20")
    int chunkCount;

    @Inject
    @ConfigProperty(name = "crossmatch.pairing.pool-size")
    Optional<Integer> poolSize;

    @Produces
    @ApplicationScoped
    public PairingOptions pairingOptions() {
        PairingOptions.Builder builder = PairingOptions.builder()
                .photometryEnabled(photometryEnabled)
                .perturbationEnabled(perturbationEnabled)
                .oversizedIslandPolicy(policy(oversizedIslandPolicy));
        try {
            builder.maxIslandSize(maxIslandSize).chunkCount(chunkCount);
            poolSize.ifPresent(builder::poolSize);
        } catch (IllegalArgumentException e) {
            throw new PairingConfigurationException("Invalid crossmatch.pairing configuration: " + e.getMessage(), e);
        }
        PairingOptions options = builder.build();
        log.info("pairing.options.configured options={}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public CounterpartPairingEngine pairingEngine(PairingOptions options) {
        log.info("Producing CounterpartPairingEngine");
        return CounterpartPairingEngine.builder()
                .options(options)
                .build();
    }

    public void closeEngine(@Disposes CounterpartPairingEngine engine) {
        log.info("Closing CounterpartPairingEngine");
        engine.close();
    }

    private static OversizedIslandPolicy policy(String value) {
        try {
            return OversizedIslandPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new PairingConfigurationException("Unknown oversized-island-policy '" + value
                    + "', expected FAIL or FLAG", e);
        }
    }
}
