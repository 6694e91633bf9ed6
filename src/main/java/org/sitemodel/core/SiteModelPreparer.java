package org.sitemodel.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.output.SiteModelTableWriter;
import org.sitemodel.output.SiteRecord;
import org.sitemodel.params.AuxiliaryParameterDeriver;
import org.sitemodel.params.SoilParameterRegression;
import org.sitemodel.params.SoilRegressions;
import org.sitemodel.params.Vs30MeasuredPolicy;
import org.sitemodel.points.GroundParameterSet;
import org.sitemodel.points.PointSetLoader;
import org.sitemodel.policy.AcceptanceFilter;
import org.sitemodel.spatial.AssociationResult;
import org.sitemodel.spatial.NearestNeighborAssociator;
import org.sitemodel.sites.SiteSourceBuilder;
import org.sitemodel.sites.SiteSources;
import org.sitemodel.sites.TargetSite;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Site-model preparation pipeline.
 *
 * <p>Stages: build target sites, associate each with its nearest ground-parameter point,
 * drop associations beyond the configured distance, derive the requested auxiliary fields.
 * The preparer holds only the injected derivation strategies and may be shared across runs.</p>
 */
public final class SiteModelPreparer {
    private static final Logger logger = LogManager.getLogger(SiteModelPreparer.class);

    private final SoilParameterRegression z1pt0Regression;
    private final SoilParameterRegression z2pt5Regression;
    private final Vs30MeasuredPolicy vs30MeasuredPolicy;

    /**
     * Creates a preparer with the default regressions and an always-inferred vs30measured flag.
     */
    public SiteModelPreparer() {
        this(
                SoilRegressions.CHIOU_YOUNGS_2014_Z1PT0,
                SoilRegressions.CAMPBELL_BOZORGNIA_2014_Z2PT5,
                Vs30MeasuredPolicy.alwaysInferred()
        );
    }

    public SiteModelPreparer(
            SoilParameterRegression z1pt0Regression,
            SoilParameterRegression z2pt5Regression,
            Vs30MeasuredPolicy vs30MeasuredPolicy
    ) {
        this.z1pt0Regression = Objects.requireNonNull(z1pt0Regression, "z1pt0Regression");
        this.z2pt5Regression = Objects.requireNonNull(z2pt5Regression, "z2pt5Regression");
        this.vs30MeasuredPolicy = Objects.requireNonNull(vs30MeasuredPolicy, "vs30MeasuredPolicy");
    }

    /**
     * Prepares site records from an already loaded point set.
     *
     * @throws NoPointsAvailableException when {@code points} is empty.
     * @throws EmptyInputException when no target site can be built.
     */
    public PreparationResult prepare(GroundParameterSet points, SiteSources sources, SiteModelConfig config) {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(config, "config");
        config.validate();

        long startNanos = System.nanoTime();
        NearestNeighborAssociator associator = new NearestNeighborAssociator(points);
        List<TargetSite> targets = SiteSourceBuilder.build(sources, config.getGridSpacingKm());

        List<AssociationResult> associations = associator.associateAll(targets, config.getParallelism());
        AcceptanceFilter.Outcome outcome = AcceptanceFilter.apply(associations, config.acceptancePolicy());

        AuxiliaryParameterDeriver deriver = AuxiliaryParameterDeriver.builder()
                .deriveZ1pt0(config.isDeriveZ1pt0())
                .deriveZ2pt5(config.isDeriveZ2pt5())
                .deriveVs30Measured(config.isDeriveVs30Measured())
                .z1pt0Regression(z1pt0Regression)
                .z2pt5Regression(z2pt5Regression)
                .vs30MeasuredPolicy(vs30MeasuredPolicy)
                .build();

        List<SiteRecord> records = new ArrayList<>(outcome.accepted().size());
        double maxAcceptedDistanceKm = 0.0d;
        for (AssociationResult accepted : outcome.accepted()) {
            records.add(deriver.derive(accepted));
            maxAcceptedDistanceKm = Math.max(maxAcceptedDistanceKm, accepted.distanceKm());
        }

        int discarded = (int) outcome.discardedCount();
        PreparationTelemetry telemetry = new PreparationTelemetry(
                points.size(),
                points.sourceFiles().size(),
                sources.coordinateCount(),
                targets.size(),
                records.size(),
                discarded,
                outcome.warnings().size() - discarded,
                maxAcceptedDistanceKm,
                System.nanoTime() - startNanos
        );
        if (discarded > 0) {
            logger.warn("Discarded {} of {} sites farther than {} km from any ground-parameter point",
                    discarded, targets.size(), config.getMaxAssociationDistanceKm());
        }
        logger.info("Associated {} sites to {} ground-parameter points (max distance {} km)",
                records.size(), points.size(), maxAcceptedDistanceKm);
        return new PreparationResult(deriver.columns(), List.copyOf(records), outcome.warnings(), telemetry);
    }

    /**
     * Loads the ground-parameter files, prepares the site model and writes it to {@code output}.
     */
    public PreparationResult prepareAndWrite(
            List<Path> groundParameterFiles,
            SiteSources sources,
            SiteModelConfig config,
            Path output
    ) {
        Objects.requireNonNull(output, "output");
        GroundParameterSet points = PointSetLoader.load(groundParameterFiles);
        PreparationResult result = prepare(points, sources, config);
        SiteModelTableWriter.write(output, result.columns(), result.records());
        return result;
    }
}
