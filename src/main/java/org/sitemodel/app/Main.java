package org.sitemodel.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.sitemodel.core.PreparationResult;
import org.sitemodel.core.PreparationTelemetry;
import org.sitemodel.core.SiteModelConfig;
import org.sitemodel.core.SiteModelException;
import org.sitemodel.core.SiteModelPreparer;
import org.sitemodel.params.SoilRegressions;
import org.sitemodel.params.Vs30MeasuredPolicy;
import org.sitemodel.sites.SiteInputReader;
import org.sitemodel.sites.SiteSources;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: associates Vs30 samples with exposure or site locations and
 * writes a site-model CSV.
 *
 * <p>Example: {@code prepare-site-model -e exposure.csv -g 5 -a 10 --z1pt0 -o site_model.csv vs30_a.csv vs30_b.csv}</p>
 */
@CommandLine.Command(name = "prepare-site-model",
    mixinStandardHelpOptions = true,
    description = "Associate ground-parameter samples (lon,lat,vs30) with hazard sites and write a site model")
public class Main implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(Main.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_ERROR = 2;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "VS30_FILE",
        description = "Headerless lon,lat,value files; earlier files win ties")
    private List<Path> groundParameterFiles = new ArrayList<>();

    @CommandLine.Option(names = {"-e", "--exposure"},
        description = "Exposure CSV with lon and lat columns; repeatable")
    private List<Path> exposureFiles = new ArrayList<>();

    @CommandLine.Option(names = {"-s", "--sites"}, description = "Site CSV with lon,lat[,id] rows")
    private Path sitesFile;

    @CommandLine.Option(names = {"-g", "--grid-spacing"}, defaultValue = "0",
        description = "Grid spacing in km; 0 keeps the exact locations (default: ${DEFAULT-VALUE})")
    private double gridSpacingKm;

    @CommandLine.Option(names = {"-a", "--assoc-distance"}, defaultValue = "5",
        description = "Sites farther than this (km) from every sample are discarded (default: ${DEFAULT-VALUE})")
    private double assocDistanceKm;

    @CommandLine.Option(names = {"--advisory-distance"},
        description = "Report kept sites farther than this (km) from their sample")
    private Double advisoryDistanceKm;

    @CommandLine.Option(names = {"--z1pt0"}, description = "Add a z1pt0 column")
    private boolean z1pt0;

    @CommandLine.Option(names = {"--z2pt5"}, description = "Add a z2pt5 column")
    private boolean z2pt5;

    @CommandLine.Option(names = {"--vs30measured"}, description = "Add a vs30measured column")
    private boolean vs30measured;

    @CommandLine.Option(names = {"--measured-source"},
        description = "Ground-parameter file holding measured (not inferred) values; repeatable")
    private List<Path> measuredSources = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, defaultValue = "site_model.csv",
        description = "Output CSV (default: ${DEFAULT-VALUE})")
    private Path output = Paths.get("site_model.csv");

    @CommandLine.Option(names = {"-j", "--parallelism"}, defaultValue = "1",
        description = "Worker threads for association (default: ${DEFAULT-VALUE})")
    private int parallelism = 1;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Launches the command and exits with its status.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the command without exiting the JVM.
     *
     * @return process exit code.
     */
    static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (exposureFiles.isEmpty() && sitesFile == null) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "at least one of --exposure or --sites is required");
        }

        try {
            SiteModelPreparer preparer = new SiteModelPreparer(
                SoilRegressions.CHIOU_YOUNGS_2014_Z1PT0,
                SoilRegressions.CAMPBELL_BOZORGNIA_2014_Z2PT5,
                measuredPolicy()
            );
            PreparationResult result = preparer.prepareAndWrite(
                normalized(groundParameterFiles),
                readSources(),
                SiteModelConfig.builder()
                    .deriveZ1pt0(z1pt0)
                    .deriveZ2pt5(z2pt5)
                    .deriveVs30Measured(vs30measured)
                    .gridSpacingKm(gridSpacingKm)
                    .maxAssociationDistanceKm(assocDistanceKm)
                    .advisoryDistanceKm(advisoryDistanceKm)
                    .parallelism(parallelism)
                    .build(),
                output
            );
            PreparationTelemetry telemetry = result.telemetry();
            out.printf("Wrote %d sites to %s (%d discarded, %d ground-parameter points)%n",
                telemetry.acceptedCount(), output, telemetry.discardedCount(), telemetry.pointCount());
            out.flush();
            return EXIT_SUCCESS;
        } catch (SiteModelException e) {
            logger.error("prepare-site-model failed: {}", e.getMessage(), e);
            err.println(e.getMessage());
            err.flush();
            return EXIT_ERROR;
        }
    }

    private SiteSources readSources() {
        SiteSources.SiteSourcesBuilder sources = SiteSources.builder();
        if (sitesFile != null) {
            sources.explicitSites(SiteInputReader.readSites(sitesFile));
        }
        for (Path exposure : exposureFiles) {
            sources.assetLocations(SiteInputReader.readExposure(exposure));
        }
        return sources.build();
    }

    private Vs30MeasuredPolicy measuredPolicy() {
        if (measuredSources.isEmpty()) {
            return Vs30MeasuredPolicy.alwaysInferred();
        }
        if (!vs30measured) {
            logger.warn("--measured-source has no effect without --vs30measured");
        }
        Set<String> names = new LinkedHashSet<>();
        for (Path source : normalized(measuredSources)) {
            names.add(source.toString());
        }
        return Vs30MeasuredPolicy.measuredSources(names);
    }

    private static List<Path> normalized(List<Path> paths) {
        List<Path> normalized = new ArrayList<>(paths.size());
        for (Path path : paths) {
            normalized.add(path.toAbsolutePath().normalize());
        }
        return normalized;
    }
}
