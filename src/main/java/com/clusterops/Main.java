package com.clusterops;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.clusterops.atlas.AtlasApiClient;
import com.clusterops.atlas.AtlasAuditingFeature;
import com.clusterops.atlas.AtlasClusterProvider;
import com.clusterops.aws.RdsClusterProvider;
import com.clusterops.orchestrator.OrchestratorConfig;
import com.clusterops.orchestrator.ProvisioningService;
import com.clusterops.orchestrator.RequestRejectedException;
import com.clusterops.orchestrator.RequestStatus;
import com.clusterops.provider.AuxiliaryFeature;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.DisabledFeature;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import java.util.List;
import java.util.Properties;

public class Main {
    final static Logger LOG = LogManager.getLogger(Main.class);

    public static void main(String[] argv) throws Exception {
        // parse command line args
        Args args = new Args();
        JCommander jc = JCommander.newBuilder()
                .addObject(args)
                .programName("cluster-orchestrator")
                .build();
        try {
            jc.parse(argv);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            System.exit(2);
        }
        //This is the root logger provided by log4j
        Logger rootLogger = Logger.getRootLogger();
        rootLogger.setLevel(args.verbose ? Level.DEBUG : Level.INFO);
        //Define log pattern layout
        PatternLayout layout = new PatternLayout("%d{ISO8601} [%t] %-5p %c %x - %m%n");
        //Add console appender to root logger
        rootLogger.addAppender(new ConsoleAppender(layout));
        // quartz is chatty at INFO
        Logger.getLogger("org.quartz").setLevel(Level.WARN);

        if (args.help) {
            jc.usage();
            System.exit(0);
        }
        // load config file if specified and override defaults
        OrchestratorConfig config;
        if (args.propertiesFile != null) {
            LOG.info("Reading properties from " + args.propertiesFile);
            config = OrchestratorConfig.load(args.propertiesFile);
        } else {
            config = new OrchestratorConfig();
        }

        ClusterProvider provider = providerFor(config);
        ProvisioningService service = new ProvisioningService(config, provider, featureFor(config));
        Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "shutdown"));
        service.start();

        try {
            if (args.clear) {
                service.clearAll();
                System.exit(0);
            }
            if (args.cancelId != null) {
                service.cancel(args.cancelId, args.comment);
            }
            if (args.name != null) {
                String id = service.create(args.name, args.tier);
                LOG.info("Submitted " + args.name + " as " + id);
            }
        } catch (RequestRejectedException e) {
            LOG.error(e.getMessage());
            System.exit(1);
        }
        follow(service, config.getPollIntervalMillis());
        System.exit(0);
    }

    // log every unfinished request until none is left
    static void follow(ProvisioningService service, long intervalMillis) throws InterruptedException {
        while (true) {
            List<RequestStatus> all = service.list();
            int active = 0;
            for (RequestStatus s : all) {
                if (!s.getState().isTerminal()) {
                    active++;
                }
                LOG.info(s);
            }
            if (active == 0) {
                LOG.info("No active requests, exiting");
                return;
            }
            Thread.sleep(intervalMillis);
        }
    }

    static ClusterProvider providerFor(OrchestratorConfig config) {
        Properties params = config.asProperties();
        String type = config.getProviderType();
        if ("atlas".equalsIgnoreCase(type)) {
            return new AtlasClusterProvider(params);
        }
        if ("rds".equalsIgnoreCase(type)) {
            return new RdsClusterProvider(params);
        }
        throw new IllegalArgumentException("Unknown provider.type '" + type + "' (expected atlas or rds)");
    }

    static AuxiliaryFeature featureFor(OrchestratorConfig config) {
        String type = config.getFeatureType();
        if ("none".equalsIgnoreCase(type)) {
            return new DisabledFeature();
        }
        if ("auditing".equalsIgnoreCase(type)) {
            if ("atlas".equalsIgnoreCase(config.getProviderType())) {
                return new AtlasAuditingFeature(new AtlasApiClient(config.asProperties()));
            }
            LOG.warn("Auditing is only available for Atlas, no post-ready feature for " + config.getProviderType());
            return new DisabledFeature();
        }
        throw new IllegalArgumentException("Unknown feature.type '" + type + "' (expected auditing or none)");
    }
}

class Args {
    // in the help output from usage(), options are printed in order of long option name
    @Parameter(names = {"-p", "--properties"}, description = "Properties file (java.util.Properties format) (if omitted, use defaults for all settings)")
    public String propertiesFile = null;
    @Parameter(names = {"-n", "--name"}, description = "Create a cluster with this name")
    public String name = null;
    @Parameter(names = {"-t", "--tier"}, description = "Tier for --name: SMALL, MEDIUM or LARGE (M10/M20/M30 also accepted)")
    public String tier = "SMALL";
    @Parameter(names = {"-c", "--cancel"}, description = "Cancel the request with this id")
    public String cancelId = null;
    @Parameter(names = {"-m", "--comment"}, description = "Reason recorded with --cancel")
    public String comment = null;
    @Parameter(names = {"--clear"}, description = "Forget all tracked requests and delete the snapshot file")
    public boolean clear = false;
    @Parameter(names = {"-v", "--verbose"}, description = "Debug logging")
    public boolean verbose = false;
    @Parameter(names = {"-?", "--help"}, help = true, description = "Print this message")
    public boolean help;
}
