package org.permsync.main;

import org.permsync.api.AccessGateway;
import org.permsync.api.DirectoryGateway;
import org.permsync.main.gitlab.GitLabAccessGateway;
import org.permsync.main.gitlab.GitLabClient;
import org.permsync.main.okta.OktaClient;
import org.permsync.main.okta.OktaDirectoryGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        Config config = null;

        try {
            config = new Config(args[0]);
        } catch (Exception e) {
            System.err.println("Usage: Main config/permsync.properties");
            System.exit(1);
        }

        SyncOrchestrator orchestrator;
        Config.Group sync = config.readGroup("sync");

        try {
            Monitoring.setExceptionLogPath(sync.getString("exception_log", "logs/last_exception.log"));
            orchestrator = buildOrchestrator(config);
        } catch (Exception e) {
            throw new RuntimeException("Errors while setting up the sync", e);
        }

        long frequencyMs = sync.getLong("frequency_ms", 0);

        if (frequencyMs > 0) {
            PeriodicSync periodic = new PeriodicSync(frequencyMs, sync.getLong("allowable_failures", 3), orchestrator);
            Runtime.getRuntime().addShutdownHook(new Thread(periodic::shutdown));

            periodic.start();

            try {
                periodic.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else {
            SyncReport report = orchestrator.runPass();

            for (SyncReport.GroupResult result : report.failedGroups()) {
                logger.error("{}", result);
            }

            System.exit(report.isSuccessful() ? 0 : 1);
        }
    }

    static SyncOrchestrator buildOrchestrator(Config config) {
        SyncSettings settings = SyncSettings.fromConfig(config);

        Config.Group oktaConfig = config.readGroup("okta");
        Config.Group gitlabConfig = config.readGroup("gitlab");

        DirectoryGateway directory = new OktaDirectoryGateway(new OktaClient(oktaConfig),
                                                              OktaDirectoryGateway.IdentityAttribute.fromName(oktaConfig.getString("identity_attribute", "id")));

        RateLimiter rateLimiter = new RateLimiter(gitlabConfig.getLong("queries_per_timestep", 300),
                                                  gitlabConfig.getLong("ratelimit_timestep_ms", 60000));

        AccessGateway access = new GitLabAccessGateway(new GitLabClient(gitlabConfig), rateLimiter);

        IdentityCorrelator correlator = new IdentityCorrelator();

        return new SyncOrchestrator(directory,
                                    access,
                                    correlator,
                                    new GroupMapper(settings.getGroupPrefix(), config.mappingOverrides()),
                                    settings);
    }
}
