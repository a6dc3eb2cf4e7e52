package tech.keyledger.app;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.keyledger.activation.hostname.ExemptDomainMatcher;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.security.secrets.ServerSecrets;

/**
 * keyledger startup handler.
 *
 * <p>Touches {@link ServerSecrets} on start so that secret provisioning runs, and fails,
 * before the first request instead of on it.
 */
@ApplicationScoped
public class AppStartup {

    private static final Logger LOG = Logger.getLogger(AppStartup.class);

    @Inject
    ServerSecrets secrets;

    @Inject
    ExemptDomainMatcher exemptMatcher;

    @Inject
    LicensingConfig config;

    void onStart(@Observes StartupEvent event) {
        secrets.hashSalt();
        LOG.infof("keyledger started: exempt patterns %s, exempt bypasses grace=%s, rate limiting %s",
            exemptMatcher.patterns(),
            config.domains().exemptBypassesGrace(),
            config.rateLimit().enabled() ? "enabled" : "disabled");
    }

    void onShutdown(@Observes ShutdownEvent event) {
        LOG.info("keyledger shutdown");
    }
}
