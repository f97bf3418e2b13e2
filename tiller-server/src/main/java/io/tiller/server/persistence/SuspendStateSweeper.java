package io.tiller.server.persistence;

import io.quarkus.scheduler.Scheduled;
import io.tiller.core.TillerEnvironment;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Scheduled job that purges expired suspend states from the durable tier.
///
/// Expired states are already invisible to reads, so the sweep only reclaims
/// space. A failed sweep is logged and retried on the next tick.
///
/// ### Configuration
/// | Property                        | Default | Description                       |
/// |---------------------------------|---------|-----------------------------------|
/// | `tiller.suspend.sweep-interval` | `60s`   | How often expired rows are purged |
///
/// @implNote Thread-safe. Stateless apart from the injected environment.
@ApplicationScoped
public class SuspendStateSweeper {

    private static final Logger LOG = Logger.getLogger(SuspendStateSweeper.class);

    private final TillerEnvironment environment;

    @Inject
    public SuspendStateSweeper(TillerEnvironment environment) {
        this.environment = environment;
    }

    @Scheduled(every = "${tiller.suspend.sweep-interval:60s}")
    void tick() {
        try {
            int purged = environment.getSuspendRepository().purgeExpired();
            if (purged > 0) {
                LOG.infov("Purged {0} expired suspend state(s)", purged);
            }
        } catch (RuntimeException e) {
            LOG.errorv(e, "Failed to purge expired suspend states");
        }
    }
}
