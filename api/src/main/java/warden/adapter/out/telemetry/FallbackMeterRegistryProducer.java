package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.quarkus.arc.DefaultBean;
import org.jboss.logging.Logger;

/**
 * In-memory {@link MeterRegistry} for {@link MicrometerAuthMetrics} and the JWKS
 * cache monitor when no Micrometer registry is installed.
 */
@ApplicationScoped
public class FallbackMeterRegistryProducer {

    private static final Logger LOG = Logger.getLogger(FallbackMeterRegistryProducer.class);

    @Produces
    @Singleton
    @DefaultBean
    public MeterRegistry fallbackMeterRegistry() {
        LOG.debug("No Micrometer registry installed, auth metrics stay in memory");
        return new SimpleMeterRegistry();
    }
}
