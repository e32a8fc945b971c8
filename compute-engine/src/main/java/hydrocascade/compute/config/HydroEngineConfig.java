package hydrocascade.compute.config;

import hydrocascade.factory.CascadeTopologyLoader;
import hydrocascade.io.JsonFileHandler;
import hydrocascade.physics.model.SyntheticInflowGenerator;
import hydrocascade.physics.policy.ReleasePolicy;
import hydrocascade.physics.policy.RuleCurveReleasePolicy;
import hydrocascade.physics.simulator.MassBalanceCalculator;
import hydrocascade.physics.simulator.TopologyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the physics engine (plain Java objects) into the Spring context.
 * One registry and one calculator per application context.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(HydroProperties.class)
public class HydroEngineConfig {

    @Bean
    public TopologyRegistry topologyRegistry() {
        return new TopologyRegistry();
    }

    @Bean
    public ReleasePolicy releasePolicy(HydroProperties properties) {
        RuleCurveReleasePolicy policy = new RuleCurveReleasePolicy(properties.policy().toParameters());
        log.info("Release policy configured: {}", policy.getParameters());
        return policy;
    }

    @Bean
    public MassBalanceCalculator massBalanceCalculator(TopologyRegistry registry, ReleasePolicy releasePolicy) {
        return new MassBalanceCalculator(registry, releasePolicy);
    }

    @Bean
    public CascadeTopologyLoader cascadeTopologyLoader(TopologyRegistry registry) {
        return new CascadeTopologyLoader(registry);
    }

    @Bean
    public SyntheticInflowGenerator syntheticInflowGenerator() {
        return new SyntheticInflowGenerator();
    }

    @Bean
    public JsonFileHandler jsonFileHandler() {
        return new JsonFileHandler();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
