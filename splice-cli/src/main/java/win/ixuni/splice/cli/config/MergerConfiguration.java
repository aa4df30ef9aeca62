package win.ixuni.splice.cli.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.splice.core.config.DriverConfig;
import win.ixuni.splice.core.config.SpliceProperties;
import win.ixuni.splice.core.driver.DriverFactory;
import win.ixuni.splice.core.driver.DriverFactoryLoader;
import win.ixuni.splice.core.merge.DriverSource;
import win.ixuni.splice.core.merge.ObjectsMerger;

import java.util.List;

/**
 * Wires the merger to the configured store driver
 * <p>
 * Driver factories are the {@code @Component} beans of the driver modules; every merge gets its own driver
 * instance from the factory matching {@code splice.driver.type}.
 */
@Slf4j
@Configuration
public class MergerConfiguration {

    @Bean
    public DriverSource driverSource(SpliceProperties properties, List<DriverFactory> driverFactories) {
        driverFactories.forEach(factory ->
                log.debug("Found driver factory: {} - {}", factory.getDriverType(), factory.getDescription()));

        DriverConfig config = properties.getDriver();
        DriverFactory factory = DriverFactoryLoader.find(driverFactories, config.getType());
        log.info("Using {} driver '{}'", factory.getDriverType(), config.getName());
        return DriverSource.perCall(factory, config);
    }

    @Bean
    public ObjectsMerger objectsMerger(DriverSource driverSource, SpliceProperties properties) {
        return new ObjectsMerger(driverSource, properties.getMerge());
    }
}
