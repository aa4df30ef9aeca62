package win.ixuni.splice.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.splice.core.config.SpliceProperties;

/**
 * S3Splice command line entry point
 * <p>
 * Runs one merge described by the command line arguments and exits.
 */
@SpringBootApplication(scanBasePackages = "win.ixuni.splice")
@EnableConfigurationProperties(SpliceProperties.class)
public class SpliceApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SpliceApplication.class, args)));
    }
}
