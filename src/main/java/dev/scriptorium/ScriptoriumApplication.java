package dev.scriptorium;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Scriptorium ingestion tool.
 *
 * <p>Runs as a non-web Spring application: {@link dev.scriptorium.cli.IngestCommand} ingests the
 * URL given on the command line and the process exits with the command's exit code.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class ScriptoriumApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ScriptoriumApplication.class, args)));
    }
}
