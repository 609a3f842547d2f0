package io.github.drompincen.ledgersync.persistence;

import io.github.drompincen.ledgersync.persistence.config.MongoConversionConfig;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@Configuration
@EnableAutoConfiguration
@Import(MongoConversionConfig.class)
@EnableMongoRepositories(basePackages = "io.github.drompincen.ledgersync.persistence.repository")
public class TestMongoConfiguration {

    static {
        // Flapdoodle has no arm64 build for every MongoDB version; the x86_64 one runs under emulation.
        String arch = System.getProperty("os.arch", "");
        if (arch.equals("aarch64") || arch.equals("arm64")) {
            System.setProperty("os.arch", "amd64");
        }
    }
}
