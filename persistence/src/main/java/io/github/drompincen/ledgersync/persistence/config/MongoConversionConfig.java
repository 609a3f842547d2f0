package io.github.drompincen.ledgersync.persistence.config;

import io.github.drompincen.ledgersync.persistence.convert.TaskStatusConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

@Configuration
public class MongoConversionConfig {

    @Bean
    MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(TaskStatusConverters.all());
    }
}
