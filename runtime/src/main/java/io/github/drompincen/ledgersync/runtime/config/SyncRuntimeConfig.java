package io.github.drompincen.ledgersync.runtime.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.ledgersync.runtime.device.DeviceStore;
import io.github.drompincen.ledgersync.runtime.device.InMemoryDeviceStore;
import io.github.drompincen.ledgersync.runtime.device.JsonFileDeviceStore;
import io.github.drompincen.ledgersync.runtime.note.NoteCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncRuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncRuntimeConfig.class);

    static final int CONTEXT_THREADS = 4;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoteCodec noteCodec(SyncProperties properties) {
        return new NoteCodec(properties.getDeepLinkBase());
    }

    /** Bounded pool for the story, goal and sprint chunk reads of a pass. */
    @Bean(name = "contextExecutor", destroyMethod = "shutdown")
    public ExecutorService contextExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(CONTEXT_THREADS, r -> {
            Thread t = new Thread(r, "ledgersync-context-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public DeviceStore deviceStore(SyncProperties properties, ObjectMapper objectMapper, Clock clock) {
        SyncProperties.DeviceStore config = properties.getDeviceStore();
        if ("file".equalsIgnoreCase(config.getType())) {
            log.info("Using file-backed device store at {}", config.getPath());
            return new JsonFileDeviceStore(Path.of(config.getPath()), objectMapper, clock);
        }
        log.info("Using in-memory device store");
        return new InMemoryDeviceStore(clock);
    }
}
