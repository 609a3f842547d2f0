package io.github.drompincen.ledgersync.runtime.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Device store persisted as one JSON document on the local disk. Every change rewrites
 * the file through a temporary sibling so a crash never leaves it half-written.
 */
public class JsonFileDeviceStore extends InMemoryDeviceStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileDeviceStore.class);

    record Snapshot(List<DeviceList> lists, List<DeviceItem> items) {}

    private final Path path;
    private final ObjectMapper objectMapper;
    private boolean loading;

    public JsonFileDeviceStore(Path path, ObjectMapper objectMapper, Clock clock) {
        super(clock);
        this.path = path;
        this.objectMapper = objectMapper;
        load();
    }

    private synchronized void load() {
        if (!Files.exists(path)) {
            log.info("Device store {} does not exist yet, starting empty", path);
            return;
        }
        try {
            Snapshot snapshot = objectMapper.readValue(path.toFile(), Snapshot.class);
            loading = true;
            if (snapshot.lists() != null) snapshot.lists().forEach(l -> lists.put(l.id(), l));
            if (snapshot.items() != null) snapshot.items().forEach(i -> items.put(i.getId(), i));
            log.info("Loaded {} device items in {} lists from {}", items.size(), lists.size(), path);
        } catch (IOException e) {
            throw new DeviceStoreException("Cannot read device store " + path, e);
        } finally {
            loading = false;
        }
    }

    @Override
    protected synchronized void changed() {
        if (loading) return;
        Snapshot snapshot = new Snapshot(new ArrayList<>(lists.values()), new ArrayList<>(items.values()));
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new DeviceStoreException("Cannot write device store " + path, e);
        }
    }
}
