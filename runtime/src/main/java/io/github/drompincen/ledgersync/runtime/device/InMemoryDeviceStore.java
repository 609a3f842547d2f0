package io.github.drompincen.ledgersync.runtime.device;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Thread-safe device store held in memory; also the base of the file-backed store. */
public class InMemoryDeviceStore implements DeviceStore {

    protected final Map<String, DeviceList> lists = new LinkedHashMap<>();
    protected final Map<String, DeviceItem> items = new LinkedHashMap<>();
    protected final Clock clock;

    public InMemoryDeviceStore(Clock clock) {
        this.clock = clock;
    }

    public InMemoryDeviceStore() {
        this(Clock.systemUTC());
    }

    @Override
    public synchronized List<DeviceList> lists() {
        return new ArrayList<>(lists.values());
    }

    @Override
    public synchronized DeviceList ensureList(String name) {
        String wanted = name == null || name.isBlank() ? "Reminders" : name.trim();
        for (DeviceList list : lists.values()) {
            if (list.name().toLowerCase(Locale.ROOT).equals(wanted.toLowerCase(Locale.ROOT))) return list;
        }
        DeviceList created = new DeviceList(UUID.randomUUID().toString(), wanted);
        lists.put(created.id(), created);
        changed();
        return created;
    }

    @Override
    public synchronized List<DeviceItem> items() {
        List<DeviceItem> snapshot = new ArrayList<>(items.size());
        items.values().forEach(item -> snapshot.add(item.copy()));
        return snapshot;
    }

    @Override
    public synchronized Optional<DeviceItem> find(String itemId) {
        DeviceItem item = items.get(itemId);
        return item == null ? Optional.empty() : Optional.of(item.copy());
    }

    @Override
    public synchronized DeviceItem create(DeviceItem draft, DeviceList list) {
        DeviceItem stored = draft.copy();
        stored.setId(UUID.randomUUID().toString().toUpperCase(Locale.ROOT));
        stored.setListId(list.id());
        stored.setListName(list.name());
        stored.setLastModified(clock.instant());
        lists.putIfAbsent(list.id(), list);
        items.put(stored.getId(), stored);
        changed();
        return stored.copy();
    }

    @Override
    public synchronized DeviceItem save(DeviceItem item) {
        if (item.getId() == null || !items.containsKey(item.getId())) {
            throw new DeviceStoreException("No device item " + item.getId());
        }
        DeviceItem stored = item.copy();
        stored.setLastModified(clock.instant());
        items.put(stored.getId(), stored);
        changed();
        return stored.copy();
    }

    @Override
    public synchronized DeviceItem move(DeviceItem item, DeviceList target) {
        lists.putIfAbsent(target.id(), target);
        DeviceItem moved = item.copy();
        moved.setListId(target.id());
        moved.setListName(target.name());
        return save(moved);
    }

    @Override
    public synchronized void delete(String itemId) {
        if (items.remove(itemId) != null) changed();
    }

    /** Seeds an item without touching its timestamps; for fixtures and imports of existing data. */
    public synchronized DeviceItem put(DeviceItem item) {
        DeviceItem stored = item.copy();
        if (stored.getId() == null) stored.setId(UUID.randomUUID().toString().toUpperCase(Locale.ROOT));
        if (stored.getListName() != null && stored.getListId() == null) {
            stored.setListId(ensureList(stored.getListName()).id());
        }
        if (stored.getLastModified() == null) stored.setLastModified(clock.instant());
        items.put(stored.getId(), stored);
        changed();
        return stored.copy();
    }

    /** Hook for subclasses that persist state. */
    protected void changed() {
    }
}
