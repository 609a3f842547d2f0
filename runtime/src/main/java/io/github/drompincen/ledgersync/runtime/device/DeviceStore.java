package io.github.drompincen.ledgersync.runtime.device;

import java.util.List;
import java.util.Optional;

/**
 * The local to-do store the engine reconciles against the ledger.
 * Failures surface as {@link DeviceStoreException}.
 */
public interface DeviceStore {

    List<DeviceList> lists();

    /** Finds a list by name, ignoring case, creating it when absent. */
    DeviceList ensureList(String name);

    /** Snapshot of every item in every list. */
    List<DeviceItem> items();

    Optional<DeviceItem> find(String itemId);

    /** Adds a new item to {@code list} and returns it with its assigned id. */
    DeviceItem create(DeviceItem draft, DeviceList list);

    /** Writes back an item previously read from this store. */
    DeviceItem save(DeviceItem item);

    DeviceItem move(DeviceItem item, DeviceList target);

    void delete(String itemId);
}
