package io.github.drompincen.ledgersync.runtime.device;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDeviceStoreTest {

    private final InMemoryDeviceStore store =
            new InMemoryDeviceStore(Clock.fixed(Instant.parse("2024-02-02T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void ensureListIgnoresCaseAndDefaultsBlankName() {
        DeviceList work = store.ensureList("Work");

        assertThat(store.ensureList(" work ")).isEqualTo(work);
        assertThat(store.ensureList("").name()).isEqualTo("Reminders");
        assertThat(store.lists()).hasSize(2);
    }

    @Test
    void readsAreCopies() {
        DeviceItem created = store.create(new DeviceItem("Water plants"), store.ensureList("Home"));
        DeviceItem read = store.find(created.getId()).orElseThrow();

        read.setTitle("changed");

        assertThat(store.find(created.getId()).orElseThrow().getTitle()).isEqualTo("Water plants");
    }

    @Test
    void moveChangesListAndKeepsId() {
        DeviceItem created = store.create(new DeviceItem("Fix bug"), store.ensureList("Inbox"));
        DeviceList work = store.ensureList("Work");

        DeviceItem moved = store.move(created, work);

        assertThat(moved.getId()).isEqualTo(created.getId());
        assertThat(moved.getListName()).isEqualTo("Work");
        assertThat(moved.getListId()).isEqualTo(work.id());
    }

    @Test
    void savingUnknownItemFails() {
        DeviceItem ghost = new DeviceItem("ghost");
        ghost.setId("NOPE");

        assertThatThrownBy(() -> store.save(ghost)).isInstanceOf(DeviceStoreException.class);
    }
}
