package io.github.drompincen.ledgersync.runtime.device;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A to-do entry in the local device store. Instances handed out by a {@link DeviceStore}
 * are copies; changes take effect through {@link DeviceStore#save(DeviceItem)}.
 */
public class DeviceItem {

    private String id;
    private String title;
    private boolean completed;
    private Long dueAt;
    private Map<String, Object> recurrence;
    private String notes;
    private String listId;
    private String listName;
    private int priority;
    private Instant lastModified;
    private String url;

    public DeviceItem() {}

    public DeviceItem(String title) {
        this.title = title;
    }

    public DeviceItem copy() {
        DeviceItem c = new DeviceItem();
        c.id = id;
        c.title = title;
        c.completed = completed;
        c.dueAt = dueAt;
        c.recurrence = recurrence == null ? null : new LinkedHashMap<>(recurrence);
        c.notes = notes;
        c.listId = listId;
        c.listName = listName;
        c.priority = priority;
        c.lastModified = lastModified;
        c.url = url;
        return c;
    }

    public boolean recurring() {
        return recurrence != null && !recurrence.isEmpty();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Long getDueAt() { return dueAt; }
    public void setDueAt(Long dueAt) { this.dueAt = dueAt; }

    public Map<String, Object> getRecurrence() { return recurrence; }
    public void setRecurrence(Map<String, Object> recurrence) { this.recurrence = recurrence; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public String getListId() { return listId; }
    public void setListId(String listId) { this.listId = listId; }

    public String getListName() { return listName; }
    public void setListName(String listName) { this.listName = listName; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public Instant getLastModified() { return lastModified; }
    public void setLastModified(Instant lastModified) { this.lastModified = lastModified; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    @Override
    public String toString() {
        return "DeviceItem{" + id + " '" + title + "' list=" + listName + (completed ? " done" : "") + "}";
    }
}
