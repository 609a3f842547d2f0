package io.github.drompincen.ledgersync.persistence.document;

import io.github.drompincen.ledgersync.protocol.api.TaskStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Document(collection = "tasks")
@CompoundIndexes({
        @CompoundIndex(name = "owner_serverUpdatedAt", def = "{'ownerId': 1, 'serverUpdatedAt': 1}"),
        @CompoundIndex(name = "owner_updatedAt", def = "{'ownerId': 1, 'updatedAt': 1}"),
        @CompoundIndex(name = "owner_linkedDevice", def = "{'ownerId': 1, 'linkedDeviceId': 1}"),
        @CompoundIndex(name = "owner_humanRef", def = "{'ownerId': 1, 'humanRef': 1}")
})
public class LedgerTaskDocument {

    @Id
    private String id;
    private String ownerId;
    private String title;
    private TaskStatus status;
    private Long dueAt;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant serverUpdatedAt;
    private Instant completedAt;
    @Indexed(expireAfterSeconds = 0)
    private Instant deleteAfter;

    private String linkedDeviceId;
    private String deviceListId;
    private String deviceListName;
    private Instant deviceMissingAt;
    private String humanRef;

    private String parentId;
    private String groupId;
    private String sprintId;
    private String category;
    private List<String> tags;
    private Integer priority;

    private String duplicateOf;
    private String duplicateKey;
    private String sourceRef;
    private String externalId;
    private String deviceAltId;

    private Map<String, Object> recurrence;
    private String itemType;
    private String persona;
    private String source;

    private Boolean deleted;
    private String syncDirective;
    private String convertedToStoryId;

    public LedgerTaskDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }

    public Long getDueAt() { return dueAt; }
    public void setDueAt(Long dueAt) { this.dueAt = dueAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getServerUpdatedAt() { return serverUpdatedAt; }
    public void setServerUpdatedAt(Instant serverUpdatedAt) { this.serverUpdatedAt = serverUpdatedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getDeleteAfter() { return deleteAfter; }
    public void setDeleteAfter(Instant deleteAfter) { this.deleteAfter = deleteAfter; }

    public String getLinkedDeviceId() { return linkedDeviceId; }
    public void setLinkedDeviceId(String linkedDeviceId) { this.linkedDeviceId = linkedDeviceId; }

    public String getDeviceListId() { return deviceListId; }
    public void setDeviceListId(String deviceListId) { this.deviceListId = deviceListId; }

    public String getDeviceListName() { return deviceListName; }
    public void setDeviceListName(String deviceListName) { this.deviceListName = deviceListName; }

    public Instant getDeviceMissingAt() { return deviceMissingAt; }
    public void setDeviceMissingAt(Instant deviceMissingAt) { this.deviceMissingAt = deviceMissingAt; }

    public String getHumanRef() { return humanRef; }
    public void setHumanRef(String humanRef) { this.humanRef = humanRef; }

    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }

    public String getGroupId() { return groupId; }
    public void setGroupId(String groupId) { this.groupId = groupId; }

    public String getSprintId() { return sprintId; }
    public void setSprintId(String sprintId) { this.sprintId = sprintId; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public List<String> getTags() { return tags; }
    public void setTags(List<String> tags) { this.tags = tags; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public String getDuplicateOf() { return duplicateOf; }
    public void setDuplicateOf(String duplicateOf) { this.duplicateOf = duplicateOf; }

    public String getDuplicateKey() { return duplicateKey; }
    public void setDuplicateKey(String duplicateKey) { this.duplicateKey = duplicateKey; }

    public String getSourceRef() { return sourceRef; }
    public void setSourceRef(String sourceRef) { this.sourceRef = sourceRef; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }

    public String getDeviceAltId() { return deviceAltId; }
    public void setDeviceAltId(String deviceAltId) { this.deviceAltId = deviceAltId; }

    public Map<String, Object> getRecurrence() { return recurrence; }
    public void setRecurrence(Map<String, Object> recurrence) { this.recurrence = recurrence; }

    public String getItemType() { return itemType; }
    public void setItemType(String itemType) { this.itemType = itemType; }

    public String getPersona() { return persona; }
    public void setPersona(String persona) { this.persona = persona; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public Boolean getDeleted() { return deleted; }
    public void setDeleted(Boolean deleted) { this.deleted = deleted; }

    public String getSyncDirective() { return syncDirective; }
    public void setSyncDirective(String syncDirective) { this.syncDirective = syncDirective; }

    public String getConvertedToStoryId() { return convertedToStoryId; }
    public void setConvertedToStoryId(String convertedToStoryId) { this.convertedToStoryId = convertedToStoryId; }

    /** Status with a missing value read as open. */
    public TaskStatus effectiveStatus() {
        return status != null ? status : TaskStatus.OPEN;
    }

    public boolean markedDuplicate() {
        return duplicateOf != null && !duplicateOf.isBlank();
    }

    /** The reference shown to users: the human ref when assigned, otherwise the document id. */
    public String displayRef() {
        return humanRef != null && !humanRef.isBlank() ? humanRef : id;
    }

    public List<String> tagsOrEmpty() {
        return tags != null ? tags : new ArrayList<>();
    }
}
