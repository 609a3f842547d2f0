package io.github.drompincen.ledgersync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/** A category and the device list its tasks are placed in. */
@Document(collection = "themes")
public class ThemeDocument {

    @Id
    private String id;
    @Indexed
    private String ownerId;
    private String name;
    private String deviceListName;

    public ThemeDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDeviceListName() { return deviceListName; }
    public void setDeviceListName(String deviceListName) { this.deviceListName = deviceListName; }
}
