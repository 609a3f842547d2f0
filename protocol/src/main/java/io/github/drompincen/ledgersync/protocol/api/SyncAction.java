package io.github.drompincen.ledgersync.protocol.api;

public enum SyncAction {
    IMPORT_ITEM("importItem"),
    CREATE_DEVICE_ITEM("createDeviceItem"),
    REPAIR_METADATA("repairMetadata"),
    RELINK_DEVICE_ITEM("relinkDeviceItem"),
    SUPPRESS_DEVICE_DUPLICATE("suppressDeviceDuplicate"),
    UPDATE_FROM_DEVICE("updateFromDevice"),
    UPDATE_DEVICE_FROM_LEDGER("updateDeviceFromLedger"),
    COMPLETE_DUPLICATE("completeDuplicate"),
    DELETE_DUPLICATE("deleteDuplicate"),
    CLEAR_MISSING_DEVICE_ITEM("clearMissingDeviceItem"),
    COMPLETE_FROM_LEDGER_DELETE("completeFromLedgerDelete"),
    TTL_REMOVE("ttlRemove"),
    ROUTE_WORK("routeWork"),
    ROUTE_PERSONAL("routePersonal"),
    SKIP_CLAIMED("skipClaimed");

    private final String wireName;

    SyncAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
