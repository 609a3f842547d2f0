package io.github.drompincen.ledgersync.runtime.device;

public class DeviceStoreException extends RuntimeException {

    public DeviceStoreException(String message) {
        super(message);
    }

    public DeviceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
