package io.github.drompincen.ledgersync.runtime.device;

public record DeviceList(String id, String name) {}
