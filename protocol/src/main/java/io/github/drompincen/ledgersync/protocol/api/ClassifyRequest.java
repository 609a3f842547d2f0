package io.github.drompincen.ledgersync.protocol.api;

import java.util.List;

public record ClassifyRequest(String title, String notes, List<String> tags) {}
