package io.github.drompincen.ledgersync.protocol.api;

/**
 * Outcome of routing an incoming device item.
 *
 * @param source one of {@code tag}, {@code remote}, {@code heuristic}, {@code disabled}
 */
public record TriageClassification(
        Persona persona,
        double confidence,
        String source,
        String suggestedCategory
) {
    public static TriageClassification disabled() {
        return new TriageClassification(Persona.UNKNOWN, 0.0, "disabled", null);
    }

    public boolean isWork() {
        return persona == Persona.WORK;
    }

    public boolean isPersonal() {
        return persona == Persona.PERSONAL;
    }
}
