package io.github.drompincen.ledgersync.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PersonaTest {

    @Test
    void parseIsLenient() {
        assertThat(Persona.parse(" WORK ")).isEqualTo(Persona.WORK);
        assertThat(Persona.parse("Personal")).isEqualTo(Persona.PERSONAL);
        assertThat(Persona.parse("other")).isEqualTo(Persona.UNKNOWN);
        assertThat(Persona.parse(null)).isEqualTo(Persona.UNKNOWN);
    }

    @Test
    void wireNameIsLowerCase() {
        assertThat(Persona.PERSONAL.wireName()).isEqualTo("personal");
    }
}
