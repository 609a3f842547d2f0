package io.github.drompincen.ledgersync.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskStatusTest {

    @Test
    void decodesNumericCodes() {
        assertThat(TaskStatus.decode(0)).isEqualTo(TaskStatus.OPEN);
        assertThat(TaskStatus.decode(1)).isEqualTo(TaskStatus.OPEN);
        assertThat(TaskStatus.decode(2L)).isEqualTo(TaskStatus.DONE);
        assertThat(TaskStatus.decode(-1)).isEqualTo(TaskStatus.DELETED);
    }

    @Test
    void decodesStringsAndBooleans() {
        assertThat(TaskStatus.decode(" Completed ")).isEqualTo(TaskStatus.DONE);
        assertThat(TaskStatus.decode("done")).isEqualTo(TaskStatus.DONE);
        assertThat(TaskStatus.decode("deleted")).isEqualTo(TaskStatus.DELETED);
        assertThat(TaskStatus.decode("in-progress")).isEqualTo(TaskStatus.OPEN);
        assertThat(TaskStatus.decode(true)).isEqualTo(TaskStatus.DONE);
    }

    @Test
    void missingStatusIsOpen() {
        assertThat(TaskStatus.decode(null)).isEqualTo(TaskStatus.OPEN);
    }

    @Test
    void noteValueOnlyDistinguishesOpen() {
        assertThat(TaskStatus.OPEN.noteValue()).isEqualTo("open");
        assertThat(TaskStatus.DONE.noteValue()).isEqualTo("complete");
        assertThat(TaskStatus.DELETED.noteValue()).isEqualTo("complete");
    }
}
