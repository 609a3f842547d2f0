package io.github.drompincen.ledgersync.persistence.convert;

import io.github.drompincen.ledgersync.protocol.api.TaskStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.util.List;

/**
 * Task status arrives as an integer code from some producers and as a string from others.
 * These converters decode every stored shape into {@link TaskStatus} on read and always
 * write the integer code.
 */
public final class TaskStatusConverters {

    private TaskStatusConverters() {}

    public static List<Converter<?, ?>> all() {
        return List.of(
                new IntegerToTaskStatus(),
                new LongToTaskStatus(),
                new DoubleToTaskStatus(),
                new StringToTaskStatus(),
                new BooleanToTaskStatus(),
                new TaskStatusToInteger());
    }

    @ReadingConverter
    public static class IntegerToTaskStatus implements Converter<Integer, TaskStatus> {
        @Override
        public TaskStatus convert(Integer source) {
            return TaskStatus.decode(source);
        }
    }

    @ReadingConverter
    public static class LongToTaskStatus implements Converter<Long, TaskStatus> {
        @Override
        public TaskStatus convert(Long source) {
            return TaskStatus.decode(source);
        }
    }

    @ReadingConverter
    public static class DoubleToTaskStatus implements Converter<Double, TaskStatus> {
        @Override
        public TaskStatus convert(Double source) {
            return TaskStatus.decode(source);
        }
    }

    @ReadingConverter
    public static class StringToTaskStatus implements Converter<String, TaskStatus> {
        @Override
        public TaskStatus convert(String source) {
            return TaskStatus.decode(source);
        }
    }

    @ReadingConverter
    public static class BooleanToTaskStatus implements Converter<Boolean, TaskStatus> {
        @Override
        public TaskStatus convert(Boolean source) {
            return TaskStatus.decode(source);
        }
    }

    @WritingConverter
    public static class TaskStatusToInteger implements Converter<TaskStatus, Integer> {
        @Override
        public Integer convert(TaskStatus source) {
            return source.code();
        }
    }
}
