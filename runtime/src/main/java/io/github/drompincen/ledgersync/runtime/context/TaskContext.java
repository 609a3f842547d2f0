package io.github.drompincen.ledgersync.runtime.context;

/**
 * Story, goal and sprint a task belongs to, joined for one pass. References fall back to
 * the raw id when the linked record cannot be read.
 */
public record TaskContext(
        String storyId,
        String storyRef,
        String goalId,
        String goalRef,
        String themeName,
        String sprintId,
        String sprintName
) {
    public static TaskContext empty() {
        return new TaskContext(null, null, null, null, null, null, null);
    }
}
