package org.bpmnml.language.model;

public final class Task extends Node {
    private final TaskType taskType; // null when the source omits it

    public Task(String name, TaskType taskType) {
        super(name);
        this.taskType = taskType;
    }

    public static Task of(String name) {
        return new Task(name, null);
    }

    public TaskType getTaskType() {
        return taskType;
    }

    /**
     * @return the declared type, or {@link TaskType#TASK} when none was declared
     */
    public TaskType getEffectiveTaskType() {
        return taskType != null ? taskType : TaskType.TASK;
    }

    @Override
    public ElementKind kind() {
        return ElementKind.TASK;
    }
}
