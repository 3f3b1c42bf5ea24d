package org.bpmnml.language.model;

public final class Event extends Node {
    private final EventType eventType; // null when the source omits it

    public Event(String name, EventType eventType) {
        super(name);
        this.eventType = eventType;
    }

    public static Event start(String name) {
        return new Event(name, EventType.START);
    }

    public static Event end(String name) {
        return new Event(name, EventType.END);
    }

    public EventType getEventType() {
        return eventType;
    }

    /**
     * @return the declared type, or {@link EventType#INTERMEDIATE} when none was declared
     */
    public EventType getEffectiveEventType() {
        return eventType != null ? eventType : EventType.INTERMEDIATE;
    }

    @Override
    public ElementKind kind() {
        return ElementKind.EVENT;
    }
}
