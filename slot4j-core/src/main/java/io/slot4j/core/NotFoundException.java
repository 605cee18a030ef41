package io.slot4j.core;

/**
 * Unknown config, slot, task or pipeline.
 */
public class NotFoundException extends Slot4jException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
