package com.jreinhal.legaldoc.model;

public record ExtractedEntity(String text, EntityType type) {
    @Override
    public String toString() {
        return String.format("%s [%s]", this.text, this.type);
    }
}
