package com.jreinhal.legaldoc.model;

public enum SupportLevel {
    EXACT,
    PARTIAL,
    NONE;

    public boolean isSupported() {
        return this != NONE;
    }
}
