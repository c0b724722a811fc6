package com.jreinhal.legaldoc.model;

public enum SupportClass {
    SUPPORTED,
    PARTIALLY_SUPPORTED,
    UNSUPPORTED
}
