package com.jreinhal.legaldoc.model;

public enum EntityType {
    STATUTE,
    CASE_CITATION,
    COURT,
    LEGAL_CONCEPT,
    ORGANIZATION,
    PERSON,
    LOCATION,
    DATE
}
