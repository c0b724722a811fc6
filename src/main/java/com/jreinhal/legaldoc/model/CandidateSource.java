package com.jreinhal.legaldoc.model;

public enum CandidateSource {
    SPARSE_ONLY,
    DENSE_ONLY,
    BOTH
}
