package com.vuong.simpledata.fixture;

/**
 * Mapped type without a primary key; only reachable through a mocked metamodel.
 */
public class KeylessRecord {

    private String label;

    public String getLabel() {
        return label;
    }
}
