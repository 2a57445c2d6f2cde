package com.legisgraph.citegraph.service.graph;

public enum RelationshipType {
    ENACTS,
    AMENDS;

    /**
     * The first law cited in a section's source credit created the section; every later
     * citation amended it.
     */
    public static RelationshipType forPosition(int position) {
        if (position < 0) {
            throw new IllegalArgumentException("Position must not be negative: " + position);
        }
        return position == 0 ? ENACTS : AMENDS;
    }
}
