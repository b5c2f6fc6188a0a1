package org.eagowl.fleetoptimizer.model;

public enum RecommendationType {
    FUEL_ALERT,
    FUEL_WARNING,
    EFFICIENCY_IMPROVEMENT
}
