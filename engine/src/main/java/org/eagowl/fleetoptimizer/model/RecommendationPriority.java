package org.eagowl.fleetoptimizer.model;

public enum RecommendationPriority {
    HIGH,
    MEDIUM
}
