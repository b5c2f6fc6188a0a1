package org.eagowl.fleetoptimizer.exception.optimization;

/**
 * An unexpected failure while assigning or sequencing deliveries. Nothing is recorded for the run.
 */
public class RouteComputationException extends RuntimeException {
    public RouteComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
