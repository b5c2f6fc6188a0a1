package org.eagowl.fleetoptimizer.exception.optimization;

public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
