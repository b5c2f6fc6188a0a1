package org.eagowl.fleetoptimizer.state;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last known state of the most recently registered vehicles, oldest registration first,
 * and the number of routes produced by the latest run. Holds at most {@code capacity}
 * vehicles; registering a vehicle again makes it the most recent one.
 */
@Component
public class FleetStateRegistry {

    private final int capacity;
    private final Map<String, Vehicle> vehiclesById;
    private final Lock lock = new ReentrantLock();
    private int activeRoutes;

    @Autowired
    public FleetStateRegistry(OptimizerConfiguration configuration) {
        this(configuration.getFleetCapacity());
    }

    public FleetStateRegistry(int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException("Fleet capacity must be positive, got " + capacity);
        this.capacity = capacity;
        this.vehiclesById = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Vehicle> eldest) {
                return size() > FleetStateRegistry.this.capacity;
            }
        };
    }

    public void register(List<Vehicle> vehicles, int routesInRun) {
        lock.lock();
        try {
            for (Vehicle vehicle : vehicles) {
                vehiclesById.remove(vehicle.getId());
                vehiclesById.put(vehicle.getId(), vehicle.copy());
            }
            activeRoutes = routesInRun;
        } finally {
            lock.unlock();
        }
    }

    public List<Vehicle> snapshot() {
        lock.lock();
        try {
            return vehiclesById.values().stream().map(Vehicle::copy).toList();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return vehiclesById.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int activeRoutes() {
        lock.lock();
        try {
            return activeRoutes;
        } finally {
            lock.unlock();
        }
    }
}
