package org.eagowl.fleetoptimizer.state;

import org.eagowl.fleetoptimizer.config.OptimizerConfiguration;
import org.eagowl.fleetoptimizer.model.Vehicle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FleetStateRegistryTest {

    private static Vehicle vehicle(String id, double fuel) {
        return new Vehicle(id, "Driver " + id, 1000, 0, 0, fuel, 60);
    }

    @Test
    void reRegisteredVehicleReplacesEarlierStateAndBecomesMostRecent() {
        var registry = new FleetStateRegistry(10);
        registry.register(List.of(vehicle("a", 50), vehicle("b", 40)), 2);
        registry.register(List.of(vehicle("c", 30), vehicle("a", 5)), 1);

        var snapshot = registry.snapshot();

        assertEquals(List.of("b", "c", "a"), snapshot.stream().map(Vehicle::getId).toList());
        assertEquals(5, snapshot.get(2).getFuelLevel());
        assertEquals(3, registry.size());
        assertEquals(1, registry.activeRoutes());
    }

    @Test
    void registeredVehiclesAreCopied() {
        var registry = new FleetStateRegistry(10);
        var original = vehicle("a", 50);
        registry.register(List.of(original), 1);

        original.setFuelLevel(1);
        registry.snapshot().get(0).setFuelLevel(2);

        assertEquals(50, registry.snapshot().get(0).getFuelLevel());
    }

    @Test
    void oldestVehiclesAreEvictedBeyondCapacity() {
        var registry = new FleetStateRegistry(2);
        registry.register(List.of(vehicle("a", 50), vehicle("b", 40), vehicle("c", 30)), 3);

        assertEquals(List.of("b", "c"), registry.snapshot().stream().map(Vehicle::getId).toList());
        assertEquals(2, registry.size());
    }

    @Test
    void reRegisteredVehicleSurvivesEviction() {
        var registry = new FleetStateRegistry(2);
        registry.register(List.of(vehicle("a", 50), vehicle("b", 40)), 2);
        registry.register(List.of(vehicle("a", 45)), 1);
        registry.register(List.of(vehicle("c", 30)), 1);

        assertEquals(List.of("a", "c"), registry.snapshot().stream().map(Vehicle::getId).toList());
    }

    @Test
    void vehiclesWithoutIdsDoNotGrowRegistryPastCapacity() {
        var config = new OptimizerConfiguration();
        config.setFleetCapacity(50);
        var registry = new FleetStateRegistry(config);

        for (int run = 0; run < 100; run++) {
            var fleet = new ArrayList<Vehicle>();
            for (int i = 0; i < 10; i++)
                fleet.add(new Vehicle());
            registry.register(fleet, 10);
        }

        assertEquals(50, registry.size());
        assertEquals(50, registry.capacity());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new FleetStateRegistry(0));
    }
}
