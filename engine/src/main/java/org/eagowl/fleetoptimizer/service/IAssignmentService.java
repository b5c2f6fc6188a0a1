package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.model.AssignmentResult;
import org.eagowl.fleetoptimizer.model.DeliveryStop;
import org.eagowl.fleetoptimizer.model.Vehicle;

import java.util.List;

public interface IAssignmentService {
    AssignmentResult assign(List<DeliveryStop> deliveries, List<Vehicle> vehicles);
}
