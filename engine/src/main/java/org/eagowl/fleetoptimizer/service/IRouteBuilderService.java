package org.eagowl.fleetoptimizer.service;

import org.eagowl.fleetoptimizer.model.Coordinate;
import org.eagowl.fleetoptimizer.model.DeliveryStop;
import org.eagowl.fleetoptimizer.model.RouteAssignment;

import java.util.List;

public interface IRouteBuilderService {
    RouteAssignment buildRoute(String vehicleId, List<DeliveryStop> stops, Coordinate start);
}
