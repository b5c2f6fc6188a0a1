package org.eagowl.fleetoptimizer.controller;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.eagowl.fleetoptimizer.model.FuelEfficiencyRequest;
import org.eagowl.fleetoptimizer.model.FuelFeasibility;
import org.eagowl.fleetoptimizer.model.HealthResponse;
import org.eagowl.fleetoptimizer.model.HistoryResponse;
import org.eagowl.fleetoptimizer.model.OptimizationRequest;
import org.eagowl.fleetoptimizer.model.OptimizationResponse;
import org.eagowl.fleetoptimizer.model.RecommendationsResponse;
import org.eagowl.fleetoptimizer.service.IFleetOptimizerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@Validated
@RestController
@CrossOrigin(origins = "*")
@RequestMapping("optimizer/v1")
public class OptimizationController {

    private final IFleetOptimizerService fleetOptimizerService;
    private final ExecutorService executorService;

    @Autowired
    public OptimizationController(
        IFleetOptimizerService fleetOptimizerService,
        ExecutorService executorService)
    {
        this.fleetOptimizerService = fleetOptimizerService;
        this.executorService = executorService;
    }

    @PostMapping("/optimize")
    public CompletableFuture<ResponseEntity<OptimizationResponse>> optimize(
        @RequestBody @Valid OptimizationRequest request)
    {
        return CompletableFuture.supplyAsync(
            () -> ResponseEntity.ok(fleetOptimizerService.optimize(request)),
            executorService
        );
    }

    @PostMapping("/fuel-efficiency")
    public ResponseEntity<FuelFeasibility> fuelEfficiency(@RequestBody @Valid FuelEfficiencyRequest request) {
        return ResponseEntity.ok(
            fleetOptimizerService.fuelEfficiency(request.toVehicle(), request.getRouteDistance()));
    }

    @GetMapping("/recommendations")
    public ResponseEntity<RecommendationsResponse> recommendations() {
        return ResponseEntity.ok(fleetOptimizerService.recommendations());
    }

    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> history(
        @RequestParam(name = "limit", defaultValue = "10") @Min(0) int limit)
    {
        return ResponseEntity.ok(fleetOptimizerService.history(limit));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(fleetOptimizerService.health());
    }
}
