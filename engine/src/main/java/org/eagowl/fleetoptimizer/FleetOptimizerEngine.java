package org.eagowl.fleetoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetOptimizerEngine {

	public static void main(String[] args) {
		SpringApplication.run(FleetOptimizerEngine.class, args);
	}
}
