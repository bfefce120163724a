package com.planttracker.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlantTrackerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PlantTrackerApplication.class, args);
	}
}
