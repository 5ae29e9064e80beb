package com.apex.gate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GateApplication {
	public static void main(String[] args) {
		SpringApplication.run(GateApplication.class, args);
	}
}
