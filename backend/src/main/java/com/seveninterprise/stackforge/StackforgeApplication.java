package com.seveninterprise.stackforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StackforgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(StackforgeApplication.class, args);
	}

}
