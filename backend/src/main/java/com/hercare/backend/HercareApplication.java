package com.hercare.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HercareApplication {

	public static void main(String[] args) {
		// Records are dated in UTC regardless of host settings
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(HercareApplication.class, args);
	}

}
