package com.copyleft.CanvasSync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class CanvasSyncApplication {

	public static void main(String[] args) {
		SpringApplication.run(CanvasSyncApplication.class, args);
	}

}
