package com.noi.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

import com.noi.backend.config.DotenvLoader;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class NoiBackendApplication {

	public static void main(String[] args) {
		DotenvLoader.loadFromWorkingDirectoryIfPresent();
		SpringApplication.run(NoiBackendApplication.class, args);
	}

}
