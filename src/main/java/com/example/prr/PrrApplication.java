package com.example.prr;

import com.example.prr.config.PrrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PrrProperties.class)
public class PrrApplication {

	public static void main(String[] args) {
		SpringApplication.run(PrrApplication.class, args);
	}

}
