package com.example.jobfit;

import com.example.jobfit.config.MatchingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MatchingProperties.class)
public class JobFitApplication {

	public static void main(String[] args) {
		SpringApplication.run(JobFitApplication.class, args);
	}

}
