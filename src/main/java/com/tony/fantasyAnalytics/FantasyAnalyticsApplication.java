package com.tony.fantasyAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FantasyAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(FantasyAnalyticsApplication.class, args);
	}

}
