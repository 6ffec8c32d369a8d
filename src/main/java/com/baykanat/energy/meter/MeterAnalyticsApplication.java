package com.baykanat.energy.meter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile periyodik meter sync. */
@SpringBootApplication
@EnableScheduling
public class MeterAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(MeterAnalyticsApplication.class, args);
	}

}
