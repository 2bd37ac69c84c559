package com.trade.signalengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class SignalEngineApplication {

	public static void main(String[] args) {
		SpringApplication.run(SignalEngineApplication.class, args);
	}

}
