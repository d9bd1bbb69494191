package com.GlobeLine.price_broadcaster;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceBroadcasterApplication {

	public static void main(String[] args) {
		SpringApplication.run(PriceBroadcasterApplication.class, args);
	}
}
