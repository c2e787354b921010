package com.tony.transferMarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TransferMarketApplication {

	public static void main(String[] args) {
		SpringApplication.run(TransferMarketApplication.class, args);
	}

}
