package com.cgi.fielddiscovery.discovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.cgi.fielddiscovery")
@EnableCaching
@EnableScheduling
public class FieldDiscoveryApplication {

	public static void main(String[] args) {
		SpringApplication.run(FieldDiscoveryApplication.class, args);
	}

}
