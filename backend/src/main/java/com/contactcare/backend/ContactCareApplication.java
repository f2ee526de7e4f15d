package com.contactcare.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ContactCareApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC so contact and review dates roll over consistently
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(ContactCareApplication.class, args);
	}

}

/*
Must stay in the root package: component scanning starts here, so moving it into a
sub-package would hide the modules outside that package.
 */
