package com.al.obstranslator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ObsTranslatorApplication {

	public static void main(String[] args) {
		SpringApplication.run(ObsTranslatorApplication.class, args);
	}

}
