package com.autoapply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoApplyApplication {

	public static void main(String[] args) {
		SpringApplication.run(AutoApplyApplication.class, args);
	}

}
