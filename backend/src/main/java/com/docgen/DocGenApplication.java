package com.docgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * DocGen - reliability layer between the documentation templates and the LLM.
 */
@SpringBootApplication
public class DocGenApplication {

	public static void main(String[] args) {
		SpringApplication.run(DocGenApplication.class, args);
	}

}
