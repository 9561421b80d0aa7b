package com.metrocrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

@SpringBootApplication
public class MetroCrawlerApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(MetroCrawlerApplication.class);

		// A one-shot crawl from the command line does not need the HTTP server
		if (Arrays.stream(args).anyMatch(arg -> arg.startsWith("--system-id"))) {
			application.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(application.run(args)));
		}

		application.run(args);
	}

}
