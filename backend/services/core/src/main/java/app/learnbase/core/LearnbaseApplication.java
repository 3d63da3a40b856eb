package app.learnbase.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class LearnbaseApplication {

	public static void main(String[] args) {
		SpringApplication.run(LearnbaseApplication.class, args);
	}

}
