package github.sarthakdev143.clip_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClipFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClipFactoryApplication.class, args);
	}

}
