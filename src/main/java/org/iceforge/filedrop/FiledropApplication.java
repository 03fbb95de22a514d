package org.iceforge.filedrop;

import org.iceforge.filedrop.config.FiledropProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(FiledropProperties.class)
public class FiledropApplication {

	public static void main(String[] args) {
		SpringApplication.run(FiledropApplication.class, args);
	}
}
