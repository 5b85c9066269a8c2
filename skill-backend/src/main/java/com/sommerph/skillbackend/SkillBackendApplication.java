package com.sommerph.skillbackend;

import com.sommerph.skillbackend.config.LedgerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LedgerProperties.class)
public class SkillBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(SkillBackendApplication.class, args);
	}

}
