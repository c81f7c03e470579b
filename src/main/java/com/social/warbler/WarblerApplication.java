// src/main/java/com/social/warbler/WarblerApplication.java
package com.social.warbler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication
@EnableJpaRepositories({
		"com.social.warbler.user.repository",
		"com.social.warbler.message.repository",
		"com.social.warbler.social.repository"
})
@EntityScan({
		"com.social.warbler.user.model",
		"com.social.warbler.message.model",
		"com.social.warbler.social.model"
})
public class WarblerApplication {

	public static void main(String[] args) {
		SpringApplication.run(WarblerApplication.class, args);
	}

}
