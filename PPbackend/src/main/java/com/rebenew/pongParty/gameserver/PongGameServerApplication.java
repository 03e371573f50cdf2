package com.rebenew.pongParty.gameserver;

import com.rebenew.pongParty.gameserver.config.GameProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GameProperties.class)
public class PongGameServerApplication {
	public static void main(String[] args) {
		SpringApplication.run(PongGameServerApplication.class, args);
	}
}
