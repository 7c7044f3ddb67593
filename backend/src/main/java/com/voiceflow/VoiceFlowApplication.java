package com.voiceflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * VoiceFlow - voice-enhanced browser workflow generation.
 */
@SpringBootApplication
public class VoiceFlowApplication {

	public static void main(String[] args) {
		SpringApplication.run(VoiceFlowApplication.class, args);
	}

}
