package com.noi.backend;

import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.noi.backend.services.extraction.engine.ModelClient;

@SpringBootTest(properties = {
		"openai.api-key="
})
class NoiBackendApplicationTests {

	@Autowired
	private ModelClient modelClient;

	@Test
	void contextLoads() {
	}

	@Test
	void modelClientIsUnavailableWithoutApiKey() {
		assertFalse(modelClient.isAvailable());
	}

}
