package com.cardparser.backend;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.cardparser.backend.services.ocr.DisabledOcrService;
import com.cardparser.backend.services.ocr.OcrService;

@SpringBootTest
class BackendApplicationTests {

	@Autowired
	OcrService ocrService;

	@Test
	void contextLoadsWithOcrDisabledByDefault() {
		assertInstanceOf(DisabledOcrService.class, ocrService);
	}

}
