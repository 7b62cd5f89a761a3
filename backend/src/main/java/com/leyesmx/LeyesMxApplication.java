package com.leyesmx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * LeyesMx - Mexican statute text to structured JSON.
 */
@SpringBootApplication
public class LeyesMxApplication {

	public static void main(String[] args) {
		SpringApplication.run(LeyesMxApplication.class, args);
	}

}
