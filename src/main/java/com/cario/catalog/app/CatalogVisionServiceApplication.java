package com.cario.catalog.app;

import com.cario.catalog.app.config.CatalogProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Catalog Vision Service.
 *
 * <p>The service reads product photographs, extracts their text with a multi-strategy OCR pass and
 * a vision model in parallel, and stores one reconciled result per image for inventory
 * cataloging. Usage:
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogVisionServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Catalog Vision Service application...");
    SpringApplication.run(CatalogVisionServiceApplication.class, args);
    log.info("Catalog Vision Service application started successfully.");
  }
}
