package com.cario.insight.app;

import com.cario.insight.app.config.InsightProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Image Insight Service Spring Boot application.
 *
 * <p>The service accepts image uploads, analyzes them asynchronously (colors, quality, faces, text,
 * scene) and serves the resulting insight records to polling clients.
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(InsightProperties.class)
public class ImageInsightServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Image Insight Service application...");
    SpringApplication.run(ImageInsightServiceApplication.class, args);
    log.info("Image Insight Service application started successfully.");
  }
}
