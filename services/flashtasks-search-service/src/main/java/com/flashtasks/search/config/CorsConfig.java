package com.flashtasks.search.config;

import java.util.Arrays;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  @Value("${app.cors.allowed-origins:http://localhost:3000}")
  private String allowedOrigins;

  @Value("${app.cors.allowed-methods:GET,POST,PUT,DELETE}")
  private String allowedMethods;

  @Value("${app.cors.allowed-headers:Content-Type,Authorization}")
  private String allowedHeaders;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/**")
      .allowedOrigins(split(allowedOrigins))
      .allowedMethods(split(allowedMethods))
      .allowedHeaders(split(allowedHeaders))
      .exposedHeaders("x-trace-id", "x-request-id")
      .allowCredentials(true)
      .maxAge(3600);
  }

  private static String[] split(String value) {
    return Arrays.stream(value.split(","))
      .map(String::trim)
      .filter(s -> !s.isEmpty())
      .toArray(String[]::new);
  }
}
