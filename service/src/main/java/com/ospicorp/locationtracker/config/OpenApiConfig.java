package com.ospicorp.locationtracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(TrackerProperties properties) {
    return new OpenAPI()
        .info(new Info()
            .title("Location Tracker API")
            .version(properties.version())
            .description("Serves coordinate tables from DynamoDB, with mock data for development")
            .contact(new Contact().name("Location Tracker Team").email("api-support@example.com")))
        .servers(List.of(new Server().url("/")));
  }
}
