package com.ospicorp.tstoolbox.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo(@Value("${tstoolbox.docs.errors-base-url:https://developers.company.com/docs/errors/}")
      String errorsBaseUrl) {
    return new OpenAPI()
        .info(new Info()
            .title("Time Series Toolbox API")
            .version("v1")
            .description("Spectral filtering, row equations and DTW alignment of time series "
                + "posted as CSV or JSON")
            .contact(new Contact().name("Time Series Platform Team").email("api-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Error codes")
            .url(errorsBaseUrl));
  }
}
