package com.ospicorp.salesinsights.config;

import com.ospicorp.salesinsights.schema.AliasTable;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Sales Insights API")
            .version("v1")
            .description("Monthly sales actuals, forecasts, breakdowns and customer exploration "
                + "over optional CSV artifacts. Column aliases: table version " + AliasTable.VERSION)
            .contact(new Contact().name("Sales Analytics Team").email("analytics@example.com")))
        .servers(List.of(new Server().url("/")))
        .tags(List.of(
            new Tag().name("Series").description("Monthly actuals, forecast and breakdowns"),
            new Tag().name("Customers").description("Segmented customer exploration"),
            new Tag().name("Profiles").description("Per-segment profile table"),
            new Tag().name("Admin").description("Artifact status and cache reload")));
  }
}
