package com.survey.codeframe.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI codeframeOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080");
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Codeframe Generation API")
                .version("0.1.0")
                .description("Generates coding taxonomies for open-ended survey answers, " +
                        "validates brand candidates and tracks AI usage.");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
