package com.xksgroup.mediadedup.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI customOpenAPI() {

        Server localDev = new Server()
                .url("http://localhost:" + serverPort)
                .description("Développement local");

        return new OpenAPI()
                .info(new Info()
                        .title("API Media Dedup")
                        .version("v1")
                        .description("Documentation de l'API de détection et de gestion des doublons de la médiathèque"))
                .servers(List.of(localDev));
    }
}
