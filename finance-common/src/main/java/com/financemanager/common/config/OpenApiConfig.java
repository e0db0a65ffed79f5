package com.financemanager.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI financeManagerOpenAPI(@Value("${app.api.title:Finance Manager API}") String title,
                                         @Value("${app.api.description:}") String description,
                                         @Value("${app.version:1.0.0}") String version,
                                         @Value("${server.port:8080}") int port) {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + port);
        localServer.setDescription("Local Development Server");

        Contact contact = new Contact();
        contact.setName("Finance Manager Team");
        contact.setEmail("support@financemanager.local");

        Info info = new Info()
                .title(title)
                .version(version)
                .description(description)
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
