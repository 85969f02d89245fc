package tech.noetzold.verification_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI verificationOpenAPI(@Value("${server.port:8090}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Verification API")
                        .version("1.0.0")
                        .description("Checks LLM responses against versioned compliance ontologies and issues reproducible certificates")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + port)
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Verification").description("Verify text and fetch audit records"),
                        new Tag().name("Ontology").description("List and inspect ontologies"),
                        new Tag().name("Certificate").description("Check certificate signatures")));
    }
}
