package com.kreasipositif.ledgerservice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8082}")
    private String serverPort;

    @Bean
    public OpenAPI ledgerServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ledger Service API")
                        .description("""
                                In-memory ledger behind the statement processor.
                                
                                **Resources:**
                                - clients, with the BIN learned from bank statements
                                - ledger transactions, entered manually or committed from a statement import
                                - counterparty aliases learned from manual client choices
                                
                                **Reconciliation statuses:**
                                - `MANUAL` — entered by a manager, not yet seen on a statement
                                - `VERIFIED` — settled by a bank row with the same amount
                                - `DISCREPANCY` — settled by a bank row with a different amount
                                - `BANK_IMPORT` — created from a bank row with no manual counterpart
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif"))
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
