package com.kreasipositif.statementprocessor.config;

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
 * SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8081}")
    private String serverPort;

    @Bean
    public OpenAPI statementProcessorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Statement Processor API")
                        .description("""
                                Imports bank statements and reconciles them against the ledger.
                                
                                **Formats:**
                                - `NATIONAL_TXT`: 1C client-bank exchange text
                                - `DELIMITED`: CSV / TSV exports with a recognizable header row
                                - `SPREADSHEET`: xls / xlsx exports
                                
                                **Reconciliation outcomes:**
                                - `VERIFIED`: an unconfirmed ledger entry with the same amount exists
                                - `DISCREPANCY`: an entry exists within the amount tolerance
                                - `NEW`: no candidate entry; the row becomes a new ledger entry
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
