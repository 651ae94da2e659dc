package com.z254.lazarus.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for LAZARUS.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8095}")
    private int serverPort;

    @Bean
    public OpenAPI lazarusOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LAZARUS Remediation Engine API")
                        .description("""
                                LAZARUS detects operational faults and remediates them with verified,
                                rollback-capable playbooks, escalating to operators when automation
                                cannot recover the resource.
                                """)
                        .version("0.1.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag().name("Incidents").description("Incident lifecycle and history"),
                        new Tag().name("Playbooks").description("Playbook publishing and dry runs"),
                        new Tag().name("Escalations").description("Operator tickets and fallback modes"),
                        new Tag().name("Signals").description("Failure and heartbeat ingestion"),
                        new Tag().name("Detectors").description("Detector pool management"),
                        new Tag().name("Audit").description("Audit ledger access and verification"),
                        new Tag().name("Metrics").description("Remediation success rate and MTTR")
                ));
    }
}
