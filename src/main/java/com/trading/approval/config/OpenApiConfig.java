package com.trading.approval.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI approvalGatewayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Action Approval Gateway API")
                        .version("1.0.0")
                        .description(
                                "Authorizes high-risk trading operations before they execute.\n\n" +
                                "**Approval Pipeline:**\n" +
                                "1. Receive a request via `POST /approvals/requests`, `POST /approvals/operator-decisions` " +
                                "or the tagged envelope `POST /events`\n" +
                                "2. Replay the cached decision if the approval key was already decided\n" +
                                "3. Run the gate chain: RBAC, reason length, bounds freshness, allowlist, emergency bypass\n" +
                                "4. Fold the requester into the approval chain for the key\n" +
                                "5. Emit **action.approved** once enough distinct approvers consented, " +
                                "otherwise **approval.pending**\n" +
                                "6. A periodic sweep rejects stale chains (**InsufficientQuorum**) and revokes " +
                                "approvals whose TTL elapsed (**TtlExpired**)\n\n" +
                                "**Profiles:**\n" +
                                "- `single`: one authorized approver\n" +
                                "- `dual`: two distinct approvers\n" +
                                "- `quorum`: N distinct approvers out of a pool of M\n\n" +
                                "**Emergency bypass:** while an emergency stop is active, a single authorized request " +
                                "for a global protective action (e.g. `halt_entry` with `scope=global`) is approved immediately.")
                        .contact(new Contact().name("Trading Risk Controls Team")));
    }
}
