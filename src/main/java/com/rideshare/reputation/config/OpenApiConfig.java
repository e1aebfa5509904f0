package com.rideshare.reputation.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI reputationConsoleOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Reputation Console API")
                        .version("1.0.0")
                        .description(
                                "Administrative reputation subsystem of the ride-share platform.\n\n" +
                                "**Trust score (0-100)** is recomputed on explicit request from recorded facts:\n" +
                                "- `rating` (0-30): average rating x 6, 0 when the user has no ratings\n" +
                                "- `completion` (0-25): completed / total terminal rides x 25\n" +
                                "- `reliability` (0-25): 25 minus 2 per cancellation, 5 per late cancellation, " +
                                "10 per no-show, floored at 0\n" +
                                "- `experience` (0-20): tiered on total rides (0, 1-5, 6-15, 16-30, 31+)\n\n" +
                                "Categories: **Excellent** (>=80), **Good** (60-79), **Fair** (40-59), **Poor** (<40).\n\n" +
                                "Every mutation (recalculation, rating moderation, rider verification) is followed by a " +
                                "best-effort append to the admin audit log. Mutating endpoints expect the verified " +
                                "administrator uid in the `X-Admin-Uid` header.")
                        .contact(new Contact().name("Trust & Safety Platform Team")));
    }
}
