package com.health.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI healthAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Health Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Per-user baseline and anomaly detection for daily health metrics.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Ingest a daily sample via `POST /samples`\n" +
                                "2. Baselines (mean and standard deviation per metric) are recomputed nightly " +
                                "and after every 7 new samples, once at least 7 days exist\n" +
                                "3. `POST /anomalies/detect` compares a sample to the baseline: the optional ML " +
                                "signal is used when available and confident, otherwise values more than " +
                                "2 standard deviations from the mean are flagged\n" +
                                "4. Severity: **WARNING** (2-3 sigma), **ALERT** (>= 3 sigma), **INFO** for " +
                                "favourable deviations\n" +
                                "5. Users acknowledge anomalies via `POST /anomalies/{id}/acknowledge`\n\n" +
                                "**Metrics:** STEPS, DISTANCE, CALORIES, SCREEN_TIME, SLEEP, HEART_RATE, HRV, MOOD")
                        .contact(new Contact().name("Health Insights Team")));
    }
}
