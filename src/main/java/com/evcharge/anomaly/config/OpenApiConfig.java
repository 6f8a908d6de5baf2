package com.evcharge.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI evAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("EV Charging Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection for EV charging session logs.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Upload a CSV via `POST /api/v1/detections/predict`\n" +
                                "2. Column names are standardized (e.g. `SessionID` -> `session_id`, `kWh` -> `energy_kWh`)\n" +
                                "3. Each detector runs over the whole batch; missing columns skip only that detector\n" +
                                "4. Flags are merged into one finding per session, labels joined with `+`\n" +
                                "5. Findings are appended to the anomaly log (`GET /api/v1/detections/logs`)\n\n" +
                                "**Detectors:**\n" +
                                "- `dos_attack`: CPU usage and packet rate scored by a pre-fit outlier model\n" +
                                "- `billing_fraud`: energy delivered and amount billed scored by a pre-fit outlier model\n" +
                                "- `multi_user_conflict`: a user's session starting before their previous session ended\n\n" +
                                "**Required columns:** `session_id`, `user_id`, `start_time`, `end_time`")
                        .contact(new Contact().name("EV Charging Anomaly Detection Team")));
    }
}
