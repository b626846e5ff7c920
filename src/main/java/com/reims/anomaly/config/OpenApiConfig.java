package com.reims.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyEnsembleOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Anomaly Detection Ensemble API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection for periodic financial account series.\n\n" +
                                "**Evaluation Pipeline:**\n" +
                                "1. Receive a series via `POST /api/v1/detections/evaluate`\n" +
                                "2. Run statistical and model-based detectors\n" +
                                "3. Combine candidates into consensus anomalies (weighted by detector reliability)\n" +
                                "4. Score financial impact (0-100): variance, parent category share, DSCR proximity\n" +
                                "5. Suppress noise: low agreement, immaterial impact or low confidence\n\n" +
                                "**Detectors:**\n" +
                                "- `z_score` - point outliers against the other observations\n" +
                                "- `percentage_change` - period-over-period jumps\n" +
                                "- `cusum` - sustained level shifts\n" +
                                "- `volatility` - rolling volatility spikes\n" +
                                "- `seasonal_decomposition` - deviation from the seasonal expectation\n" +
                                "- `isolation_forest` - isolation-based outliers (cached model)\n" +
                                "- `lof` - density-based outliers (cached model)")
                        .contact(new Contact().name("REIMS Analytics Team")));
    }
}
