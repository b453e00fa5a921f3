package com.survey.codeframe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "codeframe.google")
public class GoogleProperties {
    private String apiKey;
    private String searchEngineId;
    private String customSearchUrl = "https://www.googleapis.com/customsearch/v1";
    private String knowledgeGraphUrl = "https://kgsearch.googleapis.com/v1/entities:search";
    private String translateUrl = "https://translation.googleapis.com/language/translate/v2";

    public boolean hasSearchCredentials() {
        return apiKey != null && !apiKey.isBlank() && searchEngineId != null && !searchEngineId.isBlank();
    }
}
