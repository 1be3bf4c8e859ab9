package com.scoutiq.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Router and answerer settings.
 * Maps to scoutiq.agent.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoutiq.agent")
public class AgentConfig {

    private int maxQueryLength = 500;

    /** Concurrent pipeline invocations accepted through submit() */
    private int pipelinePoolSize = 8;

    private Router router = new Router();
    private Answer answer = new Answer();

    @Data
    public static class Router {
        /** Ask the language model to classify queries that pass the keyword screen */
        private boolean useLanguageModel = true;
        private float temperature = 0.0f;
        private int maxOutputTokens = 128;
    }

    @Data
    public static class Answer {
        /** Let the language model write the explanation under the summary */
        private boolean useLanguageModel = true;
        private float temperature = 0.3f;
        private int maxOutputTokens = 512;
        /** Citation lines shown in the template explanation */
        private int maxListed = 5;
    }
}
