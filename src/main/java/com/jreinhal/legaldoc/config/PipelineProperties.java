package com.jreinhal.legaldoc.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "legaldoc.pipeline")
public class PipelineProperties {
    /**
     * Number of regenerations the corrective validator may request for one query.
     * The answer model is called at most {@code retryBudget + 1} times per query.
     */
    private int retryBudget = 2;

    /**
     * Queries longer than this are rejected before the pipeline starts.
     */
    private int maxQueryLength = 4000;

    /**
     * Per-stage time limits. A stage that exceeds its limit is cancelled and handled as a
     * failure of that stage.
     */
    private Timeouts timeouts = new Timeouts();

    public int getRetryBudget() {
        return this.retryBudget;
    }

    public void setRetryBudget(int retryBudget) {
        this.retryBudget = Math.max(0, retryBudget);
    }

    public int getMaxQueryLength() {
        return this.maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public Timeouts getTimeouts() {
        return this.timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public static class Timeouts {
        private Duration contextualization = Duration.ofSeconds(10);
        private Duration extraction = Duration.ofSeconds(5);
        private Duration retrieval = Duration.ofSeconds(10);
        private Duration rerank = Duration.ofSeconds(20);
        private Duration generation = Duration.ofSeconds(60);
        private Duration validation = Duration.ofSeconds(20);

        public Duration getContextualization() {
            return this.contextualization;
        }

        public void setContextualization(Duration contextualization) {
            this.contextualization = contextualization;
        }

        public Duration getExtraction() {
            return this.extraction;
        }

        public void setExtraction(Duration extraction) {
            this.extraction = extraction;
        }

        public Duration getRetrieval() {
            return this.retrieval;
        }

        public void setRetrieval(Duration retrieval) {
            this.retrieval = retrieval;
        }

        public Duration getRerank() {
            return this.rerank;
        }

        public void setRerank(Duration rerank) {
            this.rerank = rerank;
        }

        public Duration getGeneration() {
            return this.generation;
        }

        public void setGeneration(Duration generation) {
            this.generation = generation;
        }

        public Duration getValidation() {
            return this.validation;
        }

        public void setValidation(Duration validation) {
            this.validation = validation;
        }
    }
}
