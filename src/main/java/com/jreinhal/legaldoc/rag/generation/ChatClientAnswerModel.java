package com.jreinhal.legaldoc.rag.generation;

import com.jreinhal.legaldoc.exception.PipelineStageException;
import com.jreinhal.legaldoc.exception.StageFailure;
import com.jreinhal.legaldoc.model.ConversationTurn;
import com.jreinhal.legaldoc.util.SimpleCircuitBreaker;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * {@link AnswerModel} over a Spring AI {@link ChatClient}. Prior turns are sent as chat messages
 * ahead of the grounded user prompt. Repeated model failures open a circuit breaker so that a
 * dead model endpoint fails fast instead of holding every query for the full stage timeout.
 */
@Component
public class ChatClientAnswerModel implements AnswerModel {
    private static final Logger log = LoggerFactory.getLogger(ChatClientAnswerModel.class);
    private final ChatClient chatClient;
    @Value("${legaldoc.generation.temperature:0.2}")
    private double temperature = 0.2;
    @Value("${legaldoc.generation.max-tokens:2000}")
    private int maxTokens = 2000;
    @Value("${legaldoc.generation.circuit-breaker.failure-threshold:5}")
    private int failureThreshold = 5;
    @Value("${legaldoc.generation.circuit-breaker.open-seconds:30}")
    private long openSeconds = 30;
    private SimpleCircuitBreaker circuitBreaker;

    public ChatClientAnswerModel(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @PostConstruct
    public void init() {
        this.circuitBreaker = new SimpleCircuitBreaker("answer-model", this.failureThreshold, Duration.ofSeconds(this.openSeconds));
        log.info("Answer model initialized (temperature={}, maxTokens={}, breakerThreshold={})",
                this.temperature, this.maxTokens, this.failureThreshold);
    }

    @Override
    public String complete(AnswerPrompt prompt) {
        if (!this.circuitBreaker.allowRequest()) {
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer model circuit open");
        }
        String content;
        try {
            content = this.chatClient.prompt()
                    .options(ChatOptions.builder().temperature(this.temperature).maxTokens(this.maxTokens).build())
                    .system(prompt.system())
                    .messages(toMessages(prompt.history()))
                    .user(prompt.user())
                    .call()
                    .content();
        } catch (RuntimeException e) {
            this.circuitBreaker.recordFailure();
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer model call failed: " + e.getMessage(), e);
        }
        if (content == null || content.isBlank()) {
            this.circuitBreaker.recordFailure();
            throw new PipelineStageException(StageFailure.GENERATION_FAILURE, "Answer model returned no text");
        }
        this.circuitBreaker.recordSuccess();
        return content.trim();
    }

    SimpleCircuitBreaker.State circuitState() {
        return this.circuitBreaker.getState();
    }

    private static List<Message> toMessages(List<ConversationTurn> history) {
        List<Message> messages = new ArrayList<>(history.size() * 2);
        for (ConversationTurn turn : history) {
            messages.add(new UserMessage(turn.query()));
            messages.add(new AssistantMessage(turn.answer()));
        }
        return messages;
    }
}
