package com.jreinhal.legaldoc.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.legaldoc.model.ConversationTurn;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

class QueryContextualizerTest {
    private static final List<ConversationTurn> HISTORY = List.of(
            new ConversationTurn("What does Article 21 protect?", "Life and personal liberty [1].", List.of(), Instant.now()));

    private ChatClient chatClient;
    private QueryContextualizer contextualizer;

    @BeforeEach
    void setUp() {
        this.chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(this.chatClient);
        this.contextualizer = new QueryContextualizer(builder);
    }

    private void rewriteReturns(String content) {
        when(this.chatClient.prompt().options(any()).user(anyString()).call().content()).thenReturn(content);
    }

    @Test
    void detectsFollowUps() {
        assertThat(this.contextualizer.isVague("What about exceptions?")).isTrue();
        assertThat(this.contextualizer.isVague("Can the legislature restrict it under a valid procedure established by law?")).isTrue();
        assertThat(this.contextualizer.isVague("Which article of the constitution guarantees equality before the law for all persons?")).isFalse();
    }

    @Test
    @DisplayName("Standalone questions and first turns are returned unchanged")
    void passesThrough() {
        String standalone = "Which article of the constitution guarantees equality before the law for all persons?";

        assertThat(this.contextualizer.contextualize(standalone, HISTORY)).isEqualTo(standalone);
        assertThat(this.contextualizer.contextualize("And exceptions?", List.of())).isEqualTo("And exceptions?");
        verify(this.chatClient, never()).prompt();
    }

    @Test
    void rewritesFollowUpAndStripsQuotes() {
        rewriteReturns("\"What exceptions apply to the protection of life under Article 21?\"");

        assertThat(this.contextualizer.contextualize("What about exceptions?", HISTORY))
                .isEqualTo("What exceptions apply to the protection of life under Article 21?");
    }

    @Test
    @DisplayName("A failed or empty rewrite prefixes the previous question")
    void fallsBackToPreviousQuestion() {
        rewriteReturns("  ");

        assertThat(this.contextualizer.contextualize("What about exceptions?", HISTORY))
                .isEqualTo("What does Article 21 protect? What about exceptions?");
    }

    @Test
    void modelErrorFallsBack() {
        when(this.chatClient.prompt().options(any()).user(anyString()).call().content())
                .thenThrow(new IllegalStateException("timeout"));

        assertThat(this.contextualizer.contextualize("What about exceptions?", HISTORY))
                .startsWith("What does Article 21 protect?");
    }
}
