package com.jreinhal.legaldoc.rag.crag;

import java.util.Locale;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Asks the chat model whether a passage entails a claim. An answer that names none of the three
 * labels counts as {@link Entailment#NEUTRAL}, which leaves the lexical classification in place.
 */
public class LlmEntailmentJudge implements EntailmentJudge {
    private static final int MAX_EVIDENCE_CHARS = 1500;
    private static final String PROMPT = """
            Does the EVIDENCE support the CLAIM?

            CLAIM: %s

            EVIDENCE:
            %s

            Answer with exactly one word:
            ENTAILED - the evidence states the claim
            NEUTRAL - the evidence does not say
            CONTRADICTED - the evidence says otherwise""";
    private final ChatClient chatClient;

    public LlmEntailmentJudge(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public Entailment judge(String claim, String evidence) {
        String content = evidence == null ? "" : evidence;
        if (content.length() > MAX_EVIDENCE_CHARS) {
            content = content.substring(0, MAX_EVIDENCE_CHARS) + "...";
        }
        String response = this.chatClient.prompt()
                .user(PROMPT.formatted(claim, content))
                .call()
                .content();
        return parse(response);
    }

    static Entailment parse(String response) {
        if (response == null) {
            return Entailment.NEUTRAL;
        }
        String upper = response.trim().toUpperCase(Locale.ROOT);
        if (upper.startsWith("CONTRADICT")) {
            return Entailment.CONTRADICTED;
        }
        if (upper.startsWith("ENTAIL")) {
            return Entailment.ENTAILED;
        }
        return Entailment.NEUTRAL;
    }
}
