package com.jreinhal.legaldoc.rag.crag;

import com.jreinhal.legaldoc.constant.StopWords;
import com.jreinhal.legaldoc.model.ClaimCheck;
import com.jreinhal.legaldoc.model.ContextPassage;
import com.jreinhal.legaldoc.model.DraftAnswer;
import com.jreinhal.legaldoc.model.SupportClass;
import com.jreinhal.legaldoc.model.SupportLevel;
import com.jreinhal.legaldoc.model.ValidationVerdict;
import com.jreinhal.legaldoc.rag.generation.CitationMarkers;
import com.jreinhal.legaldoc.util.TextTokenizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Claim-level grounding check for a draft answer.
 *
 * The draft is split into sentence claims. Each claim is compared with the passages it cites, or
 * with every supplied passage when it cites none, and classified by lexical coverage:
 * - EXACT: at least {@code exactThreshold} of the claim's content terms occur in one passage
 * - PARTIAL: at least {@code partialThreshold} do
 * - NONE: anything less
 *
 * Two consistency rules force NONE regardless of coverage: a number in the claim (an article or
 * section number, a year) that the evidence does not contain, and phrasing that signals the model
 * is answering from its own knowledge. When an {@link EntailmentJudge} is configured it settles
 * PARTIAL claims.
 */
@Component
public class ClaimSupportChecker {

    private static final Logger log = LoggerFactory.getLogger(ClaimSupportChecker.class);

    private static final Pattern SENTENCE_SPLIT = Pattern.compile(
            "(?<![ (]v\\.)(?<!\\bvs\\.)(?<!\\bArt\\.)(?<!\\bSec\\.)(?<!\\bNo\\.)(?<!\\bCl\\.)"
                    + "(?<!\\be\\.g\\.)(?<!\\bi\\.e\\.)(?<=[.!?])\\s+");

    // "... process. [1]" -> "... process[1]."
    private static final Pattern TRAILING_MARKERS = Pattern.compile(
            "([.!?])\\s*((?:\\[\\d{1,4}(?:\\s*,\\s*\\d{1,4})*\\])+)");

    // Only statements about the sources themselves; "The Constitution does not include ..." is a claim.
    private static final Pattern COVERAGE_DISCLOSURE = Pattern.compile(
            "(?i)^(?:the\\s+|these\\s+)?(?:provided\\s+|given\\s+|supplied\\s+|available\\s+|retrieved\\s+)?"
                    + "(?:sources?|documents?|context|passages?|excerpts?)(?:\\s+provided)?\\s+"
                    + "(?:do(?:es)?\\s+not|don't|doesn't)\\s+"
                    + "(?:contain|cover|specify|mention|address|provide|include|say|state|discuss)\\b"
                    + "|^(?:i\\s+)?(?:cannot|can't)\\s+(?:answer|find|determine)\\b"
                    + "|^(?:there\\s+is\\s+)?no\\s+information\\s+(?:is\\s+)?(?:in|from|within)\\s+"
                    + "(?:the\\s+)?(?:provided\\s+)?(?:sources?|documents?|context|passages?)\\b"
                    + "|\\bnot\\s+(?:covered|addressed|mentioned)\\s+(?:in|by)\\s+(?:the\\s+)?"
                    + "(?:provided\\s+|available\\s+)?(?:sources?|documents?|context|passages?)\\b");

    private static final List<String> HALLUCINATION_INDICATORS = List.of(
            "based on my knowledge", "as far as i know", "generally speaking", "in my experience",
            "it is widely known", "i believe", "typically in most jurisdictions");

    private static final int MIN_CLAIM_CHARS = 15;

    @Nullable
    private final EntailmentJudge entailmentJudge;

    @Value("${legaldoc.validation.exact-threshold:0.8}")
    private double exactThreshold = 0.8;

    @Value("${legaldoc.validation.partial-threshold:0.5}")
    private double partialThreshold = 0.5;

    public ClaimSupportChecker(@Nullable EntailmentJudge entailmentJudge) {
        this.entailmentJudge = entailmentJudge;
    }

    @PostConstruct
    public void init() {
        if (this.partialThreshold > this.exactThreshold) {
            log.warn("legaldoc.validation.partial-threshold={} above exact-threshold={}; using exact for both",
                    this.partialThreshold, this.exactThreshold);
            this.partialThreshold = this.exactThreshold;
        }
        log.info("Claim support checker initialized (exact={}, partial={}, entailmentJudge={})",
                this.exactThreshold, this.partialThreshold, this.entailmentJudge != null);
    }

    /**
     * Produce the verdict for a draft. A draft with no checkable claim is UNSUPPORTED.
     */
    public ValidationVerdict check(DraftAnswer draft) {
        List<ClaimCheck> checks = new ArrayList<>();
        for (String claim : splitClaims(draft.text())) {
            String body = CitationMarkers.strip(claim);
            if (!isCheckable(body)) {
                continue;
            }
            checks.add(this.checkClaim(claim, body, draft));
        }
        if (checks.isEmpty()) {
            return new ValidationVerdict(SupportClass.UNSUPPORTED, List.of(), List.of(), 0.0);
        }
        List<String> flagged = checks.stream()
                .filter(c -> !c.level().isSupported())
                .map(ClaimCheck::claim)
                .toList();
        SupportClass support = flagged.isEmpty() ? SupportClass.SUPPORTED
                : flagged.size() == checks.size() ? SupportClass.UNSUPPORTED
                : SupportClass.PARTIALLY_SUPPORTED;
        double confidence = checks.stream().mapToDouble(ClaimCheck::score).average().orElse(0.0);
        if (log.isDebugEnabled()) {
            log.debug("Validated draft attempt {}: {} claims, {} unsupported, verdict {}",
                    draft.attempt(), checks.size(), flagged.size(), support);
        }
        return new ValidationVerdict(support, checks, flagged, confidence);
    }

    private ClaimCheck checkClaim(String claim, String body, DraftAnswer draft) {
        String lower = body.toLowerCase(Locale.ROOT);
        for (String indicator : HALLUCINATION_INDICATORS) {
            if (lower.contains(indicator)) {
                return new ClaimCheck(body, SupportLevel.NONE, 0, 0.0, "speculative phrasing: \"" + indicator + "\"");
            }
        }
        Set<String> claimTerms = new HashSet<>(TextTokenizer.terms(body, StopWords.CLAIM_CHECK));
        List<ContextPassage> evidence = evidenceFor(claim, draft);
        if (evidence.isEmpty()) {
            return new ClaimCheck(body, SupportLevel.NONE, 0, 0.0, "cites no supplied passage");
        }
        ContextPassage best = null;
        double bestScore = -1.0;
        for (ContextPassage passage : evidence) {
            double score = coverage(claimTerms, passage.text());
            if (score > bestScore) {
                bestScore = score;
                best = passage;
            }
        }
        Set<String> missingNumbers = new HashSet<>(TextTokenizer.numbers(body));
        missingNumbers.removeAll(TextTokenizer.numbers(best.text()));
        if (!missingNumbers.isEmpty()) {
            return new ClaimCheck(body, SupportLevel.NONE, best.citationIndex(), 0.0,
                    "numbers " + missingNumbers + " not in source " + best.citationIndex());
        }
        SupportLevel level = bestScore >= this.exactThreshold ? SupportLevel.EXACT
                : bestScore >= this.partialThreshold ? SupportLevel.PARTIAL
                : SupportLevel.NONE;
        String reason = String.format(Locale.ROOT, "coverage %.2f in source %d", bestScore, best.citationIndex());
        if (level == SupportLevel.PARTIAL && this.entailmentJudge != null) {
            EntailmentJudge.Entailment entailment = this.entailmentJudge.judge(body, best.text());
            if (entailment == EntailmentJudge.Entailment.ENTAILED) {
                level = SupportLevel.EXACT;
            } else if (entailment == EntailmentJudge.Entailment.CONTRADICTED) {
                level = SupportLevel.NONE;
                bestScore = 0.0;
            }
            reason = reason + ", entailment " + entailment;
        }
        return new ClaimCheck(body, level, best.citationIndex(), bestScore, reason);
    }

    private static List<ContextPassage> evidenceFor(String claim, DraftAnswer draft) {
        List<Integer> cited = CitationMarkers.indexes(claim);
        if (cited.isEmpty()) {
            return draft.passages();
        }
        return cited.stream().map(draft::passage).flatMap(Optional::stream).toList();
    }

    static double coverage(Set<String> claimTerms, String passageText) {
        if (claimTerms.isEmpty()) {
            return 0.0;
        }
        Set<String> passageTerms = new HashSet<>(TextTokenizer.terms(passageText, StopWords.CLAIM_CHECK));
        long matched = claimTerms.stream().filter(passageTerms::contains).count();
        return (double) matched / claimTerms.size();
    }

    static List<String> splitClaims(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = TRAILING_MARKERS.matcher(text.trim()).replaceAll("$2$1");
        List<String> claims = new ArrayList<>();
        for (String line : normalized.split("\\n+")) {
            String cleaned = line.replaceFirst("^\\s*(?:[-*•]|\\d+[.)])\\s+", "").trim();
            if (cleaned.isEmpty()) {
                continue;
            }
            Arrays.stream(SENTENCE_SPLIT.split(cleaned))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(claims::add);
        }
        return claims;
    }

    private static boolean isCheckable(String body) {
        if (body.length() < MIN_CLAIM_CHARS || body.endsWith("?") || body.endsWith(":")) {
            return false;
        }
        if (COVERAGE_DISCLOSURE.matcher(body).find()) {
            return false;
        }
        return !TextTokenizer.terms(body, StopWords.CLAIM_CHECK).isEmpty();
    }
}
