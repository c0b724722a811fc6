package com.jreinhal.legaldoc.rag.preprocess;

import com.jreinhal.legaldoc.model.EntityType;
import com.jreinhal.legaldoc.model.ExtractedEntity;
import com.jreinhal.legaldoc.rag.knowledge.KnowledgeGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rule-based legal entity recognizer.
 *
 * Recognizes:
 * - STATUTE: article, section and clause references, named Acts, numbered amendments
 * - CASE_CITATION: "Party v. Party" style case names
 * - COURT: named courts and tribunals
 * - LEGAL_CONCEPT: any concept name known to the knowledge graph
 * - ORGANIZATION, LOCATION, DATE: common surface patterns
 *
 * Runs without a model, so it is the default recognizer and the fallback for the LLM one.
 */
public class PatternEntityRecognizer implements EntityRecognizer {

    private static final Logger log = LoggerFactory.getLogger(PatternEntityRecognizer.class);

    // Article 21, Art. 14(2), Section 5(1)(a), Sec. 302, Clause 3, § 1983
    private static final Pattern PROVISION_PATTERN = Pattern.compile(
            "\\b((?:Article|Art\\.|Section|Sec\\.|Clause|Rule|Regulation|Schedule|Chapter)\\s+\\d+[A-Za-z]?(?:\\s*\\(\\s*[0-9A-Za-z]+\\s*\\))*)"
                    + "|(§+\\s*\\d+[A-Za-z]?(?:\\s*\\(\\s*[0-9A-Za-z]+\\s*\\))*)",
            Pattern.CASE_INSENSITIVE);

    // Civil Rights Act, Indian Penal Code, Companies Act 2013
    private static final Pattern ACT_PATTERN = Pattern.compile(
            "\\b((?:[A-Z][a-z]+\\s+){1,5}(?:Act|Code|Constitution|Charter|Convention|Ordinance)(?:,?\\s+\\d{4})?)\\b");

    // First Amendment, 14th Amendment, Fourteenth Amendment
    private static final Pattern AMENDMENT_PATTERN = Pattern.compile(
            "\\b((?:\\d{1,3}(?:st|nd|rd|th)|First|Second|Third|Fourth|Fifth|Sixth|Seventh|Eighth|Ninth|Tenth|Eleventh|Twelfth|"
                    + "Thirteenth|Fourteenth|Fifteenth|Sixteenth|Seventeenth|Eighteenth|Nineteenth|Twentieth)\\s+Amendment)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CASE_PATTERN = Pattern.compile(
            "\\b([A-Z][\\w.&']*(?:\\s+[A-Z][\\w.&']*)*\\s+v(?:s)?\\.?\\s+[A-Z][\\w.&']*(?:\\s+[A-Z][\\w.&']*)*)");

    private static final Pattern COURT_PATTERN = Pattern.compile(
            "\\b((?:Supreme|High|District|Appellate|Federal|Constitutional|Family|Magistrate'?s?)\\s+Court(?:\\s+of\\s+[A-Z][a-z]+)?"
                    + "|Court\\s+of\\s+Appeals?(?:\\s+for\\s+the\\s+[A-Z][\\w\\s]+?Circuit)?|[A-Z][a-z]+\\s+Tribunal)\\b");

    private static final Pattern ORG_PATTERN = Pattern.compile(
            "\\b((?:[A-Z][\\w&]*\\s+){0,4}(?:Inc\\.?|Corp\\.?|LLC|Ltd\\.?|Company|Corporation|Commission|Ministry|Department|Agency|Parliament|Congress|Senate))\\b");

    private static final Pattern LOCATION_PATTERN = Pattern.compile(
            "\\b((?:New|San|Los|Las|North|South|East|West)\\s+[A-Z][a-z]+|[A-Z][a-z]+(?:land|burg|ville|stan|ia))\\b");

    private static final Pattern DATE_PATTERN = Pattern.compile(
            "\\b(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|"
                    + "(?:January|February|March|April|May|June|July|August|September|October|November|December)\\s+\\d{1,2}(?:,?\\s+\\d{4})?|"
                    + "(?:1[6-9]|20)\\d{2})\\b");

    // sentence-initial words that the capitalized-phrase patterns pick up
    private static final Pattern LEADING_FILLER = Pattern.compile(
            "^(?:(?:In|Under|See|Per|The|What|How|Why|When|Does|Did|Is|Was|Can|Explain|Describe)\\s+)+");

    private final KnowledgeGraph knowledgeGraph;

    public PatternEntityRecognizer(KnowledgeGraph knowledgeGraph) {
        this.knowledgeGraph = knowledgeGraph;
    }

    @Override
    public List<ExtractedEntity> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Found> found = new ArrayList<>();
        // more specific patterns first; later matches with the same text are dropped
        collect(text, AMENDMENT_PATTERN, EntityType.STATUTE, found);
        collect(text, PROVISION_PATTERN, EntityType.STATUTE, found);
        collect(text, ACT_PATTERN, EntityType.STATUTE, found);
        collect(text, CASE_PATTERN, EntityType.CASE_CITATION, found);
        collect(text, COURT_PATTERN, EntityType.COURT, found);
        collect(text, ORG_PATTERN, EntityType.ORGANIZATION, found);
        collect(text, LOCATION_PATTERN, EntityType.LOCATION, found);
        collect(text, DATE_PATTERN, EntityType.DATE, found);
        this.collectConcepts(text, found);

        Set<String> seen = new HashSet<>();
        List<ExtractedEntity> entities = found.stream()
                .sorted(Comparator.comparingInt(Found::start))
                .filter(f -> seen.add(f.entity().text().toLowerCase(Locale.ROOT)))
                .map(Found::entity)
                .toList();
        if (log.isDebugEnabled()) {
            log.debug("Extracted {} entities from text ({} chars)", entities.size(), text.length());
        }
        return entities;
    }

    private void collectConcepts(String text, List<Found> found) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String concept : this.knowledgeGraph.conceptsIn(text)) {
            int start = lower.indexOf(concept);
            int offset = Math.max(0, start);
            String surface = start >= 0 ? text.substring(start, start + concept.length()) : concept;
            found.add(new Found(new ExtractedEntity(surface, EntityType.LEGAL_CONCEPT), offset));
        }
    }

    private static void collect(String text, Pattern pattern, EntityType type, List<Found> found) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            for (int group = 1; group <= matcher.groupCount(); ++group) {
                String match = matcher.group(group);
                if (match == null || match.isBlank()) {
                    continue;
                }
                String stripped = LEADING_FILLER.matcher(match.trim()).replaceFirst("");
                if (isCommonPhrase(stripped)) {
                    continue;
                }
                String cleaned = stripped.replaceAll("\\s+", " ");
                int start = matcher.start(group) + Math.max(0, match.indexOf(stripped));
                found.add(new Found(new ExtractedEntity(cleaned, type), start));
            }
        }
    }

    private static boolean isCommonPhrase(String phrase) {
        String lower = phrase.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("the ") || lower.startsWith("a ") || lower.startsWith("an ") || lower.length() < 3;
    }

    private record Found(ExtractedEntity entity, int start) {
    }
}
