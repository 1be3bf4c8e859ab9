package com.scoutiq.ai.service;

import com.scoutiq.ai.config.AgentConfig;
import com.scoutiq.ai.model.Citation;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.ai.model.ReconciledResult;
import com.scoutiq.common.enums.IntentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Final pipeline stage: writes the answer text and its citations from the reconciled results.
 *
 * Citation n always refers to the result at rank n-1. Any [n] marker in model-written text that has
 * no matching citation is removed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswererService {

    public static final String NODE = "answerer";

    static final Pattern CITATION_MARKER = Pattern.compile("\\[(\\d+)]");

    private static final String EXPLAIN_PROMPT = """
            You are a concise shopping assistant. Using ONLY the numbered products below, explain in
            2-4 short sentences which options fit the request and why. Cite products with their number
            in square brackets, e.g. [1]. Do not invent products, prices or numbers that are not listed.
            """;

    private final GeminiService geminiService;
    private final AgentConfig agentConfig;

    public void answer(ConversationState state) {
        List<ReconciledResult> results = state.getReconciledResults();
        List<Citation> citations = results.stream().map(Citation::from).toList();

        StringBuilder answer = new StringBuilder();
        if (results.isEmpty()) {
            answer.append(emptyMessage(state));
        } else {
            answer.append(summary(state.getQuery(), results.get(0), results.size()));
            answer.append("\n\n").append(explanation(state, results, citations.size()));
        }

        Set<String> flags = state.getIntent() != null ? state.getIntent().getSafetyFlags() : Set.of();
        String caution = caution(flags);
        if (!caution.isEmpty()) {
            answer.append("\n\n").append(caution);
        }
        if (state.getIntent() != null && state.getIntent().getType() == IntentType.CLARIFICATION) {
            answer.append("\n\n").append("Could you tell me more about what you're looking for, such as the type of product or your budget?");
        }

        state.setCitations(citations);
        state.setFinalAnswer(answer.toString().trim());
        state.step(NODE, citations.size() + " citations");
        log.info("Answered query='{}' with {} citations", state.getQuery(), citations.size());
    }

    private static String emptyMessage(ConversationState state) {
        if (state.isRetrievalFailed()) {
            return "Sorry, I could not complete this search right now because the product sources are unavailable. "
                    + "Please try again in a moment.";
        }
        if (state.getQuery().isBlank()) {
            return "I didn't catch a product to search for.";
        }
        Double maxPrice = state.getConstraints() != null ? state.getConstraints().getMaxPrice() : null;
        String budget = maxPrice != null ? " under " + formatPrice(maxPrice) : "";
        return String.format("I couldn't find any matching results for \"%s\"%s. "
                + "Try different keywords or a higher budget.", quoted(state.getQuery()), budget);
    }

    private static String summary(String query, ReconciledResult top, int count) {
        String price = top.getPrice() != null ? " at " + formatPrice(top.getPrice()) : "";
        return String.format("I found %d option%s for \"%s\". My top pick is %s%s [%d].",
                count, count == 1 ? "" : "s", quoted(query), titleOf(top), price, top.citationIndex());
    }

    private String explanation(ConversationState state, List<ReconciledResult> results, int citationCount) {
        AgentConfig.Answer config = agentConfig.getAnswer();
        if (config.isUseLanguageModel()) {
            Optional<String> generated = geminiService.generate(
                            EXPLAIN_PROMPT,
                            "Request: " + state.getQuery() + "\n\nProducts:\n" + numberedList(results, results.size()),
                            config.getTemperature(), config.getMaxOutputTokens(), false)
                    .map(text -> stripUnknownCitations(text, citationCount))
                    .filter(text -> !text.isBlank());
            if (generated.isPresent()) {
                return generated.get();
            }
            state.log(NODE + ": language model unavailable, using template explanation");
        }
        return numberedList(results, Math.max(1, config.getMaxListed()));
    }

    private static String numberedList(List<ReconciledResult> results, int limit) {
        StringBuilder list = new StringBuilder();
        for (ReconciledResult result : results.subList(0, Math.min(limit, results.size()))) {
            list.append('[').append(result.citationIndex()).append("] ")
                    .append(titleOf(result))
                    .append(" - ")
                    .append(result.getPrice() != null ? formatPrice(result.getPrice()) : "price not listed")
                    .append(" (").append(result.getSource().toJson()).append(")\n");
        }
        return list.toString().trim();
    }

    /**
     * Remove [n] markers that do not refer to one of the citations 1..citationCount.
     */
    static String stripUnknownCitations(String text, int citationCount) {
        Matcher matcher = CITATION_MARKER.matcher(text);
        StringBuilder cleaned = new StringBuilder();
        while (matcher.find()) {
            boolean known;
            try {
                int index = Integer.parseInt(matcher.group(1));
                known = index >= 1 && index <= citationCount;
            } catch (NumberFormatException e) {
                known = false;
            }
            matcher.appendReplacement(cleaned, known ? Matcher.quoteReplacement(matcher.group()) : "");
        }
        matcher.appendTail(cleaned);
        return cleaned.toString().replaceAll("[ \\t]{2,}", " ").replaceAll(" +([.,;:!?])", "$1").trim();
    }

    static String caution(Set<String> flags) {
        StringBuilder caution = new StringBuilder();
        if (flags.contains(RouterService.AGE_RESTRICTED)) {
            caution.append("Note: some of these products are age-restricted; check local laws and the retailer's age requirements.\n");
        }
        if (flags.contains(RouterService.MEDICAL)) {
            caution.append("Note: this is not medical advice; consult a pharmacist or doctor before use.\n");
        }
        if (flags.contains(RouterService.CHILD_PRODUCT)) {
            caution.append("Note: check the age rating and safety certifications before buying for a child.\n");
        }
        return caution.toString().trim();
    }

    private static String titleOf(ReconciledResult result) {
        if (result.getTitle() != null && !result.getTitle().isBlank()) {
            return quoted(result.getTitle());
        }
        return quoted(result.getUrl() != null ? result.getUrl() : result.getIdentityKey());
    }

    /**
     * User or retailer text placed in the answer; a literal [n] becomes (n) so it cannot read as a citation.
     */
    static String quoted(String text) {
        return text == null ? "" : CITATION_MARKER.matcher(text).replaceAll("($1)");
    }

    static String formatPrice(double price) {
        return String.format(Locale.US, "$%.2f", price);
    }
}
