package com.scoutiq.ai.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scoutiq.ai.config.AgentConfig;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.ai.model.Intent;
import com.scoutiq.common.enums.IntentType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * First pipeline stage: decides whether a query is a shopping request and attaches safety flags.
 *
 * Order of checks:
 * 1. Blank query - clarification
 * 2. Keyword screen for obviously unrelated requests (weather, jokes, homework...)
 * 3. Gemini JSON classifier; any failure falls open to product_query
 *
 * Keyword safety flags are always added and unioned with flags from the model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouterService {

    public static final String NODE = "router";

    public static final String AGE_RESTRICTED = "age_restricted";
    public static final String MEDICAL = "medical";
    public static final String CHILD_PRODUCT = "child_product";

    private static final String SYSTEM_PROMPT = """
            You classify requests sent to a shopping assistant.
            Reply with JSON only: {"type": "...", "safety_flags": [...]}
            type is one of:
            - "product_query": the user wants to find, compare or buy a product
            - "out_of_scope": anything else (chit-chat, weather, news, homework, coding)
            - "clarification": a shopping request too vague to search
            safety_flags may contain "age_restricted", "medical", "child_product".
            """;

    private static final Pattern SHOPPING_CUE = Pattern.compile(
            "\\b(buy|shop|shopping|price|prices|cheap|cheaper|deal|deals|under|budget|recommend|"
                    + "product|products|brand|order|purchase|gift|\\$)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> OUT_OF_SCOPE = List.of(
            Pattern.compile("\\b(weather|forecast|temperature outside)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(tell|know) (me )?(a )?joke\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(write|compose) (me )?(a )?(poem|song|story|essay)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(homework|solve|equation|integral|derivative)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^\\s*what(?:'s| is)\\s+\\d+\\s*[-+*/x]\\s*\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(news|headlines|election|stock market)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(debug|stack trace|python code|java code|write (a )?(function|program|script))\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private static final Map<String, Pattern> SAFETY_RULES = new LinkedHashMap<>();

    static {
        SAFETY_RULES.put(AGE_RESTRICTED, Pattern.compile(
                "\\b(alcohol|beer|wine|whiskey|vodka|liquor|tobacco|cigarettes?|cigars?|vapes?|vaping|e-cig\\w*|"
                        + "nicotine|firearms?|guns?|ammo|ammunition|knife|knives|lighter fluid)\\b",
                Pattern.CASE_INSENSITIVE));
        SAFETY_RULES.put(MEDICAL, Pattern.compile(
                "\\b(medicine|medication|medical|supplements?|vitamins?|prescription|drugs?|pills?|"
                        + "pain reliever|ibuprofen|acetaminophen|melatonin|first aid)\\b",
                Pattern.CASE_INSENSITIVE));
        SAFETY_RULES.put(CHILD_PRODUCT, Pattern.compile(
                "\\b(baby|babies|infants?|toddlers?|newborns?|kids?|child|children|\\d{1,2}[- ]?(year|yr)s?[- ]?old)\\b",
                Pattern.CASE_INSENSITIVE));
    }

    private final GeminiService geminiService;
    private final AgentConfig agentConfig;
    private final ObjectMapper objectMapper;

    public void route(ConversationState state) {
        String query = state.getQuery();
        Set<String> flags = safetyFlags(query);

        if (query.isBlank()) {
            state.setIntent(Intent.of(IntentType.CLARIFICATION, flags));
            state.step(NODE, "empty query, asking for clarification");
            return;
        }

        if (isObviouslyOutOfScope(query)) {
            state.setIntent(Intent.of(IntentType.OUT_OF_SCOPE, flags));
            state.step(NODE, "out_of_scope (keyword screen)");
            return;
        }

        IntentType type = IntentType.PRODUCT_QUERY;
        String how = "default";
        if (agentConfig.getRouter().isUseLanguageModel()) {
            Optional<ModelVerdict> verdict = classify(query);
            if (verdict.isPresent()) {
                type = verdict.get().type();
                flags.addAll(verdict.get().flags());
                how = "model";
            } else {
                how = "classifier unavailable, failing open";
                state.log(NODE + ": classifier unavailable, treating query as product_query");
            }
        }

        state.setIntent(Intent.of(type, flags));
        state.step(NODE, type.toJson() + " (" + how + ")" + (flags.isEmpty() ? "" : ", flags=" + flags));
        log.info("Routed query='{}' intent={} flags={} via {}", query, type, flags, how);
    }

    static Set<String> safetyFlags(String query) {
        Set<String> flags = new LinkedHashSet<>();
        if (query == null) {
            return flags;
        }
        SAFETY_RULES.forEach((flag, pattern) -> {
            if (pattern.matcher(query).find()) {
                flags.add(flag);
            }
        });
        return flags;
    }

    static boolean isObviouslyOutOfScope(String query) {
        if (SHOPPING_CUE.matcher(query).find()) {
            return false;
        }
        return OUT_OF_SCOPE.stream().anyMatch(p -> p.matcher(query).find());
    }

    private Optional<ModelVerdict> classify(String query) {
        AgentConfig.Router router = agentConfig.getRouter();
        return geminiService.generate(SYSTEM_PROMPT, query, router.getTemperature(), router.getMaxOutputTokens(), true)
                .flatMap(this::parseVerdict);
    }

    Optional<ModelVerdict> parseVerdict(String raw) {
        String json = raw.trim();
        // Models sometimes wrap JSON in a markdown fence
        if (json.startsWith("```")) {
            json = json.replaceFirst("^```(?:json)?\\s*", "").replaceFirst("\\s*```$", "");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            IntentType type = IntentType.fromLabel(root.path("type").asText(null));
            if (type == null) {
                log.warn("Classifier returned unknown intent: {}", raw);
                return Optional.empty();
            }
            Set<String> flags = new LinkedHashSet<>();
            JsonNode flagNode = root.path("safety_flags");
            if (flagNode.isArray()) {
                for (JsonNode flag : flagNode) {
                    String value = flag.asText("").trim().toLowerCase(Locale.ROOT);
                    if (SAFETY_RULES.containsKey(value)) {
                        flags.add(value);
                    }
                }
            }
            return Optional.of(new ModelVerdict(type, flags));
        } catch (JsonProcessingException e) {
            log.warn("Classifier returned unparsable output: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    record ModelVerdict(IntentType type, Set<String> flags) {
    }
}
