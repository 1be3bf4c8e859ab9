package com.scoutiq.ai.service;

import com.scoutiq.ai.config.RetrievalConfig;
import com.scoutiq.ai.model.Constraints;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.common.enums.SearchStrategy;
import com.scoutiq.web.normalize.PriceDomainNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the query into constraints (budget, category, keywords) and picks a search strategy.
 * Pure string processing, no network calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlannerService {

    public static final String NODE = "planner";

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)";

    /** A number must not continue into more digits, so "$12.999" is not read as 12.99 */
    private static final String NUMBER_END = "(?![.,]?\\d)";

    private static final String CEILING = "\\b(?:under|below|less than|cheaper than|max(?:imum)?|at most|up to|"
            + "no more than|within|budget(?: of| is)?)\\s*";

    private static final String CURRENCY_WORD = "\\s*(?:dollars?|usd|bucks)\\b";

    /** Quantities that follow a ceiling word without being money: "under 5 pounds", "up to 3 people" */
    private static final String UNIT = "(?!\\s*(?:[\"'%]|(?:pounds?|lbs?|kg|kilos?|grams?|g|oz|ounces?|gb|tb|mb|gigs?|"
            + "mah|watts?|w|volts?|v|hz|days?|hours?|hrs?|minutes?|mins?|seconds?|secs?|weeks?|months?|years?|yrs?|"
            + "people|persons?|guests?|players?|kids|seats?|inch(?:es)?|ft|feet|foot|cm|mm|meters?|m|miles?|mph|"
            + "sq|liters?|litres?|l|ml|qt|quarts?|gallons?|gal|cups?|pcs|pieces?|pack|count|ct|percent|x)\\b))";

    private static final List<Pattern> BUDGET_PATTERNS = List.of(
            Pattern.compile(CEILING + "(?:\\$|usd\\s*)\\s*" + NUMBER + NUMBER_END + "(?:" + CURRENCY_WORD + ")?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile(CEILING + NUMBER + NUMBER_END + CURRENCY_WORD, Pattern.CASE_INSENSITIVE),
            Pattern.compile(CEILING + NUMBER + NUMBER_END + UNIT, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\$\\s*" + NUMBER + NUMBER_END + "\\s*(?:or less|or under|or below|max)\\b",
                    Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern RETAILER = Pattern.compile(
            "\\b(?:on|at|from)\\s+(amazon|walmart|target)(?:\\.com)?\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+(?:[-'][a-z0-9]+)*");

    private static final Set<String> STOPWORDS = Set.of(
            "a", "an", "the", "and", "or", "for", "of", "to", "in", "on", "at", "from", "with", "without",
            "i", "me", "my", "we", "you", "your", "it", "is", "are", "be", "that", "this", "these", "those",
            "want", "need", "looking", "look", "find", "show", "get", "buy", "search", "please", "can", "could",
            "would", "some", "any", "good", "best", "great", "nice", "recommend", "something", "what", "which",
            "under", "below", "less", "than", "cheaper", "max", "maximum", "most", "up", "budget", "dollars",
            "dollar", "usd", "bucks", "price", "around", "about", "do", "does", "have", "has", "there"
    );

    private static final Map<String, String> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        for (String k : List.of("cleaner", "cleaning", "detergent", "disinfectant", "wipes", "sponge", "bleach", "mop")) {
            CATEGORY_KEYWORDS.put(k, "Cleaning Supplies");
        }
        for (String k : List.of("toy", "lego", "puzzle", "doll", "board-game", "plush")) {
            CATEGORY_KEYWORDS.put(k, "Toys & Games");
        }
        for (String k : List.of("headphone", "earbud", "speaker", "charger", "laptop", "phone", "tablet",
                "keyboard", "mouse", "monitor", "camera", "cable")) {
            CATEGORY_KEYWORDS.put(k, "Electronics");
        }
        for (String k : List.of("shampoo", "conditioner", "lotion", "soap", "moisturizer", "sunscreen", "toothpaste")) {
            CATEGORY_KEYWORDS.put(k, "Beauty & Personal Care");
        }
        for (String k : List.of("pan", "pot", "knife", "blender", "cookware", "kettle", "mug", "skillet")) {
            CATEGORY_KEYWORDS.put(k, "Kitchen & Dining");
        }
        for (String k : List.of("dog", "cat", "pet", "leash", "litter")) {
            CATEGORY_KEYWORDS.put(k, "Pet Supplies");
        }
        for (String k : List.of("shoe", "sneaker", "shirt", "jacket", "sock", "dress", "jeans")) {
            CATEGORY_KEYWORDS.put(k, "Clothing, Shoes & Jewelry");
        }
        for (String k : List.of("tent", "backpack", "bottle", "yoga", "dumbbell", "bike")) {
            CATEGORY_KEYWORDS.put(k, "Sports & Outdoors");
        }
    }

    private final RetrievalConfig retrievalConfig;

    public void plan(ConversationState state) {
        String query = state.getQuery();

        Constraints constraints = Constraints.builder()
                .maxPrice(extractBudget(query))
                .keywords(extractKeywords(query))
                .build();
        constraints.setCategory(categoryFor(constraints.getKeywords()));

        SearchStrategy strategy = chooseStrategy(query, constraints);

        state.setConstraints(constraints);
        state.setStrategy(strategy);
        state.step(NODE, String.format("strategy=%s, maxPrice=%s, category=%s, keywords=%s",
                strategy.toJson(), constraints.getMaxPrice(), constraints.getCategory(), constraints.getKeywords()));
        log.info("Planned query='{}' strategy={} maxPrice={} category={}",
                query, strategy, constraints.getMaxPrice(), constraints.getCategory());
    }

    /**
     * Budget ceiling from phrases like "under $15" or "$15 or less"; null when absent or out of range.
     * A bare number after a ceiling word counts unless a unit follows it.
     */
    static Double extractBudget(String query) {
        if (query == null) {
            return null;
        }
        for (Pattern pattern : BUDGET_PATTERNS) {
            Matcher matcher = pattern.matcher(query);
            while (matcher.find()) {
                double value = Double.parseDouble(matcher.group(1).replace(",", ""));
                if (PriceDomainNormalizer.isValidPrice(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    static Set<String> extractKeywords(String query) {
        Set<String> keywords = new LinkedHashSet<>();
        if (query == null) {
            return keywords;
        }
        String text = query.toLowerCase(Locale.ROOT);
        for (Pattern pattern : BUDGET_PATTERNS) {
            text = pattern.matcher(text).replaceAll(" ");
        }
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group();
            if (STOPWORDS.contains(token) || token.chars().allMatch(Character::isDigit)) {
                continue;
            }
            keywords.add(token);
        }
        return keywords;
    }

    static String categoryFor(Set<String> keywords) {
        for (String keyword : keywords) {
            String category = CATEGORY_KEYWORDS.get(keyword);
            if (category == null && keyword.endsWith("s")) {
                category = CATEGORY_KEYWORDS.get(keyword.substring(0, keyword.length() - 1));
            }
            if (category != null) {
                return category;
            }
        }
        return null;
    }

    SearchStrategy chooseStrategy(String query, Constraints constraints) {
        SearchStrategy wanted;
        if (constraints.getKeywords().isEmpty()) {
            wanted = SearchStrategy.CATALOG_ONLY;
        } else if (RETAILER.matcher(query).find()) {
            wanted = SearchStrategy.WEB_ONLY;
        } else {
            wanted = SearchStrategy.HYBRID;
        }

        boolean catalogEnabled = retrievalConfig.isCatalogEnabled();
        boolean webEnabled = retrievalConfig.isWebEnabled();
        if (wanted.usesCatalog() && !catalogEnabled && webEnabled) {
            return SearchStrategy.WEB_ONLY;
        }
        if (wanted.usesWeb() && !webEnabled && catalogEnabled) {
            return SearchStrategy.CATALOG_ONLY;
        }
        return wanted;
    }
}
