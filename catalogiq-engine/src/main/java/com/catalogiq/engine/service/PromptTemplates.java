package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.common.enums.Aspect;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prompts sent to the oracle. Kept in one place so wording changes do not touch ranking code.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    public static String duplicateValidation(Item a, Item b, Map<Aspect, Double> aspectScores) {
        StringBuilder sb = new StringBuilder();
        sb.append("Are these the same product? (Answer TRUE/FALSE only)\n");
        sb.append("Product 1: ").append(describe(a)).append('\n');
        sb.append("Product 2: ").append(describe(b)).append('\n');
        Double title = aspectScores.get(Aspect.TITLE);
        if (title != null) {
            sb.append("Title similarity: ").append(percent(title)).append("%\n");
        }
        Double attributes = aspectScores.get(Aspect.ATTRIBUTES);
        if (attributes != null) {
            sb.append("Attribute similarity: ").append(percent(attributes)).append("%\n");
        }
        return sb.toString().trim();
    }

    public static String mergeRecommendation(List<Item> members) {
        StringBuilder sb = new StringBuilder("These listings are duplicates. Which id should be kept?\n");
        for (Item member : members) {
            sb.append(member.getId()).append(": ").append(describe(member)).append('\n');
        }
        sb.append("Respond with just the id to keep and a brief reason (20 words max).");
        return sb.toString();
    }

    public static String substituteRating(Item target, Item candidate, double similarity) {
        return "Rate how good a substitute this is (0-10 scale):\n"
                + "Original: " + describe(target) + "\n"
                + "Substitute: " + describe(candidate) + "\n"
                + "Category: " + nullToEmpty(candidate.getCategory()) + "\n"
                + "Similarity: " + percent(similarity) + "%\n"
                + "Consider features, quality, and value. Return only a number 0-10.";
    }

    public static String substituteReason(Item target, Item candidate) {
        return "In 30 words, explain why " + candidate.displayName()
                + " is a good substitute for " + target.displayName();
    }

    public static String crossSellCheck(String customerSegment, Item target, Item candidate) {
        return "Would a " + customerSegment + " customer who bought \"" + nullToEmpty(target.getName())
                + "\" also want \"" + nullToEmpty(candidate.getName()) + "\"? "
                + "Consider complementary usage and customer needs. Answer TRUE or FALSE.";
    }

    public static String crossSellReason(Item target, Item candidate) {
        return "In 20 words, explain why someone who bought " + nullToEmpty(target.getName())
                + " would also want " + nullToEmpty(candidate.getName());
    }

    public static String searchMatchExplanation(String query, Item item) {
        return "Explain in 2 sentences why \"" + nullToEmpty(item.getName())
                + "\" matches the search query \"" + query + "\". Focus on key similarities.";
    }

    private static String describe(Item item) {
        return item.displayName() + " ($" + formatPrice(item.getPrice()) + ")";
    }

    private static String formatPrice(BigDecimal price) {
        return price == null ? "?" : price.stripTrailingZeros().toPlainString();
    }

    private static String percent(double score) {
        return String.format(Locale.ROOT, "%.1f", score * 100);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
