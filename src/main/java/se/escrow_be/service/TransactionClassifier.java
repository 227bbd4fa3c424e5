package se.escrow_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import se.escrow_be.configuration.properties.DisputeProperties;
import se.escrow_be.exception.EscrowStateException;
import se.escrow_be.pojo.enums.TransactionCategory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword classifier for disputed transactions. Deterministic: the same description always
 * yields the same category and therefore the same evidence requirements.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionClassifier {

    private final DisputeProperties disputeProperties;

    public TransactionCategory classify(String description) {
        if (description == null || description.isBlank()) {
            return disputeProperties.getFallbackCategory();
        }
        String text = description.toLowerCase(Locale.ROOT);
        for (Map.Entry<TransactionCategory, List<String>> rule : disputeProperties.getCategories().entrySet()) {
            for (String keyword : rule.getValue()) {
                if (matches(text, keyword)) {
                    log.debug("Classified '{}' as {} on keyword '{}'", description, rule.getKey(), keyword);
                    return rule.getKey();
                }
            }
        }
        return disputeProperties.getFallbackCategory();
    }

    public List<String> requiredEvidence(TransactionCategory category) {
        List<String> required = disputeProperties.getEvidenceRequirements().get(category);
        if (required == null || required.isEmpty()) {
            throw new EscrowStateException("No evidence requirements configured for category " + category);
        }
        return List.copyOf(required);
    }

    // Keywords anchor at a word start so "app" does not match "happy"; plurals still match.
    private static boolean matches(String text, String keyword) {
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        return Pattern.compile("\\b" + Pattern.quote(normalized)).matcher(text).find();
    }
}
