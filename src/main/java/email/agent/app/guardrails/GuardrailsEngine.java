package email.agent.app.guardrails;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scans generated reply text for content that must not be sent without a human
 * looking at it first.
 *
 * <p>Checks run in a fixed order so results are deterministic: low confidence,
 * profanity, PII, commitment language, custom keywords. Patterns are compiled when the
 * engine is built; {@link #updateConfig} compiles a complete new set and swaps it in
 * with a single write, so a concurrent {@link #validate} sees either the old or the new
 * patterns, never a mix.
 */
@Slf4j
public class GuardrailsEngine {
    // Minimal seed list; whole words only
    private static final List<String> PROFANITY_PATTERNS = List.of(
            "\\b(damn|shit|fuck|ass|bitch|bastard|crap|hell)\\b",
            "\\b(wtf|stfu|lmao|lmfao)\\b"
    );

    // Visa, Mastercard, Amex, Discover
    private static final String CREDIT_CARD_PATTERN =
            "\\b(?:4[0-9]{12}(?:[0-9]{3})?|5[1-5][0-9]{14}|3[47][0-9]{13}|6(?:011|5[0-9]{2})[0-9]{12})\\b";
    private static final String SSN_PATTERN = "\\b\\d{3}[-\\s]?\\d{2}[-\\s]?\\d{4}\\b";
    private static final List<String> SECRET_PATTERNS = List.of(
            "(?i)password\\s*[:=]\\s*\\S+",
            "(?i)pwd\\s*[:=]\\s*\\S+",
            "(?i)secret\\s*[:=]\\s*\\S+",
            "(?i)api[_-]?key\\s*[:=]\\s*\\S+",
            "(?i)access[_-]?token\\s*[:=]\\s*\\S+"
    );

    // Wording that could bind the user legally or financially
    private static final List<String> COMMITMENT_PATTERNS = List.of(
            "(?i)\\b(i agree|i accept|i confirm|i approve)\\b",
            "(?i)\\b(confirmed|approved|accepted|agreed)\\b",
            "(?i)\\b(i('ll| will) pay|i('ll| will) send (the )?money)\\b",
            "(?i)\\b(you have my (word|permission|approval))\\b",
            "(?i)\\b(deal|it's a deal|we have a deal)\\b",
            "(?i)\\b(i commit|i promise|i guarantee)\\b",
            "(?i)\\b(binding|legally binding|contractually)\\b"
    );

    private static final String REDACTED = "[REDACTED]";

    private volatile CompiledGuardrails compiled;

    public GuardrailsEngine() {
        this(GuardrailConfig.defaults());
    }

    public GuardrailsEngine(GuardrailConfig config) {
        this.compiled = new CompiledGuardrails(config);
    }

    public GuardrailConfig getConfig() {
        return compiled.config;
    }

    public void updateConfig(GuardrailConfig config) {
        this.compiled = new CompiledGuardrails(config);
    }

    public ValidationResult validate(String content) {
        return validate(content, 1.0);
    }

    /**
     * @param content    reply body to check
     * @param confidence model-reported confidence, 0.0 - 1.0
     */
    public ValidationResult validate(String content, double confidence) {
        CompiledGuardrails patterns = this.compiled;
        GuardrailConfig config = patterns.config;
        String text = content != null ? content : "";
        List<GuardrailViolation> violations = new ArrayList<>();

        // NaN compares false against the threshold, so it is rejected explicitly
        if (!Double.isFinite(confidence) || confidence < config.getConfidenceThreshold()) {
            violations.add(new GuardrailViolation(
                    ViolationType.LOW_CONFIDENCE,
                    String.format(Locale.ROOT, "confidence=%.2f", confidence),
                    String.format(Locale.ROOT, "Low confidence (%.2f) below threshold (%s)",
                            confidence, config.getConfidenceThreshold())));
        }
        if (config.isProfanityFilterEnabled()) {
            violations.addAll(checkProfanity(text, patterns));
        }
        if (config.isPiiFilterEnabled()) {
            violations.addAll(checkPii(text, patterns));
        }
        if (config.isCommitmentFilterEnabled()) {
            violations.addAll(checkCommitments(text, patterns));
        }
        if (config.isCustomKeywordsEnabled() && !patterns.customKeywords.isEmpty()) {
            violations.addAll(checkCustomKeywords(text, patterns));
        }

        ValidationResult result = ValidationResult.of(violations);
        if (!result.isPassed()) {
            log.debug("Guardrails found {} violation(s): {}", violations.size(), result.getViolationSummary());
        }
        return result;
    }

    private List<GuardrailViolation> checkProfanity(String text, CompiledGuardrails patterns) {
        List<GuardrailViolation> violations = new ArrayList<>();
        for (Pattern pattern : patterns.profanity) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String masked = maskText(matcher.group());
                violations.add(new GuardrailViolation(ViolationType.PROFANITY, masked,
                        "Profanity detected: " + masked));
            }
        }
        return violations;
    }

    private List<GuardrailViolation> checkPii(String text, CompiledGuardrails patterns) {
        List<GuardrailViolation> violations = new ArrayList<>();

        Matcher cards = patterns.creditCard.matcher(text);
        while (cards.find()) {
            String masked = maskCreditCard(cards.group());
            violations.add(new GuardrailViolation(ViolationType.PII_CREDIT_CARD, masked,
                    "Credit card number detected: " + masked));
        }

        Matcher ssns = patterns.ssn.matcher(text);
        while (ssns.find()) {
            String candidate = ssns.group();
            if (looksLikeSsn(candidate)) {
                violations.add(new GuardrailViolation(ViolationType.PII_SSN,
                        "***-**-" + candidate.substring(candidate.length() - 4),
                        "Social Security Number detected"));
            }
        }

        for (Pattern pattern : patterns.secrets) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                violations.add(new GuardrailViolation(ViolationType.PII_PASSWORD, REDACTED,
                        "Password or API key detected in content"));
            }
        }
        return violations;
    }

    private List<GuardrailViolation> checkCommitments(String text, CompiledGuardrails patterns) {
        List<GuardrailViolation> violations = new ArrayList<>();
        for (Pattern pattern : patterns.commitments) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String match = matcher.group();
                violations.add(new GuardrailViolation(ViolationType.COMMITMENT_WORD, match,
                        "Commitment language detected: '" + match + "'"));
            }
        }
        return violations;
    }

    private List<GuardrailViolation> checkCustomKeywords(String text, CompiledGuardrails patterns) {
        List<GuardrailViolation> violations = new ArrayList<>();
        for (Pattern pattern : patterns.customKeywords) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String match = matcher.group();
                violations.add(new GuardrailViolation(ViolationType.CUSTOM_KEYWORD, match,
                        "Blocked keyword detected: '" + match + "'"));
            }
        }
        return violations;
    }

    /**
     * Keeps the first and last character; two characters or fewer are fully masked.
     */
    static String maskText(String text) {
        if (text.length() <= 2) {
            return "*".repeat(text.length());
        }
        return text.charAt(0) + "*".repeat(text.length() - 2) + text.charAt(text.length() - 1);
    }

    static String maskCreditCard(String number) {
        String digits = number.replaceAll("\\D", "");
        return "****-****-****-" + digits.substring(Math.max(0, digits.length() - 4));
    }

    /**
     * SSA validity: area not 000, 666 or 900-999; group not 00; serial not 0000.
     * Filters out phone numbers and other nine digit sequences.
     */
    static boolean looksLikeSsn(String text) {
        String digits = text.replaceAll("\\D", "");
        if (digits.length() != 9) {
            return false;
        }
        int area = Integer.parseInt(digits.substring(0, 3));
        if (area == 0 || area == 666 || area >= 900) {
            return false;
        }
        int group = Integer.parseInt(digits.substring(3, 5));
        if (group == 0) {
            return false;
        }
        int serial = Integer.parseInt(digits.substring(5));
        return serial != 0;
    }

    private static final class CompiledGuardrails {
        private final GuardrailConfig config;
        private final List<Pattern> profanity;
        private final Pattern creditCard;
        private final Pattern ssn;
        private final List<Pattern> secrets;
        private final List<Pattern> commitments;
        private final List<Pattern> customKeywords;

        private CompiledGuardrails(GuardrailConfig config) {
            this.config = config;
            this.profanity = compileAll(PROFANITY_PATTERNS, Pattern.CASE_INSENSITIVE);
            this.creditCard = Pattern.compile(CREDIT_CARD_PATTERN);
            this.ssn = Pattern.compile(SSN_PATTERN);
            this.secrets = compileAll(SECRET_PATTERNS, 0);
            this.commitments = compileAll(COMMITMENT_PATTERNS, 0);
            List<String> keywords = config.getCustomBlockedKeywords() != null
                    ? config.getCustomBlockedKeywords()
                    : List.of();
            this.customKeywords = keywords.stream()
                    .filter(kw -> kw != null && !kw.isBlank())
                    .map(kw -> Pattern.compile("\\b" + Pattern.quote(kw) + "\\b",
                            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                    .collect(Collectors.toUnmodifiableList());
        }

        private static List<Pattern> compileAll(List<String> regexes, int flags) {
            return regexes.stream()
                    .map(regex -> Pattern.compile(regex, flags))
                    .collect(Collectors.toUnmodifiableList());
        }
    }
}
