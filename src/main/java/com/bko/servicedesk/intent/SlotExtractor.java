package com.bko.servicedesk.intent;

import com.bko.servicedesk.entity.CustomerStatus;
import com.bko.servicedesk.entity.TicketPriority;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls identifiers, priority, email, phone and status out of free text. Independent of wording and case.
 */
@Component
public class SlotExtractor {

    static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    static final Pattern PHONE = Pattern.compile("\\+?\\(?\\d[\\d\\s().-]{5,}\\d");
    private static final Pattern REFERENCED_ID = Pattern.compile("(?:\\bid|\\bcustomer|#)\\s*(?:is\\b)?\\s*[:#]?\\s*(\\d+)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])(\\d+)(?!\\w)(?!\\.\\d)");
    private static final Pattern PRIORITY_BEFORE = Pattern.compile("\\b(low|medium|high)[\\s-]+priority\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PRIORITY_AFTER = Pattern.compile("\\bpriority\\s*(?:is|of|to|:|=)?\\s*(low|medium|high)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS = Pattern.compile("\\b(active|disabled|inactive)\\b", Pattern.CASE_INSENSITIVE);

    public IntentSlots extract(String text, CallerContext context) {
        if (!StringUtils.hasText(text)) {
            return new IntentSlots(List.of(), context.customerId(), null, null, null, null);
        }
        String email = firstMatch(EMAIL, text);
        String withoutEmail = scrub(text, EMAIL);
        Long referenced = referencedId(withoutEmail);
        String phone = firstPhone(withoutEmail, referenced);
        List<Long> identifiers = identifiers(scrubPhones(withoutEmail, referenced));

        Long customerId = context.customerId();
        if (customerId == null) {
            customerId = referenced;
        }
        if (customerId == null && !identifiers.isEmpty()) {
            customerId = identifiers.get(0);
        }
        return new IntentSlots(identifiers, customerId, priority(text), email, phone, status(text));
    }

    /**
     * Customer reference of a single clause, without falling back to any caller context.
     */
    @Nullable
    public Long customerReference(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String withoutEmail = scrub(text, EMAIL);
        Long referenced = referencedId(withoutEmail);
        if (referenced != null) {
            return referenced;
        }
        List<Long> identifiers = identifiers(scrubPhones(withoutEmail, null));
        return identifiers.isEmpty() ? null : identifiers.get(0);
    }

    @Nullable
    public String email(String text) {
        return firstMatch(EMAIL, text);
    }

    @Nullable
    public String phone(String text) {
        if (!StringUtils.hasText(text)) {
            return null;
        }
        String withoutEmail = scrub(text, EMAIL);
        return firstPhone(withoutEmail, referencedId(withoutEmail));
    }

    private List<Long> identifiers(String text) {
        List<Long> identifiers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            Long value = positive(matcher.group(1));
            if (value != null) {
                identifiers.add(value);
            }
        }
        return identifiers;
    }

    @Nullable
    private Long referencedId(String text) {
        Matcher matcher = REFERENCED_ID.matcher(text);
        while (matcher.find()) {
            Long value = positive(matcher.group(1));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @Nullable
    private TicketPriority priority(String text) {
        String level = firstGroup(PRIORITY_BEFORE, text);
        if (level == null) {
            level = firstGroup(PRIORITY_AFTER, text);
        }
        return level == null ? null : TicketPriority.parse(level).orElse(null);
    }

    @Nullable
    private CustomerStatus status(String text) {
        String raw = firstGroup(STATUS, text);
        if (raw == null) {
            return null;
        }
        String normalized = raw.toLowerCase(Locale.ROOT);
        return "inactive".equals(normalized) ? CustomerStatus.DISABLED : CustomerStatus.parse(normalized).orElse(null);
    }

    @Nullable
    private String firstPhone(String text, @Nullable Long referenced) {
        boolean mentionsPhone = mentionsPhone(text);
        Matcher matcher = PHONE.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            if (isPhone(candidate, mentionsPhone, referenced)) {
                return candidate;
            }
        }
        return null;
    }

    private String scrubPhones(String text, @Nullable Long referenced) {
        boolean mentionsPhone = mentionsPhone(text);
        Matcher matcher = PHONE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String match = matcher.group();
            boolean remove = isPhone(match.trim(), mentionsPhone, referenced);
            matcher.appendReplacement(out, Matcher.quoteReplacement(remove ? " " : match));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * At least seven digits, and either written with separators or a leading {@code +}, or a bare digit run
     * in text that talks about a phone. A bare run that is the referenced customer id stays an identifier.
     */
    private static boolean isPhone(String candidate, boolean mentionsPhone, @Nullable Long referenced) {
        if (candidate.chars().filter(Character::isDigit).count() < 7) {
            return false;
        }
        boolean bareDigits = candidate.chars().allMatch(Character::isDigit);
        if (!bareDigits) {
            return true;
        }
        return mentionsPhone && (referenced == null || !candidate.equals(String.valueOf(referenced)));
    }

    private static boolean mentionsPhone(String text) {
        return text.toLowerCase(Locale.ROOT).contains("phone");
    }

    private static String scrub(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, " ");
        }
        matcher.appendTail(out);
        return out.toString();
    }

    @Nullable
    private static String firstMatch(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    @Nullable
    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    @Nullable
    private static Long positive(String digits) {
        try {
            long value = Long.parseLong(digits);
            return value > 0 ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
