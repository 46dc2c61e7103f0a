package com.aikb.rag.redact;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Lossy, one-way scrubbing of sensitive substrings. Used on text headed for logs, the
 * audit trail or the model prompt; never on text returned to the end user.
 */
@Component
public class PiiRedactor {

    public static final String EMAIL_PLACEHOLDER = "[EMAIL REDACTED]";
    public static final String PHONE_PLACEHOLDER = "[PHONE REDACTED]";
    public static final String SSN_PLACEHOLDER = "[SSN REDACTED]";
    public static final String ID_PLACEHOLDER = "[ID REDACTED]";
    public static final String FIELD_PLACEHOLDER = "[REDACTED]";

    // Also catches "name [at] host (dot) com" style obfuscation
    private static final Pattern EMAIL = Pattern.compile(
            "[a-zA-Z0-9._%+-]+(?:\\s*(?:@|\\[at]|\\(at\\))\\s*)[a-zA-Z0-9-]+(?:(?:\\s*(?:\\.|\\[dot]|\\(dot\\))\\s*)[a-zA-Z0-9-]+)*(?:\\s*(?:\\.|\\[dot]|\\(dot\\))\\s*)[a-zA-Z]{2,}",
            Pattern.CASE_INSENSITIVE);

    // SSN runs before phone so that 123-45-6789 is not half-eaten by the phone pattern
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}[- ]?\\d{2}[- ]?\\d{4}\\b");

    private static final Pattern PHONE = Pattern.compile(
            "(?<![\\w-])(?:\\+\\d{1,3}[\\s.-]?)?(?:\\(\\d{3}\\)|\\d{3})[\\s.-]?\\d{3}[\\s.-]?\\d{4}\\b");

    // Passport-style national ids: one or two letters followed by 6 to 9 digits
    private static final Pattern NATIONAL_ID = Pattern.compile("\\b[A-Z]{1,2}\\d{6,9}\\b", Pattern.CASE_INSENSITIVE);

    public String redactPii(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = EMAIL.matcher(text).replaceAll(EMAIL_PLACEHOLDER);
        out = SSN.matcher(out).replaceAll(SSN_PLACEHOLDER);
        out = PHONE.matcher(out).replaceAll(PHONE_PLACEHOLDER);
        out = NATIONAL_ID.matcher(out).replaceAll(ID_PLACEHOLDER);
        return out;
    }

    /**
     * Replaces {@code field: value} and {@code field=value} pairs for each configured
     * field name, case-insensitively. The value runs to the end of the line or the next
     * comma.
     */
    public String redactFields(String text, List<String> fields) {
        if (text == null || text.isEmpty() || fields == null || fields.isEmpty()) return text;
        String out = text;
        for (String field : fields) {
            if (field == null || field.isBlank()) continue;
            String name = field.trim();
            Pattern p = Pattern.compile(Pattern.quote(name) + "\\s*[:=]\\s*[^\\n,]+", Pattern.CASE_INSENSITIVE);
            out = p.matcher(out).replaceAll(java.util.regex.Matcher.quoteReplacement(name + ": " + FIELD_PLACEHOLDER));
        }
        return out;
    }
}
