package com.agenthost.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before URLs, headers or error bodies reach the log.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    // group 1 is always the secret
    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("Authorization\\s*[:=]\\s*Bearer\\s+([A-Za-z0-9._\\-+=/]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=/]{18,})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("[?&](?:token|access_token|auth)=([^&#\\s]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"(?:token|accessToken|access_token|refresh_token)\"\\s*:\\s*\"([^\"]+)\"",
                    Pattern.CASE_INSENSITIVE));

    /**
     * Redact known credential shapes in free text.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String out = text;
        for (Pattern pattern : PATTERNS) {
            out = redactGroup(out, pattern);
        }
        return out;
    }

    /**
     * Keep the first six and last four characters of long tokens, replace short
     * ones entirely.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    private static String redactGroup(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String whole = matcher.group();
            String secret = matcher.group(1);
            int offset = matcher.start(1) - matcher.start();
            String replaced = whole.substring(0, offset) + maskToken(secret)
                    + whole.substring(offset + secret.length());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replaced));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
