package com.studio45.backend.modules.notification.application;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * URL context for HTML bodies. A variable that opens a URL-valued attribute ({@code href="{{Url}}"})
 * may only carry a relative URL or an http, https or mailto URL; anything else is replaced by
 * {@value #UNSAFE_URL_REPLACEMENT}.
 */
final class UrlAttributeSanitizer {

    static final String UNSAFE_URL_REPLACEMENT = "#";

    private static final Logger log = LoggerFactory.getLogger(UrlAttributeSanitizer.class);

    private static final Pattern URL_ATTRIBUTE_VARIABLE = Pattern.compile(
            "(?i)\\b(?:href|src|action|formaction|poster|background|cite)\\s*=\\s*[\"']?\\s*"
                    + "\\{\\{[{&]?\\s*([\\w.-]+)\\s*\\}?\\}\\}");
    private static final Set<String> SAFE_SCHEMES = Set.of("http", "https", "mailto");

    private UrlAttributeSanitizer() {
    }

    static Set<String> urlVariables(String htmlTemplate) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = URL_ATTRIBUTE_VARIABLE.matcher(htmlTemplate);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    static Map<String, String> sanitize(String htmlTemplate, Map<String, String> variables) {
        Set<String> urlVariables = urlVariables(htmlTemplate);
        if (urlVariables.isEmpty()) {
            return variables;
        }
        Map<String, String> sanitized = new LinkedHashMap<>(variables);
        for (String name : urlVariables) {
            String value = sanitized.get(name);
            if (value != null && !isSafeUrl(value)) {
                log.warn("Replaced unsafe URL value for template variable {}", name);
                sanitized.put(name, UNSAFE_URL_REPLACEMENT);
            }
        }
        return sanitized;
    }

    static boolean isSafeUrl(String value) {
        // browsers drop whitespace and control characters inside a scheme
        StringBuilder compact = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c > 0x20 && c != 0x7f) {
                compact.append(c);
            }
        }
        String url = compact.toString();
        int colon = url.indexOf(':');
        if (colon < 0) {
            return true;
        }
        for (int i = 0; i < colon; i++) {
            char c = url.charAt(i);
            if (c == '/' || c == '?' || c == '#') {
                return true;
            }
        }
        return SAFE_SCHEMES.contains(url.substring(0, colon).toLowerCase(Locale.ROOT));
    }
}
