package com.openforge.netagent.planner;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured filters out of free text:
 *
 *   "devices in rack A1"             → {rack: "A1"}
 *   "switches at site fra-dc2"       → {site: "fra-dc2"}
 *   "interfaces on device sw-core-01" → {device: "sw-core-01"}
 *   "critical alerts"                → {severity: "critical"}
 *   "down interfaces"                → {status: "down"}
 *
 * Values keep the casing they had in the query, except severity and status
 * which are lower-cased.
 */
public class FilterExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern RACK   = Pattern.compile("\\brack\\s+([A-Za-z0-9][\\w./-]*)", FLAGS);
    private static final Pattern SITE   = Pattern.compile("\\bsite\\s+([A-Za-z0-9][\\w./-]*)", FLAGS);
    // a device name must contain a digit, dot or hyphen so plain words are not taken for names
    private static final Pattern DEVICE = Pattern.compile(
            "\\b(?:device|host|switch|router|firewall)\\s+([A-Za-z0-9][\\w.-]*[\\d.-][\\w.-]*)", FLAGS);
    private static final Pattern ALERT_CONTEXT = Pattern.compile("\\b(?:alert|alarm)", FLAGS);
    private static final Pattern SEVERITY = Pattern.compile(
            "\\b(critical|warning|major|minor|info)\\b", FLAGS);
    private static final Pattern STATUS_PHRASE = Pattern.compile(
            "\\b(?:status|state)\\s+(?:is\\s+|of\\s+)?(up|down|active|offline|planned|failed)\\b", FLAGS);
    private static final Pattern STATUS_ADJECTIVE = Pattern.compile(
            "\\b(down|offline|online)\\s+(?:devices|interfaces|ports|links|hosts)\\b", FLAGS);

    public Map<String, Object> extract(String text) {
        Map<String, Object> filters = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return filters;

        find(RACK, text).ifPresent(v -> filters.put("rack", v));
        find(SITE, text).ifPresent(v -> filters.put("site", v));
        find(DEVICE, text).ifPresent(v -> filters.put("device", v));

        if (ALERT_CONTEXT.matcher(text).find()) {
            find(SEVERITY, text).ifPresent(v -> filters.put("severity", v.toLowerCase(Locale.ROOT)));
        }

        find(STATUS_PHRASE, text)
                .or(() -> find(STATUS_ADJECTIVE, text))
                .ifPresent(v -> filters.put("status", v.toLowerCase(Locale.ROOT)));
        return filters;
    }

    /** True when the text names its own subject (a rack, site or device). */
    public boolean mentionsSubject(String text) {
        if (text == null) return false;
        return RACK.matcher(text).find() || SITE.matcher(text).find() || DEVICE.matcher(text).find();
    }

    private static Optional<String> find(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) return Optional.empty();
        String value = trimTrailingPunctuation(matcher.group(1));
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static String trimTrailingPunctuation(String value) {
        int end = value.length();
        while (end > 0 && ".-/".indexOf(value.charAt(end - 1)) >= 0) end--;
        return value.substring(0, end);
    }
}
