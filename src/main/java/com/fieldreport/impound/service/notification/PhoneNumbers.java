package com.fieldreport.impound.service.notification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Phone number parsing for SMS destinations.
 */
public final class PhoneNumbers {

    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{7,15}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PhoneNumbers() {}

    /**
     * Split a comma-separated list, trim each entry and drop empty ones. Order is kept.
     */
    public static List<String> split(String csv) {
        List<String> tokens = new ArrayList<>();
        if (csv == null) {
            return tokens;
        }
        for (String part : csv.split(",")) {
            String token = part.trim();
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Optional leading {@code +} and 7 to 15 digits.
     */
    public static boolean isValid(String phone) {
        return phone != null && PHONE.matcher(phone).matches();
    }

    public static String stripWhitespace(String phone) {
        return phone == null ? null : WHITESPACE.matcher(phone).replaceAll("");
    }

    /**
     * Entries of {@code phones} that are not valid numbers.
     */
    public static List<String> invalid(List<String> phones) {
        return phones.stream().filter(p -> !isValid(p)).toList();
    }

    /**
     * Distinct destinations in first-seen order.
     */
    public static Set<String> destinations(List<String> phones) {
        return new LinkedHashSet<>(phones);
    }
}
