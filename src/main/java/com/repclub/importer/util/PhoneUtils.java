package com.repclub.importer.util;

import java.util.regex.Pattern;

public final class PhoneUtils {

    private static final Pattern FORMATTING = Pattern.compile("[\\s\\-().+]");
    private static final Pattern DIGITS = Pattern.compile("\\d{7,15}");

    private PhoneUtils() {}

    /**
     * Removes the separators people type in phone numbers (spaces, dashes, dots,
     * parentheses and the leading plus). Letters are kept so they fail validation.
     * @param phone Phone number as typed
     * @return The remaining characters
     */
    public static String stripFormatting(String phone) {
        if (phone == null || phone.isEmpty()) {
            return phone;
        }
        return FORMATTING.matcher(phone).replaceAll("");
    }

    /**
     * Validates if phone number format is correct
     * @param phone Phone number
     * @return true if 7 to 15 digits remain once formatting is stripped
     */
    public static boolean isValid(String phone) {
        if (phone == null || phone.isEmpty()) {
            return false;
        }
        return DIGITS.matcher(stripFormatting(phone)).matches();
    }
}
