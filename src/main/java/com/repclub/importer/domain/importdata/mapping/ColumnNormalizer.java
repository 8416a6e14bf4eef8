package com.repclub.importer.domain.importdata.mapping;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical token for column matching: "E-mail Address" and "email_address"
 * both become "emailaddress".
 */
public final class ColumnNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

    private ColumnNormalizer() {}

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    public static boolean sameColumn(String a, String b) {
        return normalize(a).equals(normalize(b));
    }
}
