package com.chemked.data.loader.validation;

import java.util.regex.Pattern;

/** ORCID syntax and ISO 7064 MOD 11-2 check digit. */
public final class OrcidChecksum {
    private static final Pattern FORMAT = Pattern.compile("^\\d{4}-\\d{4}-\\d{4}-\\d{3}[\\dX]$");

    private OrcidChecksum() {}

    public static boolean isWellFormed(String orcid) {
        return orcid != null && FORMAT.matcher(orcid).matches();
    }

    /** True when {@code orcid} is well formed and its last character is the correct check digit. */
    public static boolean isValid(String orcid) {
        if (!isWellFormed(orcid)) {
            return false;
        }
        String digits = orcid.replace("-", "");
        return checkDigit(digits.substring(0, digits.length() - 1)) == digits.charAt(digits.length() - 1);
    }

    static char checkDigit(String baseDigits) {
        int total = 0;
        for (int i = 0; i < baseDigits.length(); i++) {
            total = (total + Character.digit(baseDigits.charAt(i), 10)) * 2;
        }
        int result = (12 - total % 11) % 11;
        return result == 10 ? 'X' : Character.forDigit(result, 10);
    }
}
