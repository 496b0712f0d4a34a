package com.chemked.data.loader.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loose comparison of a written author name against a registered given/family pair. Accepts
 * "Kyle E. Niemeyer", "K. E. Niemeyer", "KE Niemeyer", "Niemeyer, Kyle E." and hyphenated forms
 * such as "C-J Sung" for "Chih-Jen Sung".
 */
public final class NameComparator {
    private static final Pattern NAME_SEPARATORS = Pattern.compile("[, \\-.]+");
    private static final Pattern FAMILY_SEPARATORS = Pattern.compile("[, .]+");

    private NameComparator() {}

    public static boolean matches(String givenName, String familyName, String questionName) {
        String given = givenName.toLowerCase(Locale.ROOT);
        String family = familyName.toLowerCase(Locale.ROOT);
        String question = questionName.toLowerCase(Locale.ROOT);

        // "last, first middle" -> "first middle last"
        if (question.indexOf(',') >= 0) {
            List<String> parts = Arrays.asList(question.split(",", -1));
            Collections.reverse(parts);
            question = String.join(" ", parts).strip();
        }

        question = question.replace(".", "");
        given = given.replace(".", "");
        family = family.replace(".", "");

        List<String> givenParts = split(NAME_SEPARATORS, given);
        int familyCount = split(FAMILY_SEPARATORS, family).size();
        List<String> nameSplit = split(NAME_SEPARATORS, question);
        if (nameSplit.isEmpty()) {
            return false;
        }

        List<String> firstName = new ArrayList<>();
        firstName.add(nameSplit.get(0));
        if (nameSplit.size() > 2) {
            int end = familyCount == 0 ? 0 : nameSplit.size() - familyCount;
            for (int i = 1; i < end; i++) {
                firstName.add(nameSplit.get(i));
            }
        }

        String familyCompare;
        if (familyCount == 1 && family.indexOf('-') >= 0) {
            int hyphens = (int) family.chars().filter(c -> c == '-').count();
            familyCompare = String.join("-", tail(nameSplit, hyphens + 1));
        } else {
            familyCompare = String.join(" ", familyCount == 0 ? nameSplit : tail(nameSplit, familyCount));
        }
        if (givenParts.isEmpty()) {
            return family.equals(familyCompare);
        }

        if (firstName.size() > 1 && givenParts.size() == firstName.size()) {
            // same number of first and middle names: compare middle initials only
            for (int i = 1; i < firstName.size(); i++) {
                firstName.set(i, initial(firstName.get(i)));
                givenParts.set(i, initial(givenParts.get(i)));
            }
        } else if (givenParts.size() != firstName.size()) {
            int common = Math.min(givenParts.size(), firstName.size());
            firstName = new ArrayList<>(firstName.subList(0, common));
            givenParts = new ArrayList<>(givenParts.subList(0, common));
        }

        if (firstName.get(0).length() == 1 || givenParts.get(0).length() == 1) {
            givenParts.set(0, initial(givenParts.get(0)));
            firstName.set(0, initial(firstName.get(0)));
        }
        // first and middle initials written together, e.g. "KE"
        if (firstName.get(0).length() > 1 || givenParts.get(0).length() > 1) {
            givenParts.set(0, initial(givenParts.get(0)));
            firstName.set(0, initial(nameSplit.get(0)));
        }

        return givenParts.equals(firstName) && family.equals(familyCompare);
    }

    private static List<String> split(Pattern separators, String text) {
        return Arrays.stream(separators.split(text))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static List<String> tail(List<String> parts, int count) {
        return parts.subList(Math.max(0, parts.size() - count), parts.size());
    }

    private static String initial(String part) {
        return part.substring(0, 1);
    }
}
