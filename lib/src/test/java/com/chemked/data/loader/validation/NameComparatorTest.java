package com.chemked.data.loader.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class NameComparatorTest {

    @Test
    void acceptsInitialsAndMiddleNames() {
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "Kyle E. Niemeyer"));
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "Kyle E Niemeyer"));
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "K. E. Niemeyer"));
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "KE Niemeyer"));
        assertTrue(NameComparator.matches("Richard A.", "Yetter", "Richard A Yetter"));
        assertTrue(NameComparator.matches("N.", "Chaumeix", "N. Chaumeix"));
    }

    @Test
    void acceptsFamilyNameFirst() {
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "Niemeyer, Kyle E."));
        assertTrue(NameComparator.matches("Kyle", "Niemeyer", "niemeyer, kyle"));
    }

    @Test
    void handlesHyphenatedAndCompoundNames() {
        assertTrue(NameComparator.matches("Chih-Jen", "Sung", "Chih-Jen Sung"));
        assertTrue(NameComparator.matches("Chih-Jen", "Sung", "C-J Sung"));
        assertTrue(NameComparator.matches("C.-E.", "Paillard", "C.-E. Paillard"));
        assertTrue(NameComparator.matches("Maria", "Smith-Jones", "Maria Smith-Jones"));
        assertTrue(NameComparator.matches("Ludwig", "van Beethoven", "Ludwig van Beethoven"));
        assertTrue(NameComparator.matches("", "Plato", "Plato"));
    }

    @Test
    void rejectsDifferentPeople() {
        assertFalse(NameComparator.matches("Kyle", "Niemeyer", "Bryan W. Weber"));
        assertFalse(NameComparator.matches("Kyle", "Niemeyer", "Kyle Weber"));
        assertFalse(NameComparator.matches("Kyle", "Niemeyer", "Bryan Niemeyer"));
        assertFalse(NameComparator.matches("Kyle E.", "Niemeyer", "Kyle F. Niemeyer"));
        assertFalse(NameComparator.matches("Kyle", "Niemeyer", ""));
    }
}
