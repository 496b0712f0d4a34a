package com.chemked.data.record;

import java.util.List;
import java.util.Objects;

/** How a species is identified: exactly one of an InChI, a SMILES string or an atomic composition. */
public sealed interface SpeciesIdentity
        permits SpeciesIdentity.InChI, SpeciesIdentity.Smiles, SpeciesIdentity.AtomicComposition {

    /** Key under which the identity is written in documents. */
    String documentKey();

    record InChI(String value) implements SpeciesIdentity {
        public InChI {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String documentKey() {
            return "InChI";
        }
    }

    record Smiles(String value) implements SpeciesIdentity {
        public Smiles {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String documentKey() {
            return "SMILES";
        }
    }

    record AtomicComposition(List<ElementAmount> elements) implements SpeciesIdentity {
        public AtomicComposition {
            elements = List.copyOf(elements);
            if (elements.isEmpty()) {
                throw new IllegalArgumentException("atomic composition needs at least one element");
            }
        }

        @Override
        public String documentKey() {
            return "atomic-composition";
        }
    }

    record ElementAmount(String element, double amount) {
        public ElementAmount {
            Objects.requireNonNull(element, "element");
            if (amount < 0) {
                throw new IllegalArgumentException("element amount must be non-negative: " + amount);
            }
        }
    }
}
