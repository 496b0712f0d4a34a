package com.chemked.data.record;

import com.chemked.data.quantity.Quantity;
import java.util.Objects;

/** One component of a mixture. The amount is dimensionless and may carry an uncertainty. */
public final class Species {
    private final String name;
    private final SpeciesIdentity identity;
    private final Quantity amount;

    public Species(String name, SpeciesIdentity identity, Quantity amount) {
        this.name = Objects.requireNonNull(name, "name");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.amount = Objects.requireNonNull(amount, "amount");
        if (!amount.isCompatibleWith("dimensionless")) {
            throw new IllegalArgumentException("Species amount must be dimensionless: " + amount);
        }
    }

    public String getName() {
        return name;
    }

    public SpeciesIdentity getIdentity() {
        return identity;
    }

    public Quantity getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Species that)) {
            return false;
        }
        return name.equals(that.name) && identity.equals(that.identity) && amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, identity, amount);
    }

    @Override
    public String toString() {
        return name + ":" + amount;
    }
}
