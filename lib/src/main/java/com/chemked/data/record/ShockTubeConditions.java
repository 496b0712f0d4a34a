package com.chemked.data.record;

import com.chemked.data.quantity.Quantity;
import java.util.Objects;
import java.util.Optional;

public final class ShockTubeConditions implements ApparatusConditions {
    private static final ShockTubeConditions NONE = new ShockTubeConditions(null);

    private final Quantity pressureRise;

    public ShockTubeConditions(Quantity pressureRise) {
        this.pressureRise = pressureRise;
    }

    public static ShockTubeConditions none() {
        return NONE;
    }

    @Override
    public ApparatusKind getApparatusKind() {
        return ApparatusKind.SHOCK_TUBE;
    }

    /** Normalized pressure rise during the induction period, {@code (dP/dt)/P}. */
    public Optional<Quantity> getPressureRise() {
        return Optional.ofNullable(pressureRise);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ShockTubeConditions that && Objects.equals(pressureRise, that.pressureRise);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(pressureRise);
    }
}
