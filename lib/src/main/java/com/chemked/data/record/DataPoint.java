package com.chemked.data.record;

import com.chemked.data.quantity.Quantity;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One measured ignition delay with the state it was measured at. Quantities are stored in the units
 * the document used; the {@code (String units)} accessors convert on the way out.
 */
public final class DataPoint {
    private final Quantity temperature;
    private final Quantity pressure;
    private final Quantity ignitionDelay;
    private final Quantity firstStageIgnitionDelay;
    private final Composition composition;
    private final IgnitionType ignitionType;
    private final Double equivalenceRatio;
    private final ApparatusConditions conditions;
    private final List<TimeHistory> timeHistories;

    private DataPoint(Builder builder) {
        this.temperature = Objects.requireNonNull(builder.temperature, "temperature");
        this.pressure = Objects.requireNonNull(builder.pressure, "pressure");
        this.ignitionDelay = Objects.requireNonNull(builder.ignitionDelay, "ignitionDelay");
        this.firstStageIgnitionDelay = builder.firstStageIgnitionDelay;
        this.composition = Objects.requireNonNull(builder.composition, "composition");
        this.ignitionType = Objects.requireNonNull(builder.ignitionType, "ignitionType");
        this.equivalenceRatio = builder.equivalenceRatio;
        this.conditions = Objects.requireNonNull(builder.conditions, "conditions");
        this.timeHistories = List.copyOf(builder.timeHistories);
        if (equivalenceRatio != null && equivalenceRatio < 0) {
            throw new IllegalArgumentException("equivalence ratio must be non-negative: " + equivalenceRatio);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Quantity getTemperature() {
        return temperature;
    }

    public Quantity getTemperature(String units) {
        return temperature.to(units);
    }

    public Quantity getPressure() {
        return pressure;
    }

    public Quantity getPressure(String units) {
        return pressure.to(units);
    }

    public Quantity getIgnitionDelay() {
        return ignitionDelay;
    }

    public Quantity getIgnitionDelay(String units) {
        return ignitionDelay.to(units);
    }

    public Optional<Quantity> getFirstStageIgnitionDelay() {
        return Optional.ofNullable(firstStageIgnitionDelay);
    }

    public Composition getComposition() {
        return composition;
    }

    public IgnitionType getIgnitionType() {
        return ignitionType;
    }

    public OptionalDouble getEquivalenceRatio() {
        return equivalenceRatio == null ? OptionalDouble.empty() : OptionalDouble.of(equivalenceRatio);
    }

    public ApparatusConditions getConditions() {
        return conditions;
    }

    /** Pressure rise of a shock tube point; always empty for RCM points. */
    public Optional<Quantity> getPressureRise() {
        return conditions instanceof ShockTubeConditions shockTube ? shockTube.getPressureRise() : Optional.empty();
    }

    public Optional<RcmConditions> getRcmConditions() {
        return conditions instanceof RcmConditions rcm ? Optional.of(rcm) : Optional.empty();
    }

    public List<TimeHistory> getTimeHistories() {
        return timeHistories;
    }

    public Optional<TimeHistory> getTimeHistory(TimeHistoryType type) {
        return timeHistories.stream().filter(history -> history.getType() == type).findFirst();
    }

    /** Mole fractions as {@code "H2:0.125, O2:0.0625"}, e.g. for a kinetics code's input. */
    public String getMoleFractionString() {
        return getMoleFractionString(Map.of());
    }

    /**
     * Mole fraction string with species names substituted through {@code speciesConversion}, keyed
     * by species name, InChI or SMILES.
     *
     * @throws IllegalArgumentException if a key matches no species of this point
     */
    public String getMoleFractionString(Map<String, String> speciesConversion) {
        return composition.toFractionString(composition.getMoleFractions(), speciesConversion);
    }

    public String getMassFractionString() {
        return getMassFractionString(Map.of());
    }

    public String getMassFractionString(Map<String, String> speciesConversion) {
        return composition.toFractionString(composition.getMassFractions(), speciesConversion);
    }

    public static final class Builder {
        private Quantity temperature;
        private Quantity pressure;
        private Quantity ignitionDelay;
        private Quantity firstStageIgnitionDelay;
        private Composition composition;
        private IgnitionType ignitionType;
        private Double equivalenceRatio;
        private ApparatusConditions conditions = ShockTubeConditions.none();
        private List<TimeHistory> timeHistories = List.of();

        private Builder() {}

        public Builder temperature(Quantity value) {
            this.temperature = value;
            return this;
        }

        public Builder pressure(Quantity value) {
            this.pressure = value;
            return this;
        }

        public Builder ignitionDelay(Quantity value) {
            this.ignitionDelay = value;
            return this;
        }

        public Builder firstStageIgnitionDelay(Quantity value) {
            this.firstStageIgnitionDelay = value;
            return this;
        }

        public Builder composition(Composition value) {
            this.composition = value;
            return this;
        }

        public Builder ignitionType(IgnitionType value) {
            this.ignitionType = value;
            return this;
        }

        public Builder equivalenceRatio(Double value) {
            this.equivalenceRatio = value;
            return this;
        }

        public Builder conditions(ApparatusConditions value) {
            this.conditions = value;
            return this;
        }

        public Builder timeHistories(List<TimeHistory> value) {
            this.timeHistories = value;
            return this;
        }

        public DataPoint build() {
            return new DataPoint(this);
        }
    }
}
