package com.chemked.data.record;

import com.chemked.data.quantity.Quantity;
import java.util.Objects;
import java.util.Optional;

/** End-of-compression state and machine geometry of a rapid compression machine run. */
public final class RcmConditions implements ApparatusConditions {
    private final Quantity compressedPressure;
    private final Quantity compressedTemperature;
    private final Quantity compressionTime;
    private final Quantity stroke;
    private final Quantity clearance;
    private final Quantity compressionRatio;

    private RcmConditions(Builder builder) {
        this.compressedPressure = builder.compressedPressure;
        this.compressedTemperature = builder.compressedTemperature;
        this.compressionTime = builder.compressionTime;
        this.stroke = builder.stroke;
        this.clearance = builder.clearance;
        this.compressionRatio = builder.compressionRatio;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ApparatusKind getApparatusKind() {
        return ApparatusKind.RAPID_COMPRESSION_MACHINE;
    }

    public Optional<Quantity> getCompressedPressure() {
        return Optional.ofNullable(compressedPressure);
    }

    public Optional<Quantity> getCompressedTemperature() {
        return Optional.ofNullable(compressedTemperature);
    }

    public Optional<Quantity> getCompressionTime() {
        return Optional.ofNullable(compressionTime);
    }

    public Optional<Quantity> getStroke() {
        return Optional.ofNullable(stroke);
    }

    public Optional<Quantity> getClearance() {
        return Optional.ofNullable(clearance);
    }

    public Optional<Quantity> getCompressionRatio() {
        return Optional.ofNullable(compressionRatio);
    }

    public boolean isEmpty() {
        return compressedPressure == null
                && compressedTemperature == null
                && compressionTime == null
                && stroke == null
                && clearance == null
                && compressionRatio == null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RcmConditions that)) {
            return false;
        }
        return Objects.equals(compressedPressure, that.compressedPressure)
                && Objects.equals(compressedTemperature, that.compressedTemperature)
                && Objects.equals(compressionTime, that.compressionTime)
                && Objects.equals(stroke, that.stroke)
                && Objects.equals(clearance, that.clearance)
                && Objects.equals(compressionRatio, that.compressionRatio);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                compressedPressure, compressedTemperature, compressionTime, stroke, clearance, compressionRatio);
    }

    public static final class Builder {
        private Quantity compressedPressure;
        private Quantity compressedTemperature;
        private Quantity compressionTime;
        private Quantity stroke;
        private Quantity clearance;
        private Quantity compressionRatio;

        private Builder() {}

        public Builder compressedPressure(Quantity value) {
            this.compressedPressure = value;
            return this;
        }

        public Builder compressedTemperature(Quantity value) {
            this.compressedTemperature = value;
            return this;
        }

        public Builder compressionTime(Quantity value) {
            this.compressionTime = value;
            return this;
        }

        public Builder stroke(Quantity value) {
            this.stroke = value;
            return this;
        }

        public Builder clearance(Quantity value) {
            this.clearance = value;
            return this;
        }

        public Builder compressionRatio(Quantity value) {
            this.compressionRatio = value;
            return this;
        }

        public RcmConditions build() {
            return new RcmConditions(this);
        }
    }
}
