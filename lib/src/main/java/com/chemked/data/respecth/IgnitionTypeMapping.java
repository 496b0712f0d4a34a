package com.chemked.data.respecth;

import com.chemked.data.record.IgnitionMeasure;
import com.chemked.data.record.IgnitionTarget;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ignition target and type vocabulary of ReSpecTh {@code ignitionType} attributes. Every ChemKED
 * value has exactly one ReSpecTh spelling; the reader also accepts the ChemKED spellings of the
 * starred species since some files use them.
 */
final class IgnitionTypeMapping {

    private static final Map<IgnitionTarget, String> TARGET_TO_XML = new EnumMap<>(IgnitionTarget.class);
    private static final Map<String, IgnitionTarget> XML_TO_TARGET = new HashMap<>();
    private static final Map<IgnitionMeasure, String> MEASURE_TO_XML = new EnumMap<>(IgnitionMeasure.class);
    private static final Map<String, IgnitionMeasure> XML_TO_MEASURE = new HashMap<>();

    static {
        target(IgnitionTarget.PRESSURE, "P");
        target(IgnitionTarget.TEMPERATURE, "T");
        target(IgnitionTarget.OH, "OH");
        target(IgnitionTarget.OH_STAR, "OHEX");
        target(IgnitionTarget.CH, "CH");
        target(IgnitionTarget.CH_STAR, "CHEX");
        XML_TO_TARGET.put("OH*", IgnitionTarget.OH_STAR);
        XML_TO_TARGET.put("CH*", IgnitionTarget.CH_STAR);

        measure(IgnitionMeasure.MAX, "max");
        measure(IgnitionMeasure.D_DT_MAX, "d/dt max");
        measure(IgnitionMeasure.HALF_MAX, "1/2 max");
        measure(IgnitionMeasure.MIN, "min");
        measure(IgnitionMeasure.D_DT_MAX_EXTRAPOLATED, "baseline max intercept from d/dt");
        XML_TO_MEASURE.put("d/dt max extrapolated", IgnitionMeasure.D_DT_MAX_EXTRAPOLATED);
    }

    private IgnitionTypeMapping() {}

    private static void target(IgnitionTarget target, String xml) {
        TARGET_TO_XML.put(target, xml);
        XML_TO_TARGET.put(xml, target);
    }

    private static void measure(IgnitionMeasure measure, String xml) {
        MEASURE_TO_XML.put(measure, xml);
        XML_TO_MEASURE.put(xml, measure);
    }

    /** @param xml a single target as written in the {@code target} attribute, case-insensitive */
    static Optional<IgnitionTarget> target(String xml) {
        return Optional.ofNullable(XML_TO_TARGET.get(xml.toUpperCase(Locale.ROOT)));
    }

    static Optional<IgnitionMeasure> measure(String xml) {
        return Optional.ofNullable(XML_TO_MEASURE.get(xml));
    }

    static String toXml(IgnitionTarget target) {
        return TARGET_TO_XML.get(target);
    }

    static String toXml(IgnitionMeasure measure) {
        return MEASURE_TO_XML.get(measure);
    }
}
