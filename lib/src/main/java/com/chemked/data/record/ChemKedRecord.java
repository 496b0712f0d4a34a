package com.chemked.data.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A validated ChemKED document. Records are immutable; the {@code with*} methods return modified
 * copies for callers that re-serialize a record under a new version or author.
 */
public final class ChemKedRecord {
    private final List<Author> fileAuthors;
    private final int fileVersion;
    private final String chemKedVersion;
    private final Reference reference;
    private final ExperimentType experimentType;
    private final Apparatus apparatus;
    private final List<DataPoint> datapoints;

    public ChemKedRecord(
            List<Author> fileAuthors,
            int fileVersion,
            String chemKedVersion,
            Reference reference,
            ExperimentType experimentType,
            Apparatus apparatus,
            List<DataPoint> datapoints) {
        this.fileAuthors = List.copyOf(Objects.requireNonNull(fileAuthors, "fileAuthors"));
        this.fileVersion = fileVersion;
        this.chemKedVersion = Objects.requireNonNull(chemKedVersion, "chemKedVersion");
        this.reference = Objects.requireNonNull(reference, "reference");
        this.experimentType = Objects.requireNonNull(experimentType, "experimentType");
        this.apparatus = Objects.requireNonNull(apparatus, "apparatus");
        this.datapoints = List.copyOf(Objects.requireNonNull(datapoints, "datapoints"));
        if (this.fileAuthors.isEmpty()) {
            throw new IllegalArgumentException("record needs at least one file author");
        }
        if (fileVersion < 0) {
            throw new IllegalArgumentException("file version must be non-negative: " + fileVersion);
        }
        if (this.datapoints.isEmpty()) {
            throw new IllegalArgumentException("record needs at least one data point");
        }
        for (DataPoint datapoint : this.datapoints) {
            ApparatusKind conditionsKind = datapoint.getConditions().getApparatusKind();
            if (conditionsKind != apparatus.getKind()) {
                throw new IllegalArgumentException(
                        "data point conditions for " + conditionsKind + " in a " + apparatus.getKind() + " record");
            }
        }
    }

    public List<Author> getFileAuthors() {
        return fileAuthors;
    }

    public int getFileVersion() {
        return fileVersion;
    }

    public String getChemKedVersion() {
        return chemKedVersion;
    }

    public Reference getReference() {
        return reference;
    }

    public ExperimentType getExperimentType() {
        return experimentType;
    }

    public Apparatus getApparatus() {
        return apparatus;
    }

    public List<DataPoint> getDatapoints() {
        return datapoints;
    }

    public ChemKedRecord withFileVersion(int newFileVersion) {
        return new ChemKedRecord(
                fileAuthors, newFileVersion, chemKedVersion, reference, experimentType, apparatus, datapoints);
    }

    /** Copy with {@code author} appended to the file authors. */
    public ChemKedRecord withFileAuthor(Author author) {
        List<Author> authors = new ArrayList<>(fileAuthors);
        authors.add(Objects.requireNonNull(author, "author"));
        return new ChemKedRecord(
                authors, fileVersion, chemKedVersion, reference, experimentType, apparatus, datapoints);
    }
}
