package com.eainde.bidding.model;

/**
 * One extracted value with its provenance.
 *
 * <p>A {@link FieldStatus#FOUND} field always carries a citation. {@link FieldStatus#NOT_FOUND}
 * and {@link FieldStatus#UNAVAILABLE} fields never do.</p>
 */
public record ExtractionField(String name, String label, String value, Citation citation,
                              double confidence, FieldStatus status, String notes) {

    /** Value recorded for fields the document does not mention. */
    public static final String NOT_MENTIONED = "招标文件中未提及";

    public ExtractionField {
        if (status == FieldStatus.FOUND && citation == null) {
            throw new IllegalArgumentException("Found field '" + name + "' must carry a citation");
        }
        if (status != FieldStatus.FOUND && citation != null) {
            throw new IllegalArgumentException("Field '" + name + "' is " + status + " but carries a citation");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static ExtractionField found(String name, String label, String value, Citation citation,
                                        double confidence, String notes) {
        return new ExtractionField(name, label, value, citation, confidence, FieldStatus.FOUND, notes);
    }

    public static ExtractionField notFound(String name, String label, String notes) {
        return new ExtractionField(name, label, NOT_MENTIONED, null, 0.0, FieldStatus.NOT_FOUND, notes);
    }

    public static ExtractionField unavailable(String name, String label, String notes) {
        return new ExtractionField(name, label, null, null, 0.0, FieldStatus.UNAVAILABLE, notes);
    }

    public boolean isUnavailable() {
        return status == FieldStatus.UNAVAILABLE;
    }
}
