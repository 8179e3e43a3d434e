package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/** Relationship kind of a {@link HeritageLink}. */
public enum HeritageKind {
    SUBCLASSIFICATION,
    FEATURE_TYPING,
    SUBSETTING,
    REFERENCE_SUBSETTING,
    REDEFINITION,
    CONJUGATION,
    @JsonEnumDefaultValue
    OTHER
}
