package eu.fbk.sciencesource.data;

/**
 * The kind of value a record field is uploaded as.
 */
public enum ValueKind {

    STRING,

    QUANTITY,

    ITEM

}
