package io.storylink.core.schema;

/**
 * One failed schema constraint.
 *
 * @param schemaPointer location of the failing constraint in the schema (URI fragment style)
 * @param keyword       failing keyword, e.g. "type" or "required"
 * @param docPointer    location of the offending value in the document ("" for the root)
 * @param message       human readable detail
 */
public record SchemaViolation(String schemaPointer, String keyword, String docPointer, String message) {

    @Override
    public String toString() {
        return "constraint " + schemaPointer + "/" + keyword
                + " at doc location '" + docPointer + "': " + message;
    }
}
