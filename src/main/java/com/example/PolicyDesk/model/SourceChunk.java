package com.example.PolicyDesk.model;

/**
 * A retrievable unit of policy text with its location in the source document.
 *
 * @param text       cleaned chunk text
 * @param page       page number inside the document, {@code null} when unknown
 * @param documentId identifier of the source document
 */
public record SourceChunk(
        String text,
        Integer page,
        String documentId
) {
    public String pageLabel() {
        return page == null ? "Unknown" : String.valueOf(page);
    }
}
