package net.luminalib.controller.dto;

import java.util.List;

/**
 * Catalog registration issued by the upload pipeline once the book text is stored.
 *
 * @param contentPath location of the extracted text, relative to the content root
 */
public record BookRegistrationRequest(String title, String author, String isbn, List<String> genres, String contentPath) {
}
