package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notevault.backup.model.Document;

import java.time.Instant;

/**
 * One element of {@code {workspaceId}/documents_meta.json}.
 *
 * Aliases map the column names of the original notebook schema
 * ({@code notebookId}, {@code fileSize}, {@code filePath}, {@code isVectorized}).
 * {@code textChunks} and {@code embeddings} are carried as JSON values and
 * stored as raw JSON text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentEntry(
                                   String   id,
        @JsonAlias("notebookId")   String   workspaceId,
                                   String   fileName,
                                   String   mimeType,
        @JsonAlias("fileSize")     long     sizeBytes,
                                   String   status,
                                   String   statusMessage,
                                   String   textContent,
        @JsonAlias("filePath")     String   storagePath,
        @JsonAlias("isVectorized") boolean  vectorized,
                                   JsonNode textChunks,
                                   JsonNode embeddings,
                                   Instant  createdAt,
                                   Instant  updatedAt
) {
    public static DocumentEntry from(Document d, ObjectMapper json) throws JsonProcessingException {
        return new DocumentEntry(d.getId(), d.getWorkspaceId(), d.getFileName(), d.getMimeType(),
                d.getSizeBytes(), d.getStatus(), d.getStatusMessage(), d.getTextContent(),
                d.getStoragePath(), d.isVectorized(),
                readJson(json, d.getTextChunks()), readJson(json, d.getEmbeddings()),
                d.getCreatedAt(), d.getUpdatedAt());
    }

    /**
     * Build a row owned by {@code ownerId}, whatever workspace id the file
     * itself claims.
     */
    public Document toDocument(String ownerId) {
        Document doc = new Document(id, ownerId, fileName);
        doc.setMimeType(mimeType);
        doc.setSizeBytes(sizeBytes);
        if (status != null) doc.setStatus(status);
        doc.setStatusMessage(statusMessage);
        doc.setTextContent(textContent);
        doc.setStoragePath(storagePath);
        doc.setVectorized(vectorized);
        doc.setTextChunks(writeJson(textChunks));
        doc.setEmbeddings(writeJson(embeddings));
        if (createdAt != null) doc.setCreatedAt(createdAt);
        if (updatedAt != null) doc.setUpdatedAt(updatedAt);
        return doc;
    }

    private static JsonNode readJson(ObjectMapper json, String raw) throws JsonProcessingException {
        return raw == null ? null : json.readTree(raw);
    }

    private static String writeJson(JsonNode node) {
        return node == null || node.isNull() ? null : node.toString();
    }
}
