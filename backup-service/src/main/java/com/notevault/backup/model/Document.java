package com.notevault.backup.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * An uploaded file and its extracted text.
 *
 * The file itself lives under <blob-root>/<workspaceId>/documents; derived
 * vector data lives under .../vectors and is keyed by document id.
 *
 * DB table: documents  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "documents")
public class Document implements Persistable<String> {

    @Id
    private String id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "mime_type")
    private String mimeType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    // Processing status as written by the document pipeline ("pending", "completed", ...).
    @Column(nullable = false)
    private String status = "pending";

    @Column(name = "status_message", columnDefinition = "TEXT")
    private String statusMessage;

    @Column(name = "text_content", columnDefinition = "TEXT")
    private String textContent;

    // Path of the stored file relative to the workspace blob root.
    @Column(name = "storage_path")
    private String storagePath;

    @Column(nullable = false)
    private boolean vectorized;

    // Vectorizer output, stored as raw JSON text.
    @Column(name = "text_chunks", columnDefinition = "TEXT")
    private String textChunks;

    @Column(columnDefinition = "TEXT")
    private String embeddings;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Transient
    private boolean newEntity = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    protected Document() {}   // required by JPA

    public Document(String id, String workspaceId, String fileName) {
        this.id          = id;
        this.workspaceId = workspaceId;
        this.fileName    = fileName;
    }

    @Override
    public String  getId()            { return id; }
    public String  getWorkspaceId()   { return workspaceId; }
    public String  getFileName()      { return fileName; }
    public String  getMimeType()      { return mimeType; }
    public long    getSizeBytes()     { return sizeBytes; }
    public String  getStatus()        { return status; }
    public String  getStatusMessage() { return statusMessage; }
    public String  getTextContent()   { return textContent; }
    public String  getStoragePath()   { return storagePath; }
    public boolean isVectorized()     { return vectorized; }
    public String  getTextChunks()    { return textChunks; }
    public String  getEmbeddings()    { return embeddings; }
    public Instant getCreatedAt()     { return createdAt; }
    public Instant getUpdatedAt()     { return updatedAt; }

    @Override
    public boolean isNew()            { return newEntity; }

    public void setMimeType(String v)      { this.mimeType = v; }
    public void setSizeBytes(long v)       { this.sizeBytes = v; }
    public void setStatus(String v)        { this.status = v; }
    public void setStatusMessage(String v) { this.statusMessage = v; }
    public void setTextContent(String v)   { this.textContent = v; }
    public void setStoragePath(String v)   { this.storagePath = v; }
    public void setVectorized(boolean v)   { this.vectorized = v; }
    public void setTextChunks(String v)    { this.textChunks = v; }
    public void setEmbeddings(String v)    { this.embeddings = v; }
    public void setCreatedAt(Instant t)    { this.createdAt = t; }
    public void setUpdatedAt(Instant t)    { this.updatedAt = t; }
}
