package com.notevault.backup.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A notebook: the container that owns documents, notes and a blob tree.
 *
 * The workspace id doubles as the name of its blob directory
 * (<blob-root>/<id>/), so it is never regenerated on restore.
 *
 * DB table: workspaces  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workspaces")
public class Workspace implements Persistable<String> {

    @Id
    private String id;

    @Column(nullable = false)
    private String title;

    // Optional; nulled on restore when the folder cannot be found.
    @Column(name = "folder_id")
    private String folderId;

    // Notes text stored on the notebook row by older clients.
    @Column(name = "legacy_notes", columnDefinition = "TEXT")
    private String legacyNotes;

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

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Workspace() {}   // required by JPA

    public Workspace(String id, String title) {
        this.id    = id;
        this.title = title;
    }

    @Override
    public String  getId()          { return id; }
    public String  getTitle()       { return title; }
    public String  getFolderId()    { return folderId; }
    public String  getLegacyNotes() { return legacyNotes; }
    public Instant  getCreatedAt()  { return createdAt; }
    public Instant  getUpdatedAt()  { return updatedAt; }

    @Override
    public boolean isNew()          { return newEntity; }

    public void setFolderId(String folderId)       { this.folderId = folderId; }
    public void setLegacyNotes(String legacyNotes) { this.legacyNotes = legacyNotes; }
    public void setCreatedAt(Instant t)            { this.createdAt = t; }
    public void setUpdatedAt(Instant t)            { this.updatedAt = t; }
}
