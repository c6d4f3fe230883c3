package com.notevault.backup.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A notepad note belonging to one workspace.
 *
 * Markdown exports under <blob-root>/<workspaceId>/notes are named by note id,
 * which is why restore keeps the original id.
 *
 * DB table: notes  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "notes")
public class Note implements Persistable<String> {

    @Id
    private String id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

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

    protected Note() {}   // required by JPA

    public Note(String id, String workspaceId, String title, String content) {
        this.id          = id;
        this.workspaceId = workspaceId;
        this.title       = title;
        this.content     = content;
    }

    @Override
    public String  getId()          { return id; }
    public String  getWorkspaceId() { return workspaceId; }
    public String  getTitle()       { return title; }
    public String  getContent()     { return content; }
    public Instant getCreatedAt()   { return createdAt; }
    public Instant getUpdatedAt()   { return updatedAt; }

    @Override
    public boolean isNew()          { return newEntity; }

    public void setCreatedAt(Instant t) { this.createdAt = t; }
    public void setUpdatedAt(Instant t) { this.updatedAt = t; }
}
