package com.notevault.backup.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * A node in the folder forest.
 *
 * Folders are kept as an arena keyed by id: the parent is a plain id column,
 * never an object reference, so restore can insert them in any order it needs.
 *
 * DB table: folders  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "folders")
public class Folder implements Persistable<String> {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    // Null for a root folder.
    @Column(name = "parent_id")
    private String parentId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Ids are assigned by the caller, so Spring Data cannot tell new rows apart by a null id.
    @Transient
    private boolean newEntity = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Folder() {}   // required by JPA

    public Folder(String id, String name, String parentId) {
        this.id       = id;
        this.name     = name;
        this.parentId = parentId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override
    public String  getId()        { return id; }
    public String  getName()      { return name; }
    public String  getParentId()  { return parentId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public boolean isNew()        { return newEntity; }

    public void setParentId(String parentId)   { this.parentId = parentId; }
    public void setCreatedAt(Instant t)        { this.createdAt = t; }
    public void setUpdatedAt(Instant t)        { this.updatedAt = t; }
}
