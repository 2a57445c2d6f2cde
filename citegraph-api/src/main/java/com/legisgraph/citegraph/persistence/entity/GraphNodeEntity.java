package com.legisgraph.citegraph.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "graph_nodes", indexes = @Index(name = "graph_nodes_label_idx", columnList = "node_label"))
public class GraphNodeEntity {

    @Id
    @Column(name = "node_id", nullable = false, length = 255)
    private String id;

    @Column(name = "node_label", nullable = false, length = 64)
    private String label;

    @Column(name = "properties_json", nullable = false, length = 1_048_576)
    private String propertiesJson;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected GraphNodeEntity() {
    }

    public GraphNodeEntity(String id, String label, String propertiesJson) {
        this.id = id;
        this.label = label;
        this.propertiesJson = propertiesJson;
    }

    @PrePersist
    void onCreate() {
        createdAt = OffsetDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getPropertiesJson() {
        return propertiesJson;
    }

    public void setPropertiesJson(String propertiesJson) {
        this.propertiesJson = propertiesJson;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
