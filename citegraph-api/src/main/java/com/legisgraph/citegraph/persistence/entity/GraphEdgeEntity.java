package com.legisgraph.citegraph.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;

@Entity
@Table(name = "graph_edges",
        uniqueConstraints = @UniqueConstraint(name = "graph_edges_pair_type_uk",
                columnNames = {"from_id", "to_id", "relationship_type"}),
        indexes = @Index(name = "graph_edges_to_idx", columnList = "to_id, relationship_type"))
public class GraphEdgeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "from_id", nullable = false, length = 255)
    private String fromId;

    @Column(name = "to_id", nullable = false, length = 255)
    private String toId;

    @Column(name = "relationship_type", nullable = false, length = 32)
    private String type;

    @Column(name = "properties_json", nullable = false, length = 4096)
    private String propertiesJson;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected GraphEdgeEntity() {
    }

    public GraphEdgeEntity(String fromId, String toId, String type, String propertiesJson) {
        this.fromId = fromId;
        this.toId = toId;
        this.type = type;
        this.propertiesJson = propertiesJson;
    }

    @PrePersist
    void onCreate() {
        createdAt = OffsetDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public String getFromId() {
        return fromId;
    }

    public String getToId() {
        return toId;
    }

    public String getType() {
        return type;
    }

    public String getPropertiesJson() {
        return propertiesJson;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
