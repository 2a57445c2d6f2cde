package com.legisgraph.citegraph.persistence.repository;

import com.legisgraph.citegraph.persistence.entity.GraphEdgeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface GraphEdgeRepository extends JpaRepository<GraphEdgeEntity, Long> {

    boolean existsByFromIdAndToIdAndType(String fromId, String toId, String type);

    List<GraphEdgeEntity> findByToIdAndTypeOrderByIdAsc(String toId, String type);

    @Query("select e.type, count(e) from GraphEdgeEntity e group by e.type")
    List<Object[]> countGroupedByType();
}
