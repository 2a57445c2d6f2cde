package com.legisgraph.citegraph.persistence.repository;

import com.legisgraph.citegraph.persistence.entity.GraphNodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface GraphNodeRepository extends JpaRepository<GraphNodeEntity, String> {

    Optional<GraphNodeEntity> findByIdAndLabel(String id, String label);

    List<GraphNodeEntity> findByLabelAndIdIn(String label, Collection<String> ids);

    @Query("select n.label, count(n) from GraphNodeEntity n group by n.label")
    List<Object[]> countGroupedByLabel();
}
