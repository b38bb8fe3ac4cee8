package com.olend.repository.jpa;

import com.olend.entity.ConfigChangeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the config_change_history table.
 */
@Repository
public interface ConfigChangeJpaRepository extends JpaRepository<ConfigChangeEntity, Long> {

    @Query("SELECT c FROM ConfigChangeEntity c ORDER BY c.id DESC")
    List<ConfigChangeEntity> findAllNewestFirst();

    @Query("SELECT c FROM ConfigChangeEntity c WHERE c.configType = :configType ORDER BY c.id DESC")
    List<ConfigChangeEntity> findByConfigTypeNewestFirst(@Param("configType") String configType);
}
