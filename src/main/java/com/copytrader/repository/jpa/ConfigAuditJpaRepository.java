package com.copytrader.repository.jpa;

import com.copytrader.entity.ConfigAuditEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConfigAuditJpaRepository extends JpaRepository<ConfigAuditEntity, Long> {

    List<ConfigAuditEntity> findByKeyOrderByChangedAtDesc(String key);
}
