package com.copytrader.repository.jpa;

import com.copytrader.entity.ReconciliationLogEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReconciliationLogJpaRepository extends JpaRepository<ReconciliationLogEntity, Long> {

    List<ReconciliationLogEntity> findByTradeUuidOrderByCreatedAtDesc(String tradeUuid);
}
