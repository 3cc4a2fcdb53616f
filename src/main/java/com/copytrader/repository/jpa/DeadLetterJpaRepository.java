package com.copytrader.repository.jpa;

import com.copytrader.entity.DeadLetterEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeadLetterJpaRepository extends JpaRepository<DeadLetterEntity, Long> {

    boolean existsByTradeUuid(String tradeUuid);

    Optional<DeadLetterEntity> findByTradeUuid(String tradeUuid);

    List<DeadLetterEntity> findByReason(String reason);
}
