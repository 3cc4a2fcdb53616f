package com.copytrader.repository.jpa;

import com.copytrader.domain.enums.TradeAction;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.entity.TradeEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByStatus(TradeStatus status);

    /** Trades sitting in {@code status} since before {@code cutoff}, oldest first. */
    List<TradeEntity> findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(TradeStatus status, LocalDateTime cutoff);

    List<TradeEntity> findByWalletAddressAndTokenAndActionAndStatus(
            String walletAddress, String token, TradeAction action, TradeStatus status);

    long countByStatus(TradeStatus status);

    /**
     * Sum of realized USD P&L over trades closed since {@code since}.
     * Returns 0 when nothing closed in the window.
     */
    @Query("SELECT COALESCE(SUM(t.pnlUsd), 0) FROM TradeEntity t WHERE t.status = :status AND t.closedAt >= :since")
    BigDecimal sumPnlUsdByStatusSince(@Param("status") TradeStatus status, @Param("since") LocalDateTime since);

    /** Realized USD P&L of closed trades, most recent first. Page to bound the streak scan. */
    @Query("SELECT t.pnlUsd FROM TradeEntity t WHERE t.status = :status ORDER BY t.closedAt DESC")
    List<BigDecimal> findPnlUsdByStatusMostRecentFirst(@Param("status") TradeStatus status, Pageable pageable);

    /** Realized USD P&L of closed trades in close order, for the equity curve. */
    @Query("SELECT t.pnlUsd FROM TradeEntity t WHERE t.status = :status AND t.pnlUsd IS NOT NULL"
            + " ORDER BY t.closedAt ASC")
    List<BigDecimal> findPnlUsdByStatusInCloseOrder(@Param("status") TradeStatus status);
}
