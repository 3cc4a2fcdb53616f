package com.copytrader.lifecycle;

import com.copytrader.domain.enums.TradeAction;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Signal;
import com.copytrader.domain.model.Trade;
import com.copytrader.entity.TradeEntity;
import com.copytrader.exception.DuplicateSignalException;
import com.copytrader.exception.ResourceNotFoundException;
import com.copytrader.mapper.TradeMapper;
import com.copytrader.repository.jpa.TradeJpaRepository;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns every write to the trades table.
 *
 * <p>Each status change is validated by {@link TradeStateMachine} and written together
 * with its context in one transaction. The entity's {@code @Version} column makes a
 * transition exactly-once: if two writers race on the same trade, the loser gets an
 * {@link org.springframework.dao.OptimisticLockingFailureException} and nothing is written.
 */
@Service
public class TradeLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleService.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    /** Length of the {@code error_message} column. */
    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final TradeJpaRepository tradeJpaRepository;
    private final Clock clock;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public TradeLifecycleService(TradeJpaRepository tradeJpaRepository, Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.clock = clock;
    }

    /**
     * Inserts the PENDING record for an admitted signal.
     *
     * @throws DuplicateSignalException if a record with the same trade UUID already exists
     */
    @Transactional
    public Trade create(Signal signal) {
        if (tradeJpaRepository.existsById(signal.getTradeUuid())) {
            throw new DuplicateSignalException(signal.getTradeUuid());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        TradeEntity entity = tradeMapper.fromSignal(signal);
        entity.setStatus(TradeStatus.PENDING);
        entity.setRetryCount(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        try {
            TradeEntity saved = tradeJpaRepository.saveAndFlush(entity);
            log.debug("Trade {} created PENDING ({} {} {})", saved.getTradeUuid(), signal.getStrategy(),
                    signal.getAction(), signal.getToken());
            return tradeMapper.toDomain(saved);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                // lost the race against a concurrent delivery of the same signal
                throw new DuplicateSignalException(signal.getTradeUuid());
            }
            throw e;
        }
    }

    /** Cuts text to at most {@code maxLength} characters so it fits its column. */
    public static String clip(String text, int maxLength) {
        return text != null && text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    /** SQLSTATE 23505 is the standard unique-constraint violation (H2, PostgreSQL). */
    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Moves a trade to {@code target}, writing the context atomically with the status.
     *
     * @throws com.copytrader.exception.InvalidStateTransitionException if the edge is not allowed
     * @throws ResourceNotFoundException if no trade has this UUID
     */
    @Transactional
    public Trade transition(String tradeUuid, TradeStatus target, TransitionContext context) {
        TradeEntity entity = tradeJpaRepository
                .findById(tradeUuid)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeUuid));
        TradeStatus current = entity.getStatus();
        TradeStateMachine.validate(current, target, context);

        LocalDateTime now = LocalDateTime.now(clock);
        entity.setStatus(target);
        entity.setUpdatedAt(now);
        if (context.getTxSignature() != null) {
            entity.setTxSignature(context.getTxSignature());
        }
        if (context.getExitTxSignature() != null) {
            entity.setExitTxSignature(context.getExitTxSignature());
        }
        if (context.isClearExitSignature()) {
            entity.setExitTxSignature(null);
        }
        if (context.getErrorMessage() != null) {
            entity.setErrorMessage(clip(context.getErrorMessage(), MAX_ERROR_MESSAGE_LENGTH));
        }
        if (context.isIncrementRetry()) {
            entity.setRetryCount(entity.getRetryCount() + 1);
        }
        if (target == TradeStatus.CLOSED) {
            entity.setPnlSol(context.getPnlSol());
            entity.setPnlUsd(context.getPnlUsd());
            entity.setClosedAt(now);
        }

        TradeEntity saved = tradeJpaRepository.saveAndFlush(entity);
        log.info("Trade {} {} -> {}", tradeUuid, current, target);
        return tradeMapper.toDomain(saved);
    }

    public Optional<Trade> find(String tradeUuid) {
        return tradeJpaRepository.findById(tradeUuid).map(tradeMapper::toDomain);
    }

    public Trade get(String tradeUuid) {
        return find(tradeUuid).orElseThrow(() -> new ResourceNotFoundException("Trade", tradeUuid));
    }

    public boolean exists(String tradeUuid) {
        return tradeJpaRepository.existsById(tradeUuid);
    }

    public List<Trade> findByStatus(TradeStatus status) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByStatus(status));
    }

    /** Trades in {@code status} whose last update is older than {@code age}. */
    public List<Trade> findStuck(TradeStatus status, Duration age) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(age);
        return tradeMapper.toDomainList(
                tradeJpaRepository.findByStatusAndUpdatedAtBeforeOrderByUpdatedAtAsc(status, cutoff));
    }

    /** Open buy positions of a copied wallet in one token. */
    public List<Trade> findOpenBuys(String walletAddress, String token) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByWalletAddressAndTokenAndActionAndStatus(
                walletAddress, token, TradeAction.BUY, TradeStatus.ACTIVE));
    }
}
