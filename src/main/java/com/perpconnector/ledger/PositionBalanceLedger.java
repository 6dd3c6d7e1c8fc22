package com.perpconnector.ledger;

import com.perpconnector.domain.enums.ApplyOutcome;
import com.perpconnector.domain.enums.PositionMode;
import com.perpconnector.domain.model.Balance;
import com.perpconnector.domain.model.FundingPayment;
import com.perpconnector.domain.model.Position;
import com.perpconnector.domain.model.PositionKey;
import com.perpconnector.domain.update.BalanceSnapshot;
import com.perpconnector.domain.update.PositionSnapshot;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Account positions, balances and last funding payments as reported by the exchange.
 *
 * <p>Position and balance snapshots are authoritative and replace the whole set: entries
 * missing from a snapshot are removed, zero-amount positions are never stored. A snapshot
 * older than the last one applied is ignored. When polls fail, the last snapshot stays.
 *
 * <p>Funding is tracked per pair: a payment is recorded once per (pair, timestamp).
 */
@Component
public class PositionBalanceLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionBalanceLedger.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<PositionKey, Position> positions = new LinkedHashMap<>();
    private final Map<String, Balance> balances = new LinkedHashMap<>();
    private final Map<String, FundingPayment> lastFundingPayments = new HashMap<>();

    private Instant lastPositionSnapshotAt;
    private Instant lastBalanceSnapshotAt;

    public PositionMode getPositionMode() {
        return PositionMode.ONEWAY;
    }

    // ---- Snapshots ----

    public ApplyOutcome applyPositionSnapshot(PositionSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            if (isOlder(snapshot.timestamp(), lastPositionSnapshotAt)) {
                log.debug("Stale position snapshot ignored: snapshotTs={}, lastTs={}", snapshot.timestamp(), lastPositionSnapshotAt);
                return ApplyOutcome.STALE;
            }
            Map<PositionKey, Position> replacement = new LinkedHashMap<>();
            for (Position position : snapshot.positions()) {
                if (position.getAmount() == null || position.getAmount().signum() == 0) {
                    continue;
                }
                Position previous = replacement.put(position.key(), position.toBuilder().build());
                if (previous != null) {
                    log.warn("Duplicate position in snapshot, keeping latest: pair={}, side={}", position.getTradingPair(), position.getSide());
                }
            }

            int removed = 0;
            for (PositionKey key : positions.keySet()) {
                if (!replacement.containsKey(key)) {
                    removed++;
                    log.info("Position closed: pair={}, side={}", key.tradingPair(), key.side());
                }
            }
            positions.clear();
            positions.putAll(replacement);
            lastPositionSnapshotAt = snapshot.timestamp();
            log.debug("Position snapshot applied: positions={}, removed={}, source={}", positions.size(), removed, snapshot.source());
            return ApplyOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ApplyOutcome applyBalanceSnapshot(BalanceSnapshot snapshot) {
        lock.writeLock().lock();
        try {
            if (isOlder(snapshot.timestamp(), lastBalanceSnapshotAt)) {
                log.debug("Stale balance snapshot ignored: snapshotTs={}, lastTs={}", snapshot.timestamp(), lastBalanceSnapshotAt);
                return ApplyOutcome.STALE;
            }
            Map<String, Balance> replacement = new LinkedHashMap<>();
            for (Balance balance : snapshot.balances()) {
                replacement.put(balance.getAsset(), balance.toBuilder().build());
            }
            for (String asset : balances.keySet()) {
                if (!replacement.containsKey(asset)) {
                    log.info("Balance removed, asset absent from snapshot: asset={}", asset);
                }
            }
            balances.clear();
            balances.putAll(replacement);
            lastBalanceSnapshotAt = snapshot.timestamp();
            log.debug("Balance snapshot applied: assets={}, source={}", balances.size(), snapshot.source());
            return ApplyOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- Funding ----

    /**
     * Records a funding settlement.
     *
     * @return APPLIED for a new payment, IGNORED for the "no payment" sentinel,
     *     DUPLICATE if this (pair, timestamp) was already recorded, STALE if older than the last one
     */
    public ApplyOutcome applyFundingPayment(FundingPayment payment) {
        if (payment.isNone()) {
            log.debug("No new funding payment: pair={}", payment.tradingPair());
            return ApplyOutcome.IGNORED;
        }
        lock.writeLock().lock();
        try {
            FundingPayment last = lastFundingPayments.get(payment.tradingPair());
            if (last != null && last.timestamp() == payment.timestamp()) {
                return ApplyOutcome.DUPLICATE;
            }
            if (last != null && last.timestamp() > payment.timestamp()) {
                return ApplyOutcome.STALE;
            }
            lastFundingPayments.put(payment.tradingPair(), payment);
            log.info(
                    "Funding payment recorded: pair={}, timestamp={}, rate={}, payment={}",
                    payment.tradingPair(),
                    payment.timestamp(),
                    payment.fundingRate(),
                    payment.payment());
            return ApplyOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---- Read views ----

    public List<Position> getPositions() {
        lock.readLock().lock();
        try {
            return positions.values().stream().map(p -> p.toBuilder().build()).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** The open position on a pair. One-way mode holds at most one per pair. */
    public Optional<Position> getPosition(String tradingPair) {
        lock.readLock().lock();
        try {
            return positions.values().stream()
                    .filter(p -> p.getTradingPair().equals(tradingPair))
                    .findFirst()
                    .map(p -> p.toBuilder().build());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Balance> getBalances() {
        lock.readLock().lock();
        try {
            Map<String, Balance> copy = new LinkedHashMap<>();
            balances.forEach((asset, balance) -> copy.put(asset, balance.toBuilder().build()));
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Balance> getBalance(String asset) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(balances.get(asset)).map(b -> b.toBuilder().build());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Last recorded settlement for a pair, or the "no payment" sentinel. */
    public FundingPayment getLastFundingPayment(String tradingPair) {
        lock.readLock().lock();
        try {
            return lastFundingPayments.getOrDefault(tradingPair, FundingPayment.none(tradingPair));
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean isOlder(Instant candidate, Instant last) {
        return last != null && candidate != null && candidate.isBefore(last);
    }
}
