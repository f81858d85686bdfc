package com.flagship.tenant_ledger.operation;

import com.flagship.tenant_ledger.config.LedgerProperties;
import com.flagship.tenant_ledger.exception.RateLimitExceededException;
import com.flagship.tenant_ledger.transactionlog.OperationType;
import com.flagship.tenant_ledger.transactionlog.TransactionLogService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Per-tenant cap on withdrawal requests per UTC day.
 *
 * Both paths count the same thing: withdrawals that reserved funds today.
 * Redis holds one counter per tenant and day with a TTL that outlives the day;
 * an attempt that is refused, or that never reserves funds, gives its slot back
 * through {@link Permit#release()}. When Redis is unreachable the count of
 * today's WITHDRAWAL log rows is used instead, and those rows are only written
 * together with a reservation.
 */
@Component
@Slf4j
public class WithdrawalRateLimiter {

    private static final String REDIS_KEY_PREFIX = "ratelimit:withdrawal:";
    private static final Duration KEY_GRACE = Duration.ofHours(1);

    private final Optional<StringRedisTemplate> redisTemplate;
    private final TransactionLogService transactionLogService;
    private final LedgerProperties properties;
    private final Clock clock;

    public WithdrawalRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                                 TransactionLogService transactionLogService,
                                 LedgerProperties properties) {
        this(redisTemplate, transactionLogService, properties, Clock.systemUTC());
    }

    WithdrawalRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                          TransactionLogService transactionLogService,
                          LedgerProperties properties,
                          Clock clock) {
        this.redisTemplate = redisTemplate;
        this.transactionLogService = transactionLogService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Counts one withdrawal attempt for the tenant.
     *
     * @return a permit the caller releases if the withdrawal does not reserve funds
     * @throws RateLimitExceededException if the tenant already used today's allowance
     */
    public Permit acquire(Long tenantId) {
        long limit = properties.getLimits().getDailyWithdrawalCount();
        LocalDate today = LocalDate.now(clock);

        if (redisTemplate.isPresent()) {
            try {
                String key = REDIS_KEY_PREFIX + tenantId + ":" + today;
                Long attempts = redisTemplate.get().opsForValue().increment(key);
                if (attempts != null && attempts == 1L) {
                    redisTemplate.get().expire(key, untilEndOfDay(today).plus(KEY_GRACE));
                }
                if (attempts != null) {
                    Permit permit = new Permit(tenantId, key);
                    if (attempts > limit) {
                        permit.release();
                        log.warn("Withdrawal rate limit hit: tenantId={}, attempts={}, limit={}",
                                tenantId, attempts, limit);
                        throw new RateLimitExceededException(tenantId, attempts, limit);
                    }
                    return permit;
                }
            } catch (RateLimitExceededException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Redis rate limit check failed for tenantId={}, falling back to database. Error: {}",
                        tenantId, e.getMessage());
            }
        }

        Instant startOfDay = today.atStartOfDay().toInstant(ZoneOffset.UTC);
        long attemptsToday = transactionLogService.countSince(tenantId, OperationType.WITHDRAWAL, startOfDay);
        if (attemptsToday >= limit) {
            log.warn("Withdrawal rate limit hit (database count): tenantId={}, attempts={}, limit={}",
                    tenantId, attemptsToday, limit);
            throw new RateLimitExceededException(tenantId, attemptsToday + 1, limit);
        }
        return new Permit(tenantId, null);
    }

    /**
     * One counted attempt. Releasing is idempotent and a no-op for attempts
     * counted from the database.
     */
    public final class Permit {

        private final Long tenantId;
        private final String redisKey;
        private boolean released;

        private Permit(Long tenantId, String redisKey) {
            this.tenantId = tenantId;
            this.redisKey = redisKey;
        }

        public void release() {
            if (released || redisKey == null) {
                return;
            }
            released = true;
            try {
                redisTemplate.ifPresent(redis -> redis.opsForValue().decrement(redisKey));
            } catch (Exception e) {
                log.warn("Could not give back rate limit slot for tenantId={}. Error: {}", tenantId, e.getMessage());
            }
        }
    }

    private Duration untilEndOfDay(LocalDate today) {
        Instant endOfDay = today.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC);
        return Duration.between(clock.instant(), endOfDay);
    }
}
