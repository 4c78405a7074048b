package com.skyfuse.weather.service;

import com.skyfuse.weather.data.IpAccessLog;
import com.skyfuse.weather.exception.AccessLogException;
import com.skyfuse.weather.repository.IpAccessLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the per-IP audit trail of weather requests.
 * Storage failures surface as {@link AccessLogException}. Updates that collide with a concurrent
 * request from the same IP are retried up to {@link #MAX_ATTEMPTS} times.
 */
@Service
public class AccessLogService {

    private static final Logger log = LoggerFactory.getLogger(AccessLogService.class);

    static final int MAX_ATTEMPTS = 5;

    private final IpAccessLogRepository repo;
    private final AccessLogWriter writer;

    public AccessLogService(IpAccessLogRepository repo, AccessLogWriter writer) {
        this.repo = repo;
        this.writer = writer;
    }

    /**
     * @param lastAccessEpoch epoch seconds of the access just recorded
     * @param recentCities every city requested from the IP, newest (the current request) first
     */
    public record AccessRecord(long lastAccessEpoch, List<String> recentCities) {

        public AccessRecord {
            recentCities = List.copyOf(recentCities);
        }

        public List<String> previousCities() {
            return recentCities.isEmpty() ? List.of() : recentCities.subList(1, recentCities.size());
        }
    }

    @Transactional(readOnly = true)
    public Optional<Long> previousAccess(String ip) {
        try {
            return repo.findById(ip).map(IpAccessLog::getLastAccessTimestamp);
        } catch (DataAccessException e) {
            throw new AccessLogException("Error retrieving last access of " + ip, e);
        }
    }

    public AccessRecord recordAccess(String ip, long epochSeconds, String city) {
        for (int attempt = 1; ; attempt++) {
            try {
                AccessRecord record = writer.append(ip, epochSeconds, city);
                log.info("Access history updated for {}: {}", ip, record.recentCities());
                return record;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new AccessLogException("Access history update failed for " + ip
                            + " after " + attempt + " attempts", e);
                }
                log.debug("Concurrent access history update for {}, retrying ({}/{})", ip, attempt, MAX_ATTEMPTS);
            } catch (DataAccessException | TransactionException e) {
                throw new AccessLogException("Access history update failed for " + ip, e);
            }
        }
    }
}
