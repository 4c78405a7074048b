package com.skyfuse.weather.service;

import com.skyfuse.weather.data.IpAccessLog;
import com.skyfuse.weather.repository.IpAccessLogRepository;
import com.skyfuse.weather.service.AccessLogService.AccessRecord;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends one access to an IP's history in its own transaction.
 * The existing row is locked for the update; a missing row is inserted, which fails with a
 * duplicate key if another request created it first.
 */
@Component
public class AccessLogWriter {

    private final IpAccessLogRepository repo;

    public AccessLogWriter(IpAccessLogRepository repo) {
        this.repo = repo;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AccessRecord append(String ip, long epochSeconds, String city) {
        IpAccessLog entry = repo.findByIpForUpdate(ip).orElseGet(() -> new IpAccessLog(ip));
        entry.recordAccess(epochSeconds, city);
        IpAccessLog saved = repo.saveAndFlush(entry);
        return new AccessRecord(saved.getLastAccessTimestamp(), saved.getRecentCities());
    }
}
