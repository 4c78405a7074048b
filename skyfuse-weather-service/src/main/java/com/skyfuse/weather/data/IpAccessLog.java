package com.skyfuse.weather.data;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Access history of one client IP: when it last asked for weather and which cities.
 * Cities are stored oldest first so that recording an access only appends a row.
 */
@Entity
@Table(name = "request_ip_logs")
public class IpAccessLog {

    @Id
    @Column(name = "ip", length = 64)
    private String ip;

    @Column(name = "last_access_timestamp")
    private Long lastAccessTimestamp;

    @Version
    private Long version;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "request_ip_recent_cities", joinColumns = @JoinColumn(name = "ip"))
    @OrderColumn(name = "position")
    @Column(name = "city", nullable = false)
    private List<String> cities = new ArrayList<>();

    protected IpAccessLog() {
    }

    public IpAccessLog(String ip) {
        this.ip = ip;
    }

    public void recordAccess(long epochSeconds, String city) {
        this.lastAccessTimestamp = epochSeconds;
        this.cities.add(city);
    }

    public String getIp() {
        return ip;
    }

    public Long getLastAccessTimestamp() {
        return lastAccessTimestamp;
    }

    /**
     * @return requested cities, newest first
     */
    public List<String> getRecentCities() {
        List<String> newestFirst = new ArrayList<>(cities);
        Collections.reverse(newestFirst);
        return newestFirst;
    }
}
