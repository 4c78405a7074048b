package com.skyfuse.weather.repository;

import com.skyfuse.weather.data.IpAccessLog;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IpAccessLogRepository extends JpaRepository<IpAccessLog, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from IpAccessLog l where l.ip = :ip")
    Optional<IpAccessLog> findByIpForUpdate(@Param("ip") String ip);
}
