package com.sandy.aiot.warning.repository;

import com.sandy.aiot.warning.entity.Warning;
import com.sandy.aiot.warning.entity.WarningSeverity;
import com.sandy.aiot.warning.entity.WarningStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface WarningRepository extends JpaRepository<Warning, Long> {
    Optional<Warning> findByActiveSignature(String activeSignature);
    Optional<Warning> findFirstByDeviceIdAndWarningKindAndStatus(String deviceId, String warningKind, WarningStatus status);
    List<Warning> findByDeviceIdAndWarningKindOrderByCreatedAtAsc(String deviceId, String warningKind);
    List<Warning> findByStatusOrderByLastObservedAtDesc(WarningStatus status);
    List<Warning> findTop50ByOrderByCreatedAtDesc();
    List<Warning> findByDeviceIdOrderByCreatedAtDesc(String deviceId);
    long countByStatus(WarningStatus status);
    long countByStatusAndSeverity(WarningStatus status, WarningSeverity severity);

    @Query("select w.status from Warning w where w.id = :id")
    Optional<WarningStatus> findStatusById(@Param("id") Long id);

    @Query("select w.id from Warning w where w.status = :status and w.resolvedAt < :before")
    List<Long> findIdsByStatusAndResolvedAtBefore(@Param("status") WarningStatus status, @Param("before") LocalDateTime before);

    @Modifying
    @Query("delete from Warning w where w.id in :ids")
    int deleteByIdIn(@Param("ids") List<Long> ids);
}
