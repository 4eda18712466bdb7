package com.sandy.aiot.warning.repository;

import com.sandy.aiot.warning.entity.NotificationEntry;
import com.sandy.aiot.warning.entity.NotificationStatus;
import com.sandy.aiot.warning.vo.DueNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface NotificationEntryRepository extends JpaRepository<NotificationEntry, Long> {

    List<NotificationEntry> findByWarningIdOrderByLevelAsc(Long warningId);
    long countByStatus(NotificationStatus status);
    long countByStatusAndScheduledForBefore(NotificationStatus status, LocalDateTime before);

    @Query("select new com.sandy.aiot.warning.vo.DueNotification(n.id, n.warning.id, n.level) from NotificationEntry n " +
            "where n.status = com.sandy.aiot.warning.entity.NotificationStatus.SCHEDULED and n.scheduledFor <= :now " +
            "order by n.scheduledFor asc, n.level asc")
    List<DueNotification> findDue(@Param("now") LocalDateTime now);

    /** Atomic claim; returns 1 only for the caller that moved the entry out of SCHEDULED. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update NotificationEntry n set n.status = com.sandy.aiot.warning.entity.NotificationStatus.SENDING, n.claimedAt = :now " +
            "where n.id = :id and n.status = com.sandy.aiot.warning.entity.NotificationStatus.SCHEDULED")
    int claim(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update NotificationEntry n set n.status = com.sandy.aiot.warning.entity.NotificationStatus.SENT, n.sentAt = :now, n.finishedAt = :now " +
            "where n.id = :id and n.status = com.sandy.aiot.warning.entity.NotificationStatus.SENDING")
    int markSent(@Param("id") Long id, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update NotificationEntry n set n.status = com.sandy.aiot.warning.entity.NotificationStatus.FAILED, n.failureReason = :reason, n.finishedAt = :now " +
            "where n.id = :id and n.status = com.sandy.aiot.warning.entity.NotificationStatus.SENDING")
    int markFailed(@Param("id") Long id, @Param("reason") String reason, @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update NotificationEntry n set n.status = com.sandy.aiot.warning.entity.NotificationStatus.FAILED, n.failureReason = :reason, n.finishedAt = :now " +
            "where n.status = com.sandy.aiot.warning.entity.NotificationStatus.SENDING and n.claimedAt < :before")
    int failStaleClaims(@Param("before") LocalDateTime before, @Param("reason") String reason, @Param("now") LocalDateTime now);

    @Modifying
    @Query("delete from NotificationEntry n where n.warning.id in :warningIds")
    int deleteByWarningIdIn(@Param("warningIds") List<Long> warningIds);

    @Transactional
    @Modifying
    @Query("delete from NotificationEntry n where n.status in :statuses and n.finishedAt < :before")
    int deleteFinishedBefore(@Param("statuses") Collection<NotificationStatus> statuses, @Param("before") LocalDateTime before);
}
