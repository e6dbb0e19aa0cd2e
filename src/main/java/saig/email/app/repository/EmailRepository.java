package saig.email.app.repository;

import saig.email.app.entity.Email;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailRepository extends JpaRepository<Email, String>, JpaSpecificationExecutor<Email> {
    Optional<Email> findByAccountIdAndRemoteId(String accountId, String remoteId);
    List<Email> findByAccountIdAndRemoteIdIn(String accountId, Collection<String> remoteIds);

    Page<Email> findByAccountIdAndDeletedAtIsNull(String accountId, Pageable pageable);
    Page<Email> findByAccountIdAndDeletedAtIsNotNull(String accountId, Pageable pageable);

    @Query("SELECT e.id FROM Email e WHERE e.accountId = :accountId AND e.deletedAt IS NOT NULL")
    List<String> findTrashedIds(@Param("accountId") String accountId);

    @Query("SELECT e.id FROM Email e WHERE e.deletedAt IS NOT NULL AND e.deletedAt < :cutoff")
    List<String> findIdsTrashedBefore(@Param("cutoff") Instant cutoff);

    @Query("SELECT e.id FROM Email e WHERE e.trashSyncPending = true AND e.deletedAt IS NOT NULL AND e.trashSyncFailedAt IS NULL")
    List<String> findIdsWithPendingRemoteTrash();

    long countByAccountIdAndDeletedAtIsNullAndReadFalse(String accountId);
}
