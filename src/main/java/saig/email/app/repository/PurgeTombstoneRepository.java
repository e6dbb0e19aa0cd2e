package saig.email.app.repository;

import saig.email.app.entity.PurgeTombstone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PurgeTombstoneRepository extends JpaRepository<PurgeTombstone, String> {
    List<PurgeTombstone> findByAccountIdAndRemoteIdIn(String accountId, Collection<String> remoteIds);
    boolean existsByAccountIdAndRemoteId(String accountId, String remoteId);
}
