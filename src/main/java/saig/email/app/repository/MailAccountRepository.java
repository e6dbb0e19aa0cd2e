package saig.email.app.repository;

import saig.email.app.entity.MailAccount;
import saig.email.app.entity.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MailAccountRepository extends JpaRepository<MailAccount, String> {
    Optional<MailAccount> findByEmailAddress(String emailAddress);
    List<MailAccount> findBySyncStatusIn(Collection<SyncStatus> statuses);
}
