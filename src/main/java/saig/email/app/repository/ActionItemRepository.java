package saig.email.app.repository;

import saig.email.app.entity.ActionItem;
import saig.email.app.entity.ActionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ActionItemRepository extends JpaRepository<ActionItem, String> {
    List<ActionItem> findByEmailId(String emailId);
    List<ActionItem> findByEmailIdAndStatusNot(String emailId, ActionStatus status);
    List<ActionItem> findByAccountId(String accountId);
    List<ActionItem> findByAccountIdAndStatus(String accountId, ActionStatus status);
}
