package saig.email.app.repository;

import saig.email.app.entity.Huddle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HuddleRepository extends JpaRepository<Huddle, String> {
    List<Huddle> findByAccountId(String accountId);
}
