package saig.email.app.repository;

import saig.email.app.entity.SyncCursor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SyncCursorRepository extends JpaRepository<SyncCursor, String> {
}
