package saig.email.app.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import saig.email.app.entity.Email;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class EmailSpecifications {

    private static final char ESCAPE = '\\';

    private EmailSpecifications() {
    }

    public static Specification<Email> matching(String accountId, EmailFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("accountId"), accountId));
            predicates.add(filter.isInTrash() ? cb.isNotNull(root.get("deletedAt")) : cb.isNull(root.get("deletedAt")));

            if (hasText(filter.getQuery())) {
                String pattern = like(filter.getQuery());
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("subject")), pattern, ESCAPE),
                        cb.like(cb.lower(root.get("sender")), pattern, ESCAPE),
                        cb.like(cb.lower(root.get("body")), pattern, ESCAPE)));
            }
            if (hasText(filter.getSender())) {
                predicates.add(cb.like(cb.lower(root.get("sender")), like(filter.getSender()), ESCAPE));
            }
            if (hasText(filter.getSubjectContains())) {
                predicates.add(cb.like(cb.lower(root.get("subject")), like(filter.getSubjectContains()), ESCAPE));
            }
            if (hasText(filter.getLabel())) {
                Join<Email, String> labels = root.join("labels");
                predicates.add(cb.equal(labels, filter.getLabel()));
                query.distinct(true);
            }
            if (filter.getUnread() != null) {
                predicates.add(cb.equal(root.get("read"), !filter.getUnread()));
            }
            if (filter.getStarred() != null) {
                predicates.add(cb.equal(root.get("starred"), filter.getStarred()));
            }
            if (filter.getUrgent() != null) {
                predicates.add(cb.equal(root.get("urgent"), filter.getUrgent()));
            }
            if (filter.getReceivedAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("receivedAt"), filter.getReceivedAfter()));
            }
            if (filter.getReceivedBefore() != null) {
                predicates.add(cb.lessThan(root.get("receivedAt"), filter.getReceivedBefore()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }

    private static String like(String term) {
        String escaped = term.trim().toLowerCase(Locale.ROOT)
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
