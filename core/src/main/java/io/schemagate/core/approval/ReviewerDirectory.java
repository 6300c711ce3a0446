package io.schemagate.core.approval;

import io.schemagate.core.model.ApprovalLevel;
import java.util.Objects;
import java.util.Set;

/**
 * Who may decide requests of each approval level. {@code reviewer} requests
 * need a member of the reviewer set; {@code admin} and {@code committee}
 * requests need a member of the admin set. Automatic requests need nobody.
 *
 * @param reviewers identities allowed to review {@code reviewer} requests
 * @param admins    identities allowed to review {@code admin} and {@code committee} requests
 */
public record ReviewerDirectory(Set<String> reviewers, Set<String> admins) {

    public static final Set<String> DEFAULT_REVIEWERS = Set.of("admin", "schema_reviewer", "lead_developer");
    public static final Set<String> DEFAULT_ADMINS = Set.of("admin", "system_admin");

    public ReviewerDirectory {
        reviewers = Set.copyOf(Objects.requireNonNull(reviewers, "reviewers must not be null"));
        admins = Set.copyOf(Objects.requireNonNull(admins, "admins must not be null"));
    }

    public static ReviewerDirectory defaults() {
        return new ReviewerDirectory(DEFAULT_REVIEWERS, DEFAULT_ADMINS);
    }

    public boolean canReview(String reviewer, ApprovalLevel level) {
        return switch (level) {
            case AUTOMATIC -> true;
            case REVIEWER -> reviewer != null && reviewers.contains(reviewer);
            case ADMIN, COMMITTEE -> reviewer != null && admins.contains(reviewer);
        };
    }
}
