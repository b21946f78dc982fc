package com.tracker.resolution.core.model;

/**
 * A project membership. Exactly one of {@code user} or {@code group} is set.
 *
 * @param id    membership ID
 * @param user  the member user, or null for group memberships
 * @param group the member group, or null for user memberships
 */
public record Membership(int id, Candidate user, Candidate group) {

    public static Membership ofUser(int id, Candidate user) {
        return new Membership(id, user, null);
    }

    public static Membership ofGroup(int id, Candidate group) {
        return new Membership(id, null, group);
    }

    public boolean isUser() {
        return user != null;
    }
}
