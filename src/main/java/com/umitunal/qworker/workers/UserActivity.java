package com.umitunal.qworker.workers;

import java.time.Instant;
import java.util.Objects;

/**
 * Collapsed activity of one user, client and endpoint within a batch.
 */
public final class UserActivity {
    private final long userProfileId;
    private final String client;
    private final String query;
    private final int count;
    private final Instant lastVisit;

    public UserActivity(long userProfileId, String client, String query, int count, Instant lastVisit) {
        this.userProfileId = userProfileId;
        this.client = client;
        this.query = query;
        this.count = count;
        this.lastVisit = lastVisit;
    }

    public long getUserProfileId() { return userProfileId; }
    public String getClient() { return client; }
    public String getQuery() { return query; }
    public int getCount() { return count; }
    public Instant getLastVisit() { return lastVisit; }

    UserActivity merge(Instant visit) {
        Instant latest = visit.isAfter(lastVisit) ? visit : lastVisit;
        return new UserActivity(userProfileId, client, query, count + 1, latest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserActivity)) return false;
        UserActivity that = (UserActivity) o;
        return userProfileId == that.userProfileId && count == that.count
                && client.equals(that.client) && query.equals(that.query)
                && lastVisit.equals(that.lastVisit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userProfileId, client, query, count, lastVisit);
    }

    @Override
    public String toString() {
        return "UserActivity{user=" + userProfileId + ", client='" + client + "', query='" + query
                + "', count=" + count + ", lastVisit=" + lastVisit + '}';
    }
}
