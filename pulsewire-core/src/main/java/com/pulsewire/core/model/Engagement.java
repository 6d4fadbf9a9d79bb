package com.pulsewire.core.model;

/**
 * Platform engagement counters. A null component means the platform does not report it.
 */
public record Engagement(
    Long score,         // upvotes / points
    Long comments,
    Long likes,
    Long reposts,
    Long replies,
    Long quotes,
    Long views
) {
    /** Counters reported by discussion sites and news aggregators. */
    public static Engagement discussion(long score, long comments) {
        return new Engagement(score, comments, null, null, null, null, null);
    }

    /** Counters reported by social platforms. */
    public static Engagement social(long likes, long reposts, long replies, long quotes) {
        return new Engagement(null, null, likes, reposts, replies, quotes, null);
    }

    static long valueOf(Long counter) {
        return counter != null ? Math.max(0, counter) : 0;
    }

    public long scoreOrZero() { return valueOf(score); }
    public long commentsOrZero() { return valueOf(comments); }
    public long likesOrZero() { return valueOf(likes); }
    public long repostsOrZero() { return valueOf(reposts); }
    public long repliesOrZero() { return valueOf(replies); }
    public long quotesOrZero() { return valueOf(quotes); }
}
