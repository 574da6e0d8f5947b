package com.friendfeed.aggregate.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Outcome of processing one tracker entry. {@code data} and {@code rewrittenBody} are only present
 * when the entry's structured block parsed.
 */
public record EntryResult(
    long entryNumber,
    EntryStatus status,
    EntryFailure failure,
    List<Post> posts,
    String rewrittenBody,
    ObjectNode data,
    String feedUrl,
    String author,
    String avatar
) {
    public EntryResult {
        posts = posts == null ? List.of() : List.copyOf(posts);
        author = author == null ? "" : author;
        avatar = avatar == null ? "" : avatar;
    }

    public static EntryResult failed(long entryNumber, EntryFailure failure) {
        return new EntryResult(entryNumber, EntryStatus.ERROR, failure, List.of(), null, null, null, "", "");
    }

    public boolean isActive() {
        return status == EntryStatus.ACTIVE;
    }

    public boolean hasRewrittenBody() {
        return rewrittenBody != null;
    }
}
