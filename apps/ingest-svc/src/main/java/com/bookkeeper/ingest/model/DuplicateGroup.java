package com.bookkeeper.ingest.model;

import java.util.List;

/**
 * Pending review group: transactions sharing date and amount under one {@code DUP_nnnn} id.
 */
public record DuplicateGroup(String groupId, List<StoredTransaction> members) {

    public int size() {
        return members.size();
    }

    public boolean contains(long transactionId) {
        return members.stream().anyMatch(member -> member.id() == transactionId);
    }
}
