package dev.univer.splitledger.service;

public enum ErrorKind {
    /** A supplied amount is non-positive (or negative) where it must not be. */
    INVALID_AMOUNT,
    /** Shares do not add up, no members selected, or a member cannot take part in the split. */
    INVALID_SPLIT,
    /** A referenced group, member, expense or payment does not exist. */
    NOT_FOUND,
    /** The store rejected a read or write. */
    STORAGE_FAILURE
}
