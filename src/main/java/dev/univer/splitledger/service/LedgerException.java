package dev.univer.splitledger.service;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class LedgerException extends RuntimeException {
    private final ErrorKind kind;

    /** {@code actual - expected} for {@link ErrorKind#INVALID_SPLIT} caused by a bad total, otherwise null. */
    private final BigDecimal discrepancy;

    public LedgerException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public LedgerException(ErrorKind kind, String message, BigDecimal discrepancy, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.discrepancy = discrepancy;
    }

    public static LedgerException invalidAmount(String message) {
        return new LedgerException(ErrorKind.INVALID_AMOUNT, message);
    }

    public static LedgerException invalidSplit(String message) {
        return new LedgerException(ErrorKind.INVALID_SPLIT, message);
    }

    public static LedgerException invalidSplit(String message, BigDecimal discrepancy) {
        return new LedgerException(ErrorKind.INVALID_SPLIT, message, discrepancy, null);
    }

    public static LedgerException notFound(String entity, String id) {
        return new LedgerException(ErrorKind.NOT_FOUND, entity + " not found: " + id);
    }

    public static LedgerException storageFailure(String operation, Throwable cause) {
        return new LedgerException(ErrorKind.STORAGE_FAILURE, "Storage failure during " + operation, null, cause);
    }
}
