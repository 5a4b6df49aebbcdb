package dev.univer.splitledger.service;

public interface IdGenerator {
    String newId();
}
