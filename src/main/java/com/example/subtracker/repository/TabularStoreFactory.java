package com.example.subtracker.repository;

public interface TabularStoreFactory {

    /**
     * Binds to an existing store. No remote call is made until the store is read.
     */
    TabularStore open(String storeId);

    /**
     * Creates a new store and writes the schema's header row into it.
     */
    TabularStore provision(String title, LedgerSchema schema);
}
