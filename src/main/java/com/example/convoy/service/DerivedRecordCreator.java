package com.example.convoy.service;

import java.util.Optional;

import com.example.convoy.models.ChangeEvent;

/**
 * Customized business logic turning one auction from the feed into the
 * record derived from it.
 */
@FunctionalInterface
public interface DerivedRecordCreator {

        /**
         * Creates the derived record for the auction. Must be safe to call
         * again for the same auction after a failure.
         *
         * @param auction auction delivered by the change feed
         * @return ID of the created record, empty when the auction needs none
         */
        Optional<String> create(ChangeEvent auction);
}
