package com.bookkeeper.ingest.ai;

import java.util.List;
import java.util.Map;

public interface TransactionClassifier {

    boolean isEnabled();

    /**
     * Returns a category per request id. Ids missing from the result were not classified.
     *
     * @throws ClassifierException when the remote call or its response fails
     */
    Map<Integer, String> classify(List<ClassificationRequest> requests);
}
