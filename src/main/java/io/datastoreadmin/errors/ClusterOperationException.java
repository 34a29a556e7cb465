package io.datastoreadmin.errors;

/**
 * Exception thrown when a cluster-level operation references an unknown cluster.
 */
public class ClusterOperationException extends DatastoreAdminException {

    public ClusterOperationException(String message) {
        super(message);
    }
}
