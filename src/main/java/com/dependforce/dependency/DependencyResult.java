package com.dependforce.dependency;

import java.util.*;

/**
 * Outcome of the dependency analysis for one root object: the ordered records
 * (possibly empty) plus node-level failures, or the root-level error.
 */
public class DependencyResult {

    public enum Status {
        COMPLETED,
        /** Nothing was discovered; not an error */
        EMPTY,
        FAILED
    }

    private final ObjectIdentity root;
    private final Status status;
    private final List<DependencyRecord> records;
    private final List<DependencyException> nodeErrors;
    private final DependencyException error;

    private DependencyResult(ObjectIdentity root, Status status, List<DependencyRecord> records,
                             List<DependencyException> nodeErrors, DependencyException error) {
        this.root = root;
        this.status = status;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.nodeErrors = Collections.unmodifiableList(new ArrayList<>(nodeErrors));
        this.error = error;
    }

    public static DependencyResult completed(ObjectIdentity root, List<DependencyRecord> records,
                                             List<DependencyException> nodeErrors) {
        return new DependencyResult(root, Status.COMPLETED, records, nodeErrors, null);
    }

    public static DependencyResult empty(ObjectIdentity root) {
        return new DependencyResult(root, Status.EMPTY, Collections.emptyList(), Collections.emptyList(), null);
    }

    public static DependencyResult failed(ObjectIdentity root, DependencyException error) {
        return new DependencyResult(root, Status.FAILED, Collections.emptyList(), Collections.emptyList(), error);
    }

    public ObjectIdentity getRoot() { return root; }
    public Status getStatus() { return status; }
    public List<DependencyRecord> getRecords() { return records; }
    public List<DependencyException> getNodeErrors() { return nodeErrors; }
    public DependencyException getError() { return error; }

    public boolean isSuccess() {
        return status != Status.FAILED;
    }

    @Override
    public String toString() {
        String name = root != null ? root.getUrn() : "<none>";
        switch (status) {
            case EMPTY:
                return name + ": no dependencies found";
            case FAILED:
                return name + ": failed (" + error.getKind() + ") " + error.getMessage();
            default:
                return name + ": " + records.size() + " dependencies"
                    + (nodeErrors.isEmpty() ? "" : ", " + nodeErrors.size() + " unresolved");
        }
    }
}
