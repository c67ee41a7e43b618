package com.flashtasks.search.ingest;

public class ReconcileResult {
    private final ReconcileAction action;
    private final String id;
    private final String index;
    private final DocumentKind kind;
    private final String childId;

    /**
     * @param id      the identifier of the stored document that was written or deleted
     * @param childId for team and member events, the identifier of the embedded entry
     */
    public ReconcileResult(ReconcileAction action, String id, String index, DocumentKind kind, String childId) {
        this.action = action;
        this.id = id;
        this.index = index;
        this.kind = kind;
        this.childId = childId;
    }

    public static ReconcileResult of(ReconcileAction action, String id, String index, DocumentKind kind) {
        return new ReconcileResult(action, id, index, kind, null);
    }

    public ReconcileAction getAction() {
        return action;
    }

    public String getId() {
        return id;
    }

    public String getIndex() {
        return index;
    }

    public DocumentKind getKind() {
        return kind;
    }

    public String getChildId() {
        return childId;
    }
}
