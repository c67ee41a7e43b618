package com.flashtasks.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flashtasks.search.ingest.DocumentKind;
import com.flashtasks.search.ingest.ReconcileAction;
import com.flashtasks.search.ingest.ReconcileResult;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexResponse {
    private boolean ok;
    private ReconcileAction action;
    private String id;
    private String index;
    private DocumentKind kind;

    @JsonProperty("child_id")
    private String childId;

    private String error;

    @JsonProperty("request_id")
    private String requestId;

    public static IndexResponse of(ReconcileResult result, String requestId) {
        IndexResponse response = new IndexResponse();
        response.setOk(true);
        response.setAction(result.getAction());
        response.setId(result.getId());
        response.setIndex(result.getIndex());
        response.setKind(result.getKind());
        response.setChildId(result.getChildId());
        response.setRequestId(requestId);
        return response;
    }

    public static IndexResponse error(String code, String requestId) {
        IndexResponse response = new IndexResponse();
        response.setOk(false);
        response.setError(code);
        response.setRequestId(requestId);
        return response;
    }

    public boolean isOk() {
        return ok;
    }

    public void setOk(boolean ok) {
        this.ok = ok;
    }

    public ReconcileAction getAction() {
        return action;
    }

    public void setAction(ReconcileAction action) {
        this.action = action;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getIndex() {
        return index;
    }

    public void setIndex(String index) {
        this.index = index;
    }

    public DocumentKind getKind() {
        return kind;
    }

    public void setKind(DocumentKind kind) {
        this.kind = kind;
    }

    public String getChildId() {
        return childId;
    }

    public void setChildId(String childId) {
        this.childId = childId;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }
}
